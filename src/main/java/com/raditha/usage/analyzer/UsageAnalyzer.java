package com.raditha.usage.analyzer;

import com.github.javaparser.JavaParser;
import com.github.javaparser.ast.CompilationUnit;
import com.raditha.usage.config.UsageConfig;
import com.raditha.usage.extraction.SourceUnitIndex;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Main orchestrator for usage analysis.
 * Runs the whole-program field analysis and the per-callable parameter and local
 * variable analysis over the same set of compilation units and merges their findings.
 */
public class UsageAnalyzer {

    private static final Logger logger = LoggerFactory.getLogger(UsageAnalyzer.class);

    private final UsageConfig config;

    /**
     * Create analyzer with default configuration.
     */
    public UsageAnalyzer() {
        this(UsageConfig.standard());
    }

    /**
     * Create analyzer with custom configuration.
     */
    public UsageAnalyzer(UsageConfig config) {
        this.config = config;
    }

    /**
     * Analyze every Java file under a project directory.
     *
     * @param basePath project root; unit ids are paths relative to it
     * @throws IOException if the sources cannot be read
     */
    public UsageReport analyzeProject(Path basePath) throws IOException {
        SourceUnitIndex index = new SourceUnitIndex(basePath);
        Map<String, CompilationUnit> units = new ProjectSources(config).load(basePath, index);
        return analyze(units, index);
    }

    /**
     * Analyze source text. The symbol solver sees the JDK and the given sources only.
     *
     * @param sources source code keyed by unit id
     */
    public UsageReport analyzeSources(Map<String, String> sources) {
        JavaParser parser = ProjectSources.createParser(List.of());
        Map<String, CompilationUnit> units = new TreeMap<>();
        for (Map.Entry<String, String> source : sources.entrySet()) {
            units.put(source.getKey(), ProjectSources.parse(parser, source.getKey(), source.getValue()));
        }
        return analyze(units);
    }

    /**
     * Analyze already parsed compilation units.
     *
     * @param units compilation units keyed by unit id
     */
    public UsageReport analyze(Map<String, CompilationUnit> units) {
        SourceUnitIndex index = new SourceUnitIndex();
        units.forEach((id, cu) -> index.register(id, cu));
        return analyze(units, index);
    }

    UsageReport analyze(Map<String, CompilationUnit> units, SourceUnitIndex index) {
        AnalysisContext context = new AnalysisContext(config, index);
        ExecutorService executor = Executors.newFixedThreadPool(config.parallelism());
        SweepResult fields;
        SweepResult callables;
        try {
            UnitTaskRunner runner = new UnitTaskRunner(executor);
            fields = new FieldUsageAnalyzer(context, runner).analyze(units);
            callables = new CallableUsageAnalyzer(context, runner).analyze(units);
        } finally {
            executor.shutdownNow();
        }

        SweepResult total = fields.plus(callables);
        List<Finding> findings = new ArrayList<>(total.findings());
        findings.sort(Finding.REPORT_ORDER);

        UsageReport report = new UsageReport(findings, units.size(), total.trackedDeclarations(),
                total.diagnostics(), config);
        logger.info(report.getSummary());
        return report;
    }
}
