package com.raditha.usage.analyzer;

import com.github.javaparser.JavaParser;
import com.github.javaparser.ParseResult;
import com.github.javaparser.ParserConfiguration;
import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.symbolsolver.JavaSymbolSolver;
import com.github.javaparser.symbolsolver.resolution.typesolvers.CombinedTypeSolver;
import com.github.javaparser.symbolsolver.resolution.typesolvers.JavaParserTypeSolver;
import com.github.javaparser.symbolsolver.resolution.typesolvers.ReflectionTypeSolver;
import com.raditha.usage.config.UsageConfig;
import com.raditha.usage.extraction.SourceUnitIndex;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.stream.Stream;

/**
 * Locates and parses the Java sources of a project.
 */
public class ProjectSources {

    private static final Logger logger = LoggerFactory.getLogger(ProjectSources.class);

    private static final List<String> CONVENTIONAL_ROOTS = List.of("src/main/java", "src/test/java");

    private final UsageConfig config;

    public ProjectSources(UsageConfig config) {
        this.config = config;
    }

    /**
     * Create a parser whose symbol solver sees the JDK and the given source roots.
     */
    public static JavaParser createParser(List<Path> sourceRoots) {
        CombinedTypeSolver typeSolver = new CombinedTypeSolver();
        typeSolver.add(new ReflectionTypeSolver());
        for (Path root : sourceRoots) {
            typeSolver.add(new JavaParserTypeSolver(root));
        }
        ParserConfiguration configuration = new ParserConfiguration()
                .setLanguageLevel(ParserConfiguration.LanguageLevel.JAVA_17)
                .setSymbolResolver(new JavaSymbolSolver(typeSolver));
        return new JavaParser(configuration);
    }

    /**
     * Source roots of a project: the Maven conventional roots that exist, or the base path itself.
     */
    static List<Path> sourceRoots(Path basePath) {
        List<Path> roots = new ArrayList<>();
        for (String conventional : CONVENTIONAL_ROOTS) {
            Path root = basePath.resolve(conventional);
            if (Files.isDirectory(root)) {
                roots.add(root);
            }
        }
        if (roots.isEmpty()) {
            roots.add(basePath);
        }
        return roots;
    }

    /**
     * Parse every non-excluded {@code .java} file under the base path and register it with the index.
     *
     * @return compilation units keyed and ordered by unit id
     * @throws IOException              if the directory cannot be walked or a file cannot be read
     * @throws UsageAnalysisException   if a file does not parse
     */
    public Map<String, CompilationUnit> load(Path basePath, SourceUnitIndex index) throws IOException {
        if (!Files.isDirectory(basePath)) {
            throw new IOException("Not a directory: " + basePath);
        }
        JavaParser parser = createParser(sourceRoots(basePath));

        List<Path> files;
        try (Stream<Path> paths = Files.walk(basePath)) {
            files = paths
                    .filter(Files::isRegularFile)
                    .filter(p -> p.toString().endsWith(".java"))
                    .filter(p -> !config.shouldExclude(index.idForPath(p)))
                    .toList();
        }

        Map<String, CompilationUnit> units = new TreeMap<>();
        for (Path file : files) {
            String unitId = index.idForPath(file);
            ParseResult<CompilationUnit> result = parser.parse(file);
            CompilationUnit cu = result.getResult()
                    .filter(c -> result.isSuccessful())
                    .orElseThrow(() -> new UsageAnalysisException("Failed to parse " + unitId + ": " + result.getProblems()));
            index.register(unitId, cu);
            units.put(unitId, cu);
        }
        logger.info("Parsed {} source files under {}", units.size(), basePath);
        return units;
    }

    /**
     * Parse source text with the given parser.
     *
     * @throws UsageAnalysisException if the text does not parse
     */
    public static CompilationUnit parse(JavaParser parser, String unitId, String code) {
        ParseResult<CompilationUnit> result = parser.parse(code);
        if (!result.isSuccessful() || result.getResult().isEmpty()) {
            throw new UsageAnalysisException("Failed to parse " + unitId + ": " + result.getProblems());
        }
        return result.getResult().get();
    }
}
