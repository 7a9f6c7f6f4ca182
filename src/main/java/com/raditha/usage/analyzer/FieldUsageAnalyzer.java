package com.raditha.usage.analyzer;

import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.ast.body.FieldDeclaration;
import com.github.javaparser.ast.body.VariableDeclarator;
import com.github.javaparser.ast.expr.Expression;
import com.github.javaparser.ast.expr.FieldAccessExpr;
import com.github.javaparser.ast.expr.NameExpr;
import com.raditha.usage.extraction.FieldOccurrence;
import com.raditha.usage.extraction.OccurrenceContexts;
import com.raditha.usage.model.AccessContext;
import com.raditha.usage.model.BindingKey;
import com.raditha.usage.model.Declaration;
import com.raditha.usage.model.DeclarationId;
import com.raditha.usage.model.DeclarationSite;
import com.raditha.usage.tracker.WholeProgramUsageTracker;
import com.raditha.usage.tracker.WholeProgramUsageTracker.UnitFeed;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Stream;

/**
 * Finds private fields whose value is never read anywhere in the program.
 * <p>
 * Runs in two phases over all units: first every field is declared, then every
 * occurrence is recorded. Both phases process units concurrently; the tracker is swept
 * once the second phase has joined.
 */
class FieldUsageAnalyzer {

    private static final Logger logger = LoggerFactory.getLogger(FieldUsageAnalyzer.class);

    private final AnalysisContext context;
    private final UnitTaskRunner runner;

    FieldUsageAnalyzer(AnalysisContext context, UnitTaskRunner runner) {
        this.context = context;
        this.runner = runner;
    }

    SweepResult analyze(Map<String, CompilationUnit> units) {
        WholeProgramUsageTracker tracker = new WholeProgramUsageTracker(context.registry());
        Set<String> trackedNames = ConcurrentHashMap.newKeySet();

        runner.runAll("field declaration", units, (unitId, cu) -> {
            try (UnitFeed feed = tracker.openUnit(unitId)) {
                declareFields(feed, cu, trackedNames);
            }
            return null;
        });

        if (trackedNames.isEmpty()) {
            tracker.sweep();
            return new SweepResult(List.of(), 0, tracker.diagnostics().snapshot());
        }

        runner.runAll("field occurrences", units, (unitId, cu) -> {
            try (UnitFeed feed = tracker.openUnit(unitId)) {
                recordOccurrences(feed, cu, trackedNames);
            }
            return null;
        });

        List<Declaration> unused = tracker.sweep();
        logger.debug("{} of {} tracked fields are unused", unused.size(), tracker.declaredCount());
        List<Finding> findings = unused.stream()
                .map(d -> Finding.of(d, tracker.usageOf(d.id())))
                .toList();
        return new SweepResult(findings, tracker.declaredCount(), tracker.diagnostics().snapshot());
    }

    private void declareFields(UnitFeed feed, CompilationUnit cu, Set<String> trackedNames) {
        for (FieldDeclaration field : cu.findAll(FieldDeclaration.class)) {
            for (VariableDeclarator variable : field.getVariables()) {
                Optional<DeclarationSite> site = context.sites().forField(variable);
                if (site.isEmpty()) {
                    continue;
                }
                Optional<String> exemption = context.policies().forKind(site.get().kind()).exemptionReason(site.get());
                if (exemption.isPresent()) {
                    logger.trace("Field {} exempt: {}", site.get().name(), exemption.get());
                    continue;
                }
                feed.declare(site.get());
                trackedNames.add(site.get().name());
            }
        }
    }

    private void recordOccurrences(UnitFeed feed, CompilationUnit cu, Set<String> trackedNames) {
        Stream.concat(
                        cu.findAll(NameExpr.class).stream()
                                .filter(n -> trackedNames.contains(n.getNameAsString())),
                        cu.findAll(FieldAccessExpr.class).stream()
                                .filter(f -> trackedNames.contains(f.getNameAsString())))
                .forEach(occurrence -> record(feed, occurrence));
    }

    private void record(UnitFeed feed, Expression occurrence) {
        FieldOccurrence resolved = context.fields().resolve(occurrence);
        if (resolved.isEmpty()) {
            return;
        }
        List<AccessContext> contexts = resolved.exact()
                ? OccurrenceContexts.contextsOf(occurrence)
                : List.of(AccessContext.OTHER);
        for (BindingKey key : resolved.candidates()) {
            Optional<DeclarationId> id = feed.lookup(key);
            if (id.isPresent()) {
                for (AccessContext accessContext : contexts) {
                    feed.recordAccess(id.get(), accessContext);
                }
            }
        }
    }
}
