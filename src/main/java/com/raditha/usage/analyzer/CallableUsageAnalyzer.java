package com.raditha.usage.analyzer;

import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.ast.body.Parameter;
import com.github.javaparser.ast.body.VariableDeclarator;
import com.github.javaparser.ast.expr.NameExpr;
import com.raditha.usage.extraction.CallableCollector;
import com.raditha.usage.extraction.CallableUnit;
import com.raditha.usage.extraction.OccurrenceContexts;
import com.raditha.usage.model.AccessContext;
import com.raditha.usage.model.Declaration;
import com.raditha.usage.model.DeclarationId;
import com.raditha.usage.model.DeclarationSite;
import com.raditha.usage.tracker.SingleBodyUsageTracker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Finds unused parameters and local variables, one callable at a time.
 * <p>
 * Each callable gets its own tracker, which is swept as soon as the body has been walked.
 * A nested lambda or class is a callable of its own: its locals are reported only by its
 * own analysis, while captured outer variables count as read by the outer callable.
 */
class CallableUsageAnalyzer {

    private static final Logger logger = LoggerFactory.getLogger(CallableUsageAnalyzer.class);

    private final AnalysisContext context;
    private final UnitTaskRunner runner;

    CallableUsageAnalyzer(AnalysisContext context, UnitTaskRunner runner) {
        this.context = context;
        this.runner = runner;
    }

    SweepResult analyze(Map<String, CompilationUnit> units) {
        return SweepResult.combine(runner.runAll("callable bodies", units, (unitId, cu) -> analyzeUnit(cu)));
    }

    private SweepResult analyzeUnit(CompilationUnit cu) {
        List<SweepResult> results = new ArrayList<>();
        for (CallableUnit callable : context.callables().collect(cu)) {
            results.add(analyzeCallable(callable));
        }
        return SweepResult.combine(results);
    }

    SweepResult analyzeCallable(CallableUnit callable) {
        SingleBodyUsageTracker tracker = new SingleBodyUsageTracker(context.registry(), callable.displayName());

        for (Parameter parameter : callable.parameters()) {
            declareIfTracked(tracker, context.sites().forParameter(parameter, callable));
        }
        for (VariableDeclarator local : CallableCollector.ownedLocals(callable)) {
            declareIfTracked(tracker, context.sites().forLocal(local));
        }

        if (tracker.declaredCount() == 0) {
            tracker.sweep();
            return SweepResult.EMPTY;
        }

        if (callable.hasBody()) {
            for (NameExpr nameExpr : callable.body().findAll(NameExpr.class)) {
                context.scopes().resolve(nameExpr)
                        .flatMap(declaration -> context.keys().forVariable(declaration))
                        .flatMap(tracker::lookup)
                        .ifPresent(id -> record(tracker, id, nameExpr));
            }
        }

        List<Declaration> unused = tracker.sweep();
        if (!unused.isEmpty()) {
            logger.debug("{}: {} unused of {} tracked", callable.displayName(), unused.size(), tracker.declaredCount());
        }
        List<Finding> findings = unused.stream()
                .map(d -> Finding.of(d, tracker.usageOf(d.id())))
                .toList();
        return new SweepResult(findings, tracker.declaredCount(), tracker.diagnostics().snapshot());
    }

    private void declareIfTracked(SingleBodyUsageTracker tracker, DeclarationSite site) {
        Optional<String> exemption = context.policies().forKind(site.kind()).exemptionReason(site);
        if (exemption.isPresent()) {
            logger.trace("{} {} exempt: {}", site.kind().displayName(), site.name(), exemption.get());
            return;
        }
        tracker.declare(site);
    }

    private static void record(SingleBodyUsageTracker tracker, DeclarationId id, NameExpr occurrence) {
        for (AccessContext accessContext : OccurrenceContexts.contextsOf(occurrence)) {
            tracker.recordAccess(id, accessContext);
        }
    }
}
