package com.raditha.usage.analyzer;

import com.github.javaparser.ast.CompilationUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.function.BiFunction;

/**
 * Runs one task per compilation unit on the run's executor and waits for all of them.
 * Results come back in the order of the unit map. The first failed unit aborts the run.
 */
class UnitTaskRunner {

    private static final Logger logger = LoggerFactory.getLogger(UnitTaskRunner.class);

    private final ExecutorService executor;

    UnitTaskRunner(ExecutorService executor) {
        this.executor = executor;
    }

    <T> List<T> runAll(String phase, Map<String, CompilationUnit> units, BiFunction<String, CompilationUnit, T> task) {
        List<String> ids = new ArrayList<>(units.keySet());
        List<Callable<T>> tasks = new ArrayList<>(ids.size());
        for (String id : ids) {
            CompilationUnit cu = units.get(id);
            tasks.add(() -> task.apply(id, cu));
        }

        List<Future<T>> futures;
        try {
            futures = executor.invokeAll(tasks);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new UsageAnalysisException("Interrupted during " + phase, e);
        }

        List<T> results = new ArrayList<>(futures.size());
        for (int i = 0; i < futures.size(); i++) {
            try {
                results.add(futures.get(i).get());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new UsageAnalysisException("Interrupted during " + phase, e);
            } catch (ExecutionException e) {
                Throwable cause = e.getCause() != null ? e.getCause() : e;
                if (cause instanceof UsageAnalysisException analysisException) {
                    throw analysisException;
                }
                throw new UsageAnalysisException("Failed to analyze " + ids.get(i) + " during " + phase
                        + ": " + cause.getMessage(), cause);
            }
        }
        logger.debug("Finished {} for {} units", phase, results.size());
        return results;
    }
}
