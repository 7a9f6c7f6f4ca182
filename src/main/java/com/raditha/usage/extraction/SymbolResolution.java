package com.raditha.usage.extraction;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;
import java.util.function.Supplier;

/**
 * Gate around the JavaParser symbol solver.
 * <p>
 * The solver caches are not safe for concurrent use, so all resolution attempts of a run
 * go through one instance and are serialised on it. A failed attempt is logged and reported
 * as an empty result; callers fall back to syntactic resolution.
 */
public class SymbolResolution {

    private static final Logger logger = LoggerFactory.getLogger(SymbolResolution.class);

    private final Object solverLock = new Object();

    public <T> Optional<T> attempt(String what, Supplier<T> resolution) {
        synchronized (solverLock) {
            try {
                return Optional.ofNullable(resolution.get());
            } catch (Exception e) {
                logger.debug("Symbol resolution failed for {}: {}", what, e.getMessage());
                return Optional.empty();
            }
        }
    }
}
