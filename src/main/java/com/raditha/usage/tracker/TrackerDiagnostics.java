package com.raditha.usage.tracker;

import java.util.concurrent.atomic.LongAdder;

/**
 * Counters for input the trackers recovered from instead of reporting.
 */
public class TrackerDiagnostics {

    private final LongAdder droppedOccurrences = new LongAdder();
    private final LongAdder duplicateDeclarations = new LongAdder();
    private final LongAdder conflictingDeclarations = new LongAdder();

    void occurrenceDropped() {
        droppedOccurrences.increment();
    }

    void duplicateDeclared() {
        duplicateDeclarations.increment();
    }

    void conflictingDeclared() {
        conflictingDeclarations.increment();
    }

    public Snapshot snapshot() {
        return new Snapshot(
                droppedOccurrences.sum(),
                duplicateDeclarations.sum(),
                conflictingDeclarations.sum());
    }

    /**
     * Point-in-time view of the counters.
     *
     * @param droppedOccurrences      occurrences recorded against an id this tracker never declared
     * @param duplicateDeclarations   repeated registrations of an already declared binding
     * @param conflictingDeclarations repeated registrations that disagreed on the declaration kind
     */
    public record Snapshot(long droppedOccurrences, long duplicateDeclarations, long conflictingDeclarations) {

        public static final Snapshot EMPTY = new Snapshot(0, 0, 0);

        public Snapshot plus(Snapshot other) {
            return new Snapshot(
                    droppedOccurrences + other.droppedOccurrences,
                    duplicateDeclarations + other.duplicateDeclarations,
                    conflictingDeclarations + other.conflictingDeclarations);
        }

        public boolean isClean() {
            return droppedOccurrences == 0 && conflictingDeclarations == 0;
        }
    }
}
