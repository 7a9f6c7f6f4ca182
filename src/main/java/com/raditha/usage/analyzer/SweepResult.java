package com.raditha.usage.analyzer;

import com.raditha.usage.tracker.TrackerDiagnostics;

import java.util.ArrayList;
import java.util.List;

/**
 * Findings and counters of one or more swept trackers.
 *
 * @param findings           unused declarations
 * @param trackedDeclarations number of declarations registered with the trackers
 * @param diagnostics        accumulated tracker diagnostics
 */
record SweepResult(List<Finding> findings, int trackedDeclarations, TrackerDiagnostics.Snapshot diagnostics) {

    static final SweepResult EMPTY = new SweepResult(List.of(), 0, TrackerDiagnostics.Snapshot.EMPTY);

    SweepResult plus(SweepResult other) {
        List<Finding> all = new ArrayList<>(findings);
        all.addAll(other.findings);
        return new SweepResult(all, trackedDeclarations + other.trackedDeclarations, diagnostics.plus(other.diagnostics));
    }

    static SweepResult combine(List<SweepResult> results) {
        SweepResult total = EMPTY;
        for (SweepResult result : results) {
            total = total.plus(result);
        }
        return total;
    }
}
