package com.raditha.usage.extraction;

import com.raditha.usage.model.BindingKey;

import java.util.List;

/**
 * The fields an occurrence may refer to.
 *
 * @param candidates keys of the candidate fields
 * @param exact      true when the occurrence was bound to a single field; an inexact
 *                   occurrence is recorded as a plain read of every candidate
 */
public record FieldOccurrence(List<BindingKey> candidates, boolean exact) {

    private static final FieldOccurrence NONE = new FieldOccurrence(List.of(), true);

    public FieldOccurrence {
        candidates = List.copyOf(candidates);
    }

    public static FieldOccurrence none() {
        return NONE;
    }

    public static FieldOccurrence exact(BindingKey key) {
        return new FieldOccurrence(List.of(key), true);
    }

    public static FieldOccurrence ambiguous(List<BindingKey> candidates) {
        return new FieldOccurrence(candidates, false);
    }

    public boolean isEmpty() {
        return candidates.isEmpty();
    }
}
