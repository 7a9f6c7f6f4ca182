package com.raditha.usage.model;

/**
 * Content-independent identity of a declaration, assigned once at first sight by a
 * {@link com.raditha.usage.tracker.DeclarationRegistry}.
 *
 * @param value the integer handed out by the registry
 */
public record DeclarationId(int value) implements Comparable<DeclarationId> {

    @Override
    public int compareTo(DeclarationId other) {
        return Integer.compare(value, other.value);
    }

    @Override
    public String toString() {
        return "#" + value;
    }
}
