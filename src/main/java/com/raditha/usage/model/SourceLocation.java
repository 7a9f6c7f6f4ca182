package com.raditha.usage.model;

import java.util.Comparator;
import java.util.Objects;

/**
 * Primary source span of a declaration: the compilation unit it lives in and its range.
 *
 * @param sourceUnit identifier of the compilation unit (a path relative to the analyzed base path)
 * @param range      position of the declared name inside the unit
 */
public record SourceLocation(String sourceUnit, Range range) implements Comparable<SourceLocation> {

    private static final Comparator<SourceLocation> ORDER = Comparator
            .comparing(SourceLocation::sourceUnit)
            .thenComparing(SourceLocation::range);

    public SourceLocation {
        Objects.requireNonNull(sourceUnit, "sourceUnit");
        Objects.requireNonNull(range, "range");
    }

    @Override
    public int compareTo(SourceLocation other) {
        return ORDER.compare(this, other);
    }

    @Override
    public String toString() {
        return sourceUnit + ":" + range.startLine() + ":" + range.startColumn();
    }
}
