package com.raditha.usage.model;

import java.util.Objects;

/**
 * Stable identity of a binding as seen by the front-end.
 * Every occurrence that resolves to the same binding produces an equal key, even when the
 * occurrence and the declaration live in different compilation units.
 *
 * @param value opaque key text
 */
public record BindingKey(String value) {

    public BindingKey {
        Objects.requireNonNull(value, "value");
    }

    /**
     * Key of a field, identified by the owning type and the field name.
     */
    public static BindingKey field(String ownerName, String fieldName) {
        return new BindingKey("field:" + ownerName + "#" + fieldName);
    }

    /**
     * Key of a parameter or local variable, identified by the position of its declarator.
     */
    public static BindingKey variable(String sourceUnit, Range range, String name) {
        return new BindingKey("var:" + sourceUnit + "@" + range.startLine() + ":" + range.startColumn() + "#" + name);
    }

    @Override
    public String toString() {
        return value;
    }
}
