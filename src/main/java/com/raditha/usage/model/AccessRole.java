package com.raditha.usage.model;

/**
 * Semantic role an occurrence plays for the declaration it refers to.
 */
public enum AccessRole {
    READ,
    WRITE_ONLY,
    /**
     * Reads the old value only to compute the new one, as in {@code x += 1} or {@code x++}.
     * Counts as a write; the internal read is not a use of the value.
     */
    READ_WRITE;

    public boolean countsAsRead() {
        return this == READ;
    }

    public boolean countsAsWrite() {
        return this != READ;
    }
}
