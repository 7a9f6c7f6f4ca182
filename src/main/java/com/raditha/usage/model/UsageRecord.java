package com.raditha.usage.model;

/**
 * Aggregated access history of one declaration, merged by boolean OR so that the order
 * in which occurrences arrive does not matter.
 *
 * @param hasRead  at least one occurrence read the value
 * @param hasWrite at least one occurrence wrote the value
 */
public record UsageRecord(boolean hasRead, boolean hasWrite) {

    public static final UsageRecord NONE = new UsageRecord(false, false);

    public static UsageRecord of(AccessRole role) {
        return new UsageRecord(role.countsAsRead(), role.countsAsWrite());
    }

    public UsageRecord merge(UsageRecord other) {
        if (other.hasRead == hasRead && other.hasWrite == hasWrite) {
            return this;
        }
        return new UsageRecord(hasRead || other.hasRead, hasWrite || other.hasWrite);
    }

    /**
     * A declaration is unused when nothing ever read it, regardless of writes.
     */
    public boolean isUnused() {
        return !hasRead;
    }
}
