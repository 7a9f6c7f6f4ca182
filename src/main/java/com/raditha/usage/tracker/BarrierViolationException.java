package com.raditha.usage.tracker;

import java.util.Collection;

/**
 * Thrown when a whole-program tracker is swept while producers are still feeding it.
 */
public class BarrierViolationException extends IllegalStateException {

    private final transient Collection<String> openUnits;

    public BarrierViolationException(Collection<String> openUnits) {
        super("Cannot sweep while " + openUnits.size() + " source unit(s) are still being processed: " + openUnits);
        this.openUnits = openUnits;
    }

    public Collection<String> getOpenUnits() {
        return openUnits;
    }
}
