package com.raditha.usage.tracker;

import com.raditha.usage.model.DeclarationId;

/**
 * Tracks the parameters and local variables of one callable.
 * <p>
 * An instance is confined to the worker walking the callable body and is swept as soon
 * as the walk is over. Only ids declared in this instance are accepted, so an occurrence
 * recorded for another callable never touches this one.
 */
public class SingleBodyUsageTracker extends AbstractUsageTracker {

    private final String owner;

    /**
     * Create a tracker for a callable.
     *
     * @param registry the run-wide registry
     * @param owner    human readable name of the callable, used in log messages
     */
    public SingleBodyUsageTracker(DeclarationRegistry registry, String owner) {
        super(registry);
        this.owner = owner;
    }

    public SingleBodyUsageTracker(String owner) {
        this(new DeclarationRegistry(), owner);
    }

    @Override
    protected boolean accepts(DeclarationId id) {
        return id != null && declared.containsKey(id);
    }

    public String getOwner() {
        return owner;
    }

    @Override
    public String toString() {
        return "SingleBodyUsageTracker[" + owner + ", " + declaredCount() + " declarations]";
    }
}
