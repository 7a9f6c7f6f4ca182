package com.raditha.usage.tracker;

import com.raditha.usage.model.BindingKey;
import com.raditha.usage.model.DeclarationId;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Hands out integer identities for bindings, once per binding, at first sight.
 * <p>
 * One registry is shared by every tracker of an analysis run, so an id is unique within
 * the run and a tracker can tell its own ids from those of another tracker.
 */
public class DeclarationRegistry {

    private final Map<BindingKey, DeclarationId> ids = new ConcurrentHashMap<>();
    private final AtomicInteger next = new AtomicInteger();

    /**
     * Return the id of the binding, assigning a fresh one if the binding was never seen.
     */
    public DeclarationId idFor(BindingKey key) {
        return ids.computeIfAbsent(key, k -> new DeclarationId(next.getAndIncrement()));
    }

    public Optional<DeclarationId> find(BindingKey key) {
        return Optional.ofNullable(ids.get(key));
    }

    /**
     * True if the id was handed out by this registry.
     */
    public boolean isIssued(DeclarationId id) {
        return id != null && id.value() >= 0 && id.value() < next.get();
    }

    public int size() {
        return ids.size();
    }
}
