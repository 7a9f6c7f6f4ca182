package com.raditha.usage.tracker;

import com.raditha.usage.model.AccessContext;
import com.raditha.usage.model.BindingKey;
import com.raditha.usage.model.Declaration;
import com.raditha.usage.model.DeclarationId;
import com.raditha.usage.model.DeclarationSite;

import java.util.List;
import java.util.Optional;

/**
 * Collects declarations and the accesses made to them, and sweeps out the ones that are
 * never read.
 */
public interface UsageTracker {

    /**
     * Register a declaration. Registering the same binding again returns the existing id.
     *
     * @param site the declaration to register
     * @return the id of the declaration
     */
    DeclarationId declare(DeclarationSite site);

    /**
     * Find the id of a declaration registered with this tracker.
     */
    Optional<DeclarationId> lookup(BindingKey key);

    /**
     * Classify an occurrence and merge its role into the usage record of the declaration.
     * Occurrences for ids this tracker never declared are dropped.
     *
     * @param id      the declaration the occurrence resolved to
     * @param context the syntactic context of the occurrence
     */
    void recordAccess(DeclarationId id, AccessContext context);

    /**
     * Compute the declarations that were never read, in report order.
     * May be called once, after all producers are done.
     */
    List<Declaration> sweep();

    TrackerDiagnostics diagnostics();
}
