package com.raditha.usage.policy;

import com.raditha.usage.model.DeclarationSite;

import java.util.Optional;

/**
 * Decides whether a declaration is eligible for usage tracking at all.
 * Policies look at declaration metadata only, never at occurrences.
 */
public interface ExemptionPolicy {

    /**
     * The reason the declaration is exempt, or empty if it should be tracked.
     */
    Optional<String> exemptionReason(DeclarationSite site);

    default boolean shouldTrack(DeclarationSite site) {
        return exemptionReason(site).isEmpty();
    }
}
