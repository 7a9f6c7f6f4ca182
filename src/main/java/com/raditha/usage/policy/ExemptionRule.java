package com.raditha.usage.policy;

import com.raditha.usage.model.DeclarationSite;

import java.util.Objects;
import java.util.function.Predicate;

/**
 * One named link of an exemption chain.
 *
 * @param name    reason reported when the rule exempts a declaration
 * @param exempts predicate that is true for declarations the rule exempts
 */
public record ExemptionRule(String name, Predicate<DeclarationSite> exempts) {

    public ExemptionRule {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(exempts, "exempts");
    }

    public static ExemptionRule of(String name, Predicate<DeclarationSite> exempts) {
        return new ExemptionRule(name, exempts);
    }

    public boolean test(DeclarationSite site) {
        return exempts.test(site);
    }
}
