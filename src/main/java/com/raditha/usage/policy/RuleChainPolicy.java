package com.raditha.usage.policy;

import com.raditha.usage.model.DeclarationSite;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Evaluates exemption rules in order, cheapest first, and stops at the first rule that
 * exempts the declaration.
 */
public class RuleChainPolicy implements ExemptionPolicy {

    private final List<ExemptionRule> rules;

    public RuleChainPolicy(List<ExemptionRule> rules) {
        this.rules = List.copyOf(rules);
    }

    @Override
    public Optional<String> exemptionReason(DeclarationSite site) {
        for (ExemptionRule rule : rules) {
            if (rule.test(site)) {
                return Optional.of(rule.name());
            }
        }
        return Optional.empty();
    }

    /**
     * A new chain with the extra rule appended after the existing ones.
     */
    public RuleChainPolicy with(ExemptionRule rule) {
        List<ExemptionRule> extended = new ArrayList<>(rules);
        extended.add(rule);
        return new RuleChainPolicy(extended);
    }

    public List<ExemptionRule> getRules() {
        return rules;
    }
}
