package com.raditha.usage.policy;

import com.raditha.usage.model.DeclarationSite;
import com.raditha.usage.model.DeclarationTrait;

import java.util.List;

/**
 * Exemptions for local variables: discarded names, try-with-resources variables (closing
 * the resource is their use) and annotated locals such as {@code @SuppressWarnings}.
 */
public class LocalVariableExemptionPolicy extends RuleChainPolicy {

    public LocalVariableExemptionPolicy() {
        this(DiscardedNames.defaults());
    }

    public LocalVariableExemptionPolicy(DiscardedNames discardedNames) {
        super(List.of(
                ExemptionRule.of("discarded name", site -> discardedNames.matches(site.name())),
                ExemptionRule.of("try resource", site -> site.has(DeclarationTrait.TRY_RESOURCE)),
                ExemptionRule.of("annotated", DeclarationSite::isAnnotated)));
    }
}
