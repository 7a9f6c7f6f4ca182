package com.raditha.usage.policy;

import com.raditha.usage.model.DeclarationKind;
import com.raditha.usage.model.DeclarationSite;
import com.raditha.usage.model.DeclarationTrait;

import java.util.ArrayList;
import java.util.List;

/**
 * Exemptions for parameters of methods, constructors, local class methods and lambdas.
 * <ul>
 * <li>signatures that must match an external contract: overrides, implementations and entry points</li>
 * <li>signatures with no body to analyze</li>
 * <li>names the author marked as discarded</li>
 * <li>annotated parameters, which an out-of-band mechanism may consume</li>
 * </ul>
 */
public class ParameterExemptionPolicy extends RuleChainPolicy {

    public ParameterExemptionPolicy() {
        this(DiscardedNames.defaults(), true);
    }

    /**
     * @param discardedNames        names that mark a parameter as intentionally unused
     * @param trackLambdaParameters false to exempt every lambda parameter
     */
    public ParameterExemptionPolicy(DiscardedNames discardedNames, boolean trackLambdaParameters) {
        super(rules(discardedNames, trackLambdaParameters));
    }

    private static List<ExemptionRule> rules(DiscardedNames discardedNames, boolean trackLambdaParameters) {
        List<ExemptionRule> rules = new ArrayList<>();
        if (!trackLambdaParameters) {
            rules.add(ExemptionRule.of("lambda parameters disabled",
                    site -> site.kind() == DeclarationKind.LAMBDA_PARAMETER));
        }
        rules.add(ExemptionRule.of("no body", site -> site.has(DeclarationTrait.NO_BODY)));
        rules.add(ExemptionRule.of("external contract",
                site -> site.has(DeclarationTrait.CONTRACT_BOUND) || site.has(DeclarationTrait.ENTRY_POINT)));
        rules.add(ExemptionRule.of("discarded name", site -> discardedNames.matches(site.name())));
        rules.add(ExemptionRule.of("annotated", DeclarationSite::isAnnotated));
        return rules;
    }
}
