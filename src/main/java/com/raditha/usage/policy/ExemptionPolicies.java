package com.raditha.usage.policy;

import com.raditha.usage.config.UsageConfig;
import com.raditha.usage.model.DeclarationKind;
import com.raditha.usage.model.DeclarationSite;

import java.util.EnumMap;
import java.util.Map;

/**
 * Selects the exemption policy of each declaration kind once, from the configuration.
 */
public class ExemptionPolicies {

    private final Map<DeclarationKind, ExemptionPolicy> byKind = new EnumMap<>(DeclarationKind.class);

    public ExemptionPolicies(UsageConfig config) {
        ExemptionPolicy fields = new FieldExemptionPolicy(config.preservedFieldAnnotations());
        ExemptionPolicy parameters = new ParameterExemptionPolicy(config.discardedNames(),
                config.trackLambdaParameters());
        RuleChainPolicy locals = new LocalVariableExemptionPolicy(config.discardedNames());
        if (!config.trackLocalVariables()) {
            locals = locals.with(ExemptionRule.of("local variables disabled", site -> true));
        }

        byKind.put(DeclarationKind.FIELD, fields);
        byKind.put(DeclarationKind.PARAMETER, parameters);
        byKind.put(DeclarationKind.LOCAL_FUNCTION_PARAMETER, parameters);
        byKind.put(DeclarationKind.LAMBDA_PARAMETER, parameters);
        byKind.put(DeclarationKind.LOCAL_VARIABLE, locals);
    }

    public ExemptionPolicy forKind(DeclarationKind kind) {
        return byKind.get(kind);
    }

    public boolean shouldTrack(DeclarationSite site) {
        return forKind(site.kind()).shouldTrack(site);
    }
}
