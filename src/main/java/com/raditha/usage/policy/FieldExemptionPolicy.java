package com.raditha.usage.policy;

import com.raditha.usage.model.DeclarationTrait;

import java.util.List;
import java.util.Set;

/**
 * Exemptions for fields.
 * <ul>
 * <li>anything that is not private: it may be read from outside the analyzed code</li>
 * <li>fields with generated accessors: the accessor reads them</li>
 * <li>compile-time constants: they are inlined at their use sites</li>
 * <li>fields carrying a preserved annotation: a framework reads them</li>
 * </ul>
 */
public class FieldExemptionPolicy extends RuleChainPolicy {

    public static final Set<String> DEFAULT_PRESERVED_ANNOTATIONS = Set.of(
            "Autowired", "Inject", "Value", "Mock", "Spy", "InjectMocks", "Captor",
            "Column", "Id", "JsonProperty");

    public FieldExemptionPolicy() {
        this(DEFAULT_PRESERVED_ANNOTATIONS);
    }

    public FieldExemptionPolicy(Set<String> preservedAnnotations) {
        super(List.of(
                ExemptionRule.of("not private", site -> !site.has(DeclarationTrait.PRIVATE)),
                ExemptionRule.of("synthesized accessor", site -> site.has(DeclarationTrait.SYNTHESIZED_ACCESS)),
                ExemptionRule.of("compile-time constant", site -> site.has(DeclarationTrait.COMPILE_TIME_CONSTANT)),
                ExemptionRule.of("preserved annotation",
                        site -> site.annotations().stream().anyMatch(preservedAnnotations::contains))));
    }
}
