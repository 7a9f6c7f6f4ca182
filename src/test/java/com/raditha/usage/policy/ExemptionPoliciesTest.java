package com.raditha.usage.policy;

import com.raditha.usage.config.UsageConfig;
import com.raditha.usage.model.DeclarationKind;
import com.raditha.usage.model.TestSites;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class ExemptionPoliciesTest {

    @ParameterizedTest
    @EnumSource(DeclarationKind.class)
    void testEveryKindHasAPolicy(DeclarationKind kind) {
        assertNotNull(new ExemptionPolicies(UsageConfig.standard()).forKind(kind));
    }

    @Test
    void testParameterKindsShareOnePolicy() {
        ExemptionPolicies policies = new ExemptionPolicies(UsageConfig.standard());
        assertSame(policies.forKind(DeclarationKind.PARAMETER), policies.forKind(DeclarationKind.LAMBDA_PARAMETER));
        assertSame(policies.forKind(DeclarationKind.PARAMETER), policies.forKind(DeclarationKind.LOCAL_FUNCTION_PARAMETER));
        assertInstanceOf(FieldExemptionPolicy.class, policies.forKind(DeclarationKind.FIELD));
    }

    @Test
    void testLenientPresetExemptsLocalsAndLambdas() {
        ExemptionPolicies policies = new ExemptionPolicies(UsageConfig.lenient());

        assertEquals(Optional.of("local variables disabled"),
                policies.forKind(DeclarationKind.LOCAL_VARIABLE).exemptionReason(TestSites.local("M.java", "x", 2)));
        assertFalse(policies.shouldTrack(TestSites.variable("M.java", "e", 2, DeclarationKind.LAMBDA_PARAMETER)));
        assertTrue(policies.shouldTrack(TestSites.parameter("M.java", "p", 2)));
    }

    @Test
    void testStrictPresetIgnoresFrameworkAnnotations() {
        ExemptionPolicies policies = new ExemptionPolicies(UsageConfig.strict());
        assertTrue(policies.shouldTrack(TestSites.withAnnotations(TestSites.privateField("C", "svc", 2), "Autowired")));
    }
}
