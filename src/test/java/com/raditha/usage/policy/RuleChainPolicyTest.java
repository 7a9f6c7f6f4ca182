package com.raditha.usage.policy;

import com.raditha.usage.model.DeclarationSite;
import com.raditha.usage.model.TestSites;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;
import java.util.function.Predicate;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class RuleChainPolicyTest {

    @Test
    @SuppressWarnings("unchecked")
    void testStopsAtFirstExemptingRule() {
        Predicate<DeclarationSite> cheap = mock(Predicate.class);
        Predicate<DeclarationSite> exempting = mock(Predicate.class);
        Predicate<DeclarationSite> expensive = mock(Predicate.class);
        when(cheap.test(any())).thenReturn(false);
        when(exempting.test(any())).thenReturn(true);

        RuleChainPolicy policy = new RuleChainPolicy(List.of(
                ExemptionRule.of("cheap", cheap),
                ExemptionRule.of("exempting", exempting),
                ExemptionRule.of("expensive", expensive)));

        DeclarationSite site = TestSites.local("M.java", "x", 1);
        assertEquals(Optional.of("exempting"), policy.exemptionReason(site));

        verify(cheap).test(site);
        verify(exempting).test(site);
        verifyNoInteractions(expensive);
    }

    @Test
    void testEmptyChainTracksEverything() {
        RuleChainPolicy policy = new RuleChainPolicy(List.of());
        assertTrue(policy.shouldTrack(TestSites.local("M.java", "x", 1)));
    }

    @Test
    void testWithAppendsWithoutChangingOriginal() {
        RuleChainPolicy original = new RuleChainPolicy(List.of(ExemptionRule.of("never", site -> false)));
        RuleChainPolicy extended = original.with(ExemptionRule.of("always", site -> true));

        DeclarationSite site = TestSites.local("M.java", "x", 1);
        assertTrue(original.shouldTrack(site));
        assertEquals(Optional.of("always"), extended.exemptionReason(site));
        assertEquals(1, original.getRules().size());
        assertEquals(2, extended.getRules().size());
    }
}
