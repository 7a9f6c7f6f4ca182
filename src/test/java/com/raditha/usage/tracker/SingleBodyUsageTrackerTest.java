package com.raditha.usage.tracker;

import com.raditha.usage.model.AccessContext;
import com.raditha.usage.model.Declaration;
import com.raditha.usage.model.DeclarationId;
import com.raditha.usage.model.DeclarationKind;
import com.raditha.usage.model.DeclarationSite;
import com.raditha.usage.model.TestSites;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SingleBodyUsageTrackerTest {

    @Test
    void testUnusedParameterIsReported() {
        // void M(int a, int b) { Use(a); }
        SingleBodyUsageTracker tracker = new SingleBodyUsageTracker("M(int,int)");
        DeclarationId a = tracker.declare(TestSites.parameter("M.java", "a", 1));
        tracker.declare(TestSites.parameter("M.java", "b", 1));

        tracker.recordAccess(a, AccessContext.OTHER);

        List<Declaration> unused = tracker.sweep();
        assertEquals(1, unused.size());
        assertEquals("b", unused.get(0).name());
        assertEquals(DeclarationKind.PARAMETER, unused.get(0).kind());
    }

    @Test
    void testOutputBindingOnlyParameterIsReported() {
        // void M(out int x) { x = 0; Foo(out x); }
        SingleBodyUsageTracker tracker = new SingleBodyUsageTracker("M(out int)");
        DeclarationId x = tracker.declare(TestSites.parameter("M.java", "x", 1));

        tracker.recordAccess(x, AccessContext.ASSIGNMENT_TARGET_SIMPLE);
        tracker.recordAccess(x, AccessContext.OUTPUT_BINDING);

        List<Declaration> unused = tracker.sweep();
        assertEquals(1, unused.size(), "Output bindings are writes, not reads");
        assertTrue(tracker.usageOf(x).hasWrite());
    }

    @Test
    void testAccessToAnotherTrackersIdIsDropped() {
        DeclarationRegistry registry = new DeclarationRegistry();
        SingleBodyUsageTracker first = new SingleBodyUsageTracker(registry, "first()");
        SingleBodyUsageTracker second = new SingleBodyUsageTracker(registry, "second()");

        DeclarationId p = first.declare(TestSites.parameter("F.java", "p", 1));
        second.declare(TestSites.parameter("F.java", "q", 5));

        second.recordAccess(p, AccessContext.OTHER);

        assertEquals(1, second.diagnostics().snapshot().droppedOccurrences());
        assertEquals(List.of("p"), first.sweep().stream().map(Declaration::name).toList(),
                "A read recorded against another body must not reach this one");
    }

    @Test
    void testLookupOnlySeesOwnDeclarations() {
        DeclarationRegistry registry = new DeclarationRegistry();
        SingleBodyUsageTracker outer = new SingleBodyUsageTracker(registry, "outer()");
        SingleBodyUsageTracker lambda = new SingleBodyUsageTracker(registry, "lambda@L3:9");

        DeclarationSite local = TestSites.local("F.java", "tmp", 3);
        lambda.declare(local);

        assertTrue(outer.lookup(local.key()).isEmpty());
        assertTrue(lambda.lookup(local.key()).isPresent());
    }

    @Test
    void testWriteAfterReadKeepsDeclarationUsed() {
        SingleBodyUsageTracker tracker = new SingleBodyUsageTracker("m()");
        DeclarationId x = tracker.declare(TestSites.local("M.java", "x", 2));

        tracker.recordAccess(x, AccessContext.OTHER);
        tracker.recordAccess(x, AccessContext.ASSIGNMENT_TARGET_SIMPLE);

        assertTrue(tracker.sweep().isEmpty());
    }

    @Test
    void testSweepIsNotRepeatable() {
        SingleBodyUsageTracker tracker = new SingleBodyUsageTracker("m()");
        tracker.sweep();
        assertThrows(IllegalStateException.class, tracker::sweep);
    }
}
