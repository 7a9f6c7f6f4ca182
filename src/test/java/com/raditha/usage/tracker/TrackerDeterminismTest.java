package com.raditha.usage.tracker;

import com.raditha.usage.model.AccessContext;
import com.raditha.usage.model.Declaration;
import com.raditha.usage.model.DeclarationId;
import com.raditha.usage.model.DeclarationSite;
import com.raditha.usage.model.TestSites;
import net.jqwik.api.Arbitraries;
import net.jqwik.api.Arbitrary;
import net.jqwik.api.ForAll;
import net.jqwik.api.Property;
import net.jqwik.api.Provide;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Property-based tests: the sweep result depends only on the multiset of events.
 */
class TrackerDeterminismTest {

    private static final int FIELDS = 6;

    /**
     * An occurrence of one of the fields.
     */
    record Event(int field, AccessContext context) {
    }

    @Property(tries = 200)
    void sweepIsIndependentOfEventOrder(@ForAll("events") List<Event> events, @ForAll long seed) {
        List<Event> shuffled = new ArrayList<>(events);
        Collections.shuffle(shuffled, new Random(seed));

        assertEquals(sweepNames(events), sweepNames(shuffled));
    }

    @Property(tries = 200)
    void readsOnlyShrinkTheResult(@ForAll("events") List<Event> events, @ForAll("events") List<Event> more) {
        List<String> before = sweepNames(events);

        List<Event> extended = new ArrayList<>(events);
        extended.addAll(more);
        List<String> after = sweepNames(extended);

        assertTrue(before.containsAll(after), "Adding occurrences may never add a finding");
    }

    @Property(tries = 100)
    void writesAloneNeverMakeAFieldUsed(@ForAll("writeContexts") List<AccessContext> writes) {
        WholeProgramUsageTracker tracker = new WholeProgramUsageTracker();
        DeclarationId id = tracker.declare(TestSites.privateField("W", "w", 1));
        writes.forEach(context -> tracker.recordAccess(id, context));

        assertEquals(1, tracker.sweep().size());
    }

    @Property(tries = 100)
    void declaringTwiceChangesNothing(@ForAll("events") List<Event> events) {
        WholeProgramUsageTracker once = new WholeProgramUsageTracker();
        WholeProgramUsageTracker twice = new WholeProgramUsageTracker();
        List<DeclarationId> onceIds = declareAll(once);
        List<DeclarationId> twiceIds = declareAll(twice);
        declareAll(twice);

        events.forEach(e -> once.recordAccess(onceIds.get(e.field()), e.context()));
        events.forEach(e -> twice.recordAccess(twiceIds.get(e.field()), e.context()));

        assertEquals(names(once.sweep()), names(twice.sweep()));
    }

    @Provide
    Arbitrary<List<Event>> events() {
        Arbitrary<Integer> fields = Arbitraries.integers().between(0, FIELDS - 1);
        Arbitrary<AccessContext> contexts = Arbitraries.of(AccessContext.values());
        return fields.flatMap(f -> contexts.map(c -> new Event(f, c))).list().ofMaxSize(30);
    }

    @Provide
    Arbitrary<List<AccessContext>> writeContexts() {
        return Arbitraries.of(
                AccessContext.ASSIGNMENT_TARGET_SIMPLE,
                AccessContext.ASSIGNMENT_TARGET_COMPOUND,
                AccessContext.INCREMENT_DECREMENT,
                AccessContext.OUTPUT_BINDING).list().ofMinSize(1).ofMaxSize(10);
    }

    private static List<String> sweepNames(List<Event> events) {
        WholeProgramUsageTracker tracker = new WholeProgramUsageTracker();
        List<DeclarationId> ids = declareAll(tracker);
        for (Event event : events) {
            tracker.recordAccess(ids.get(event.field()), event.context());
        }
        return names(tracker.sweep());
    }

    private static List<DeclarationId> declareAll(WholeProgramUsageTracker tracker) {
        List<DeclarationId> ids = new ArrayList<>();
        for (int i = 0; i < FIELDS; i++) {
            DeclarationSite site = TestSites.privateField("P", "f" + i, i + 1);
            ids.add(tracker.declare(site));
        }
        return ids;
    }

    private static List<String> names(List<Declaration> declarations) {
        return declarations.stream().map(Declaration::name).toList();
    }
}
