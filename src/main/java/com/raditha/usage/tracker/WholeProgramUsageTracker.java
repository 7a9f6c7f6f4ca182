package com.raditha.usage.tracker;

import com.raditha.usage.model.AccessContext;
import com.raditha.usage.model.BindingKey;
import com.raditha.usage.model.Declaration;
import com.raditha.usage.model.DeclarationId;
import com.raditha.usage.model.DeclarationSite;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Tracks declarations whose occurrences may appear anywhere in the program.
 * <p>
 * Source units are processed concurrently. Each producer brackets its work with
 * {@link #openUnit(String)} and closes the returned feed when the unit is done;
 * {@link #sweep()} refuses to run while any feed is open.
 * <p>
 * Occurrences are accepted for any id the run's registry has issued, so an occurrence
 * that races ahead of its declaration is not lost. Records that never meet a
 * declaration of this tracker are counted as dropped when the tracker is swept.
 */
public class WholeProgramUsageTracker extends AbstractUsageTracker {

    private static final Logger logger = LoggerFactory.getLogger(WholeProgramUsageTracker.class);

    private final Set<UnitFeed> openFeeds = ConcurrentHashMap.newKeySet();
    private final Object lifecycleLock = new Object();

    public WholeProgramUsageTracker(DeclarationRegistry registry) {
        super(registry);
    }

    public WholeProgramUsageTracker() {
        this(new DeclarationRegistry());
    }

    /**
     * Register a producer for a source unit.
     *
     * @param sourceUnitId the unit about to be processed
     * @return a feed that must be closed when the unit is fully processed
     */
    public UnitFeed openUnit(String sourceUnitId) {
        synchronized (lifecycleLock) {
            ensureNotSwept();
            UnitFeed feed = new UnitFeed(sourceUnitId);
            openFeeds.add(feed);
            return feed;
        }
    }

    public int openUnitCount() {
        return openFeeds.size();
    }

    @Override
    protected boolean accepts(DeclarationId id) {
        return registry.isIssued(id);
    }

    @Override
    protected void beginSweep() {
        synchronized (lifecycleLock) {
            if (!openFeeds.isEmpty()) {
                List<String> open = openFeeds.stream().map(UnitFeed::getSourceUnitId).sorted().toList();
                throw new BarrierViolationException(open);
            }
            super.beginSweep();
        }
    }

    @Override
    public List<Declaration> sweep() {
        List<Declaration> unused = super.sweep();
        used.keySet().stream()
                .filter(id -> !declared.containsKey(id))
                .forEach(id -> {
                    diagnostics.occurrenceDropped();
                    logger.debug("Occurrences recorded for {} never met a declaration", id);
                });
        logger.debug("Swept {} declarations, {} unused", declared.size(), unused.size());
        return unused;
    }

    /**
     * A producer's handle on the tracker for the duration of one source unit.
     */
    public final class UnitFeed implements AutoCloseable {

        private final String sourceUnitId;

        private UnitFeed(String sourceUnitId) {
            this.sourceUnitId = sourceUnitId;
        }

        public DeclarationId declare(DeclarationSite site) {
            return WholeProgramUsageTracker.this.declare(site);
        }

        public Optional<DeclarationId> lookup(BindingKey key) {
            return WholeProgramUsageTracker.this.lookup(key);
        }

        public void recordAccess(DeclarationId id, AccessContext context) {
            WholeProgramUsageTracker.this.recordAccess(id, context);
        }

        public String getSourceUnitId() {
            return sourceUnitId;
        }

        @Override
        public void close() {
            openFeeds.remove(this);
        }

        @Override
        public String toString() {
            return "UnitFeed[" + sourceUnitId + "]";
        }
    }
}
