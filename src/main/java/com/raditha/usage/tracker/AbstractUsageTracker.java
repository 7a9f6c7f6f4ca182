package com.raditha.usage.tracker;

import com.raditha.usage.classify.AccessClassifier;
import com.raditha.usage.model.AccessContext;
import com.raditha.usage.model.AccessRole;
import com.raditha.usage.model.BindingKey;
import com.raditha.usage.model.Declaration;
import com.raditha.usage.model.DeclarationId;
import com.raditha.usage.model.DeclarationSite;
import com.raditha.usage.model.UsageRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Shared state and sweep logic of the tracker strategies.
 * <p>
 * Both backing maps are keyed by declaration id. Registration keeps the first writer,
 * usage records merge by boolean OR, so neither depends on call order.
 */
public abstract class AbstractUsageTracker implements UsageTracker {

    private static final Logger logger = LoggerFactory.getLogger(AbstractUsageTracker.class);

    protected final DeclarationRegistry registry;
    protected final Map<DeclarationId, Declaration> declared = new ConcurrentHashMap<>();
    protected final Map<DeclarationId, UsageRecord> used = new ConcurrentHashMap<>();
    protected final TrackerDiagnostics diagnostics = new TrackerDiagnostics();

    private volatile boolean swept;

    protected AbstractUsageTracker(DeclarationRegistry registry) {
        this.registry = registry;
    }

    @Override
    public DeclarationId declare(DeclarationSite site) {
        ensureNotSwept();
        DeclarationId id = registry.idFor(site.key());
        Declaration existing = declared.putIfAbsent(id, Declaration.from(id, site));
        if (existing != null) {
            if (existing.kind() != site.kind()) {
                diagnostics.conflictingDeclared();
                logger.debug("Ignoring {} '{}' at {}: binding already declared as {}",
                        site.kind(), site.name(), site.location(), existing.kind());
            } else {
                diagnostics.duplicateDeclared();
            }
        }
        return id;
    }

    @Override
    public Optional<DeclarationId> lookup(BindingKey key) {
        return registry.find(key).filter(declared::containsKey);
    }

    @Override
    public void recordAccess(DeclarationId id, AccessContext context) {
        ensureNotSwept();
        if (!accepts(id)) {
            diagnostics.occurrenceDropped();
            logger.debug("Dropping occurrence for unknown declaration {}", id);
            return;
        }
        AccessRole role = AccessClassifier.classify(context);
        used.merge(id, UsageRecord.of(role), UsageRecord::merge);
    }

    @Override
    public List<Declaration> sweep() {
        beginSweep();
        return declared.values().stream()
                .filter(d -> usageOf(d.id()).isUnused())
                .sorted(Declaration.REPORT_ORDER)
                .toList();
    }

    /**
     * The usage record of a declaration, {@link UsageRecord#NONE} if it was never accessed.
     */
    public UsageRecord usageOf(DeclarationId id) {
        return used.getOrDefault(id, UsageRecord.NONE);
    }

    public int declaredCount() {
        return declared.size();
    }

    @Override
    public TrackerDiagnostics diagnostics() {
        return diagnostics;
    }

    public boolean isSwept() {
        return swept;
    }

    /**
     * Whether an occurrence for the id may be merged into the usage map.
     */
    protected abstract boolean accepts(DeclarationId id);

    /**
     * Verify that the tracker may be swept and mark it swept.
     *
     * @throws IllegalStateException if the tracker was already swept
     */
    protected void beginSweep() {
        if (swept) {
            throw new IllegalStateException("Tracker has already been swept");
        }
        swept = true;
    }

    protected void ensureNotSwept() {
        if (swept) {
            throw new IllegalStateException("Tracker has already been swept; late events would be lost");
        }
    }
}
