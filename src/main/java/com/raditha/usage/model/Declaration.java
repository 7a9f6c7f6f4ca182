package com.raditha.usage.model;

import org.jspecify.annotations.Nullable;

import java.util.Comparator;
import java.util.Optional;

/**
 * A tracked declaration. Immutable; created once, when its binding is first registered.
 *
 * @param id           identity assigned by the registry
 * @param key          binding identity the id was assigned for
 * @param name         declared identifier
 * @param kind         declaration kind
 * @param location     primary source span, used for reporting and code-fix targeting
 * @param siblingGroup multi-declarator membership, or null
 */
public record Declaration(
        DeclarationId id,
        BindingKey key,
        String name,
        DeclarationKind kind,
        SourceLocation location,
        @Nullable SiblingGroup siblingGroup) {

    /**
     * Report order: source location, then name, then id.
     */
    public static final Comparator<Declaration> REPORT_ORDER = Comparator
            .comparing(Declaration::location)
            .thenComparing(Declaration::name)
            .thenComparing(Declaration::id);

    public static Declaration from(DeclarationId id, DeclarationSite site) {
        return new Declaration(id, site.key(), site.name(), site.kind(), site.location(), site.siblingGroup());
    }

    public DeclarationScope scope() {
        return kind.scope();
    }

    public Optional<SiblingGroup> sibling() {
        return Optional.ofNullable(siblingGroup);
    }
}
