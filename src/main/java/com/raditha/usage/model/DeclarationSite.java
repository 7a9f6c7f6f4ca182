package com.raditha.usage.model;

import org.jspecify.annotations.Nullable;

import java.util.Objects;
import java.util.Set;

/**
 * A declaration as discovered by the front-end, before it is registered with a tracker.
 *
 * @param key          binding identity
 * @param name         declared identifier
 * @param kind         declaration kind
 * @param location     primary source span
 * @param siblingGroup multi-declarator membership, or null for a lone declarator
 * @param traits       facts consulted by the exemption policies
 * @param annotations  simple names of the annotations on the declaration
 */
public record DeclarationSite(
        BindingKey key,
        String name,
        DeclarationKind kind,
        SourceLocation location,
        @Nullable SiblingGroup siblingGroup,
        Set<DeclarationTrait> traits,
        Set<String> annotations) {

    public DeclarationSite {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(location, "location");
        traits = traits == null ? Set.of() : Set.copyOf(traits);
        annotations = annotations == null ? Set.of() : Set.copyOf(annotations);
    }

    public boolean has(DeclarationTrait trait) {
        return traits.contains(trait);
    }

    public boolean isAnnotated() {
        return !annotations.isEmpty();
    }

    public boolean hasAnnotation(String simpleName) {
        return annotations.contains(simpleName);
    }

    /**
     * Convenience factory for sites without a sibling group.
     */
    public static DeclarationSite of(BindingKey key, String name, DeclarationKind kind,
                                     SourceLocation location, Set<DeclarationTrait> traits) {
        return new DeclarationSite(key, name, kind, location, null, traits, Set.of());
    }
}
