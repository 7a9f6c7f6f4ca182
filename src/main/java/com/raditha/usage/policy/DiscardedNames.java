package com.raditha.usage.policy;

import java.util.List;
import java.util.Set;

/**
 * Recognises identifiers whose author declared them intentionally unused.
 *
 * @param prefixes prefixes that mark a discarded name, such as {@code _}
 * @param names    whole names that mark a discarded name, such as {@code ignored}
 */
public record DiscardedNames(List<String> prefixes, Set<String> names) {

    public DiscardedNames {
        prefixes = prefixes == null ? List.of() : List.copyOf(prefixes);
        names = names == null ? Set.of() : Set.copyOf(names);
    }

    public static DiscardedNames defaults() {
        return new DiscardedNames(List.of("_"), Set.of("ignored", "unused"));
    }

    public boolean matches(String name) {
        if (names.contains(name)) {
            return true;
        }
        for (String prefix : prefixes) {
            if (name.startsWith(prefix)) {
                return true;
            }
        }
        return false;
    }
}
