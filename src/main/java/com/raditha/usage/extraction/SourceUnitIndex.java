package com.raditha.usage.extraction;

import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.ast.Node;

import java.nio.file.Path;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Names the compilation units of an analysis run.
 * <p>
 * Units registered explicitly are recognised by identity. Units parsed on the side by the
 * symbol solver are recognised by their storage path, relative to the base path, which is
 * also how registered units loaded from disk are named.
 */
public class SourceUnitIndex {

    static final String DETACHED = "<detached>";
    static final String IN_MEMORY = "<memory>";

    private final Path basePath;
    private final Map<CompilationUnit, String> ids = Collections.synchronizedMap(new IdentityHashMap<>());

    public SourceUnitIndex() {
        this(null);
    }

    /**
     * @param basePath directory unit ids are relative to, or null to use absolute paths
     */
    public SourceUnitIndex(Path basePath) {
        this.basePath = basePath == null ? null : basePath.toAbsolutePath().normalize();
    }

    public void register(String unitId, CompilationUnit cu) {
        ids.put(cu, unitId);
    }

    /**
     * Id of the compilation unit that contains the node.
     */
    public String idOf(Node node) {
        Optional<CompilationUnit> cu = node.findCompilationUnit();
        if (cu.isEmpty()) {
            return DETACHED;
        }
        String registered = ids.get(cu.get());
        if (registered != null) {
            return registered;
        }
        return cu.get().getStorage()
                .map(storage -> idForPath(storage.getPath()))
                .orElse(IN_MEMORY);
    }

    /**
     * The unit id a file on disk receives.
     */
    public String idForPath(Path path) {
        Path normalized = path.toAbsolutePath().normalize();
        Path relative = basePath != null && normalized.startsWith(basePath)
                ? basePath.relativize(normalized)
                : normalized;
        return relative.toString().replace('\\', '/');
    }

    public int size() {
        return ids.size();
    }
}
