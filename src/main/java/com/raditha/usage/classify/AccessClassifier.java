package com.raditha.usage.classify;

import com.raditha.usage.model.AccessContext;
import com.raditha.usage.model.AccessRole;

/**
 * Maps the syntactic context of an occurrence to the role it plays.
 * <p>
 * The rules are applied in priority order and the first match wins:
 * <ol>
 * <li>right operand of an assignment: {@link AccessRole#READ}</li>
 * <li>left operand of a simple assignment: {@link AccessRole#WRITE_ONLY}</li>
 * <li>left operand of a compound assignment: {@link AccessRole#READ_WRITE}</li>
 * <li>operand of an increment or decrement: {@link AccessRole#READ_WRITE}</li>
 * <li>output-only argument of a call: {@link AccessRole#WRITE_ONLY}</li>
 * <li>anything else: {@link AccessRole#READ}</li>
 * </ol>
 * Write targets form a small closed set, read shapes do not, so every shape that is not
 * known to be a pure write is a read. Unknown shapes can hide a dead write but can never
 * produce a false report.
 */
public final class AccessClassifier {

    private AccessClassifier() {
        /* this is only a utility class */
    }

    public static AccessRole classify(AccessContext context) {
        if (context == null) {
            return AccessRole.READ;
        }
        return switch (context) {
            case ASSIGNMENT_VALUE -> AccessRole.READ;
            case ASSIGNMENT_TARGET_SIMPLE -> AccessRole.WRITE_ONLY;
            case ASSIGNMENT_TARGET_COMPOUND, INCREMENT_DECREMENT -> AccessRole.READ_WRITE;
            case OUTPUT_BINDING -> AccessRole.WRITE_ONLY;
            default -> AccessRole.READ;
        };
    }
}
