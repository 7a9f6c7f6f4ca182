package com.raditha.usage.analyzer;

import com.raditha.usage.model.DeclarationKind;

/**
 * The diagnostics reported by the analysis.
 */
public enum UsageRule {
    UNUSED_PRIVATE_FIELD("USW001", "Unused private field",
            "Private field '%s' is declared but never used",
            "Private field '%s' is assigned but its value is never read"),
    UNUSED_PARAMETER("USW002", "Unused parameter",
            "Parameter '%s' is never used",
            "Parameter '%s' is assigned but its value is never read"),
    UNUSED_LOCAL_VARIABLE("USW003", "Unused local variable",
            "Variable '%s' is declared but never used",
            "Variable '%s' is assigned but its value is never used");

    private final String id;
    private final String title;
    private final String unusedFormat;
    private final String writeOnlyFormat;

    UsageRule(String id, String title, String unusedFormat, String writeOnlyFormat) {
        this.id = id;
        this.title = title;
        this.unusedFormat = unusedFormat;
        this.writeOnlyFormat = writeOnlyFormat;
    }

    public String getId() {
        return id;
    }

    public String getTitle() {
        return title;
    }

    /**
     * Message for a declaration of this rule.
     *
     * @param name      the declared name
     * @param writeOnly whether the declaration is written somewhere
     */
    public String message(String name, boolean writeOnly) {
        return String.format(writeOnly ? writeOnlyFormat : unusedFormat, name);
    }

    public static UsageRule forKind(DeclarationKind kind) {
        return switch (kind) {
            case FIELD -> UNUSED_PRIVATE_FIELD;
            case PARAMETER, LOCAL_FUNCTION_PARAMETER, LAMBDA_PARAMETER -> UNUSED_PARAMETER;
            case LOCAL_VARIABLE -> UNUSED_LOCAL_VARIABLE;
        };
    }
}
