package com.raditha.usage.model;

/**
 * Kinds of declarations whose usage is tracked.
 */
public enum DeclarationKind {
    FIELD(DeclarationScope.WHOLE_PROGRAM, "field"),
    PARAMETER(DeclarationScope.SINGLE_BODY, "parameter"),
    /** Parameter of a method declared inside a local or anonymous class. */
    LOCAL_FUNCTION_PARAMETER(DeclarationScope.SINGLE_BODY, "parameter"),
    LAMBDA_PARAMETER(DeclarationScope.SINGLE_BODY, "lambda parameter"),
    LOCAL_VARIABLE(DeclarationScope.SINGLE_BODY, "local variable");

    private final DeclarationScope scope;
    private final String displayName;

    DeclarationKind(DeclarationScope scope, String displayName) {
        this.scope = scope;
        this.displayName = displayName;
    }

    public DeclarationScope scope() {
        return scope;
    }

    public String displayName() {
        return displayName;
    }

    public boolean isParameter() {
        return this == PARAMETER || this == LOCAL_FUNCTION_PARAMETER || this == LAMBDA_PARAMETER;
    }
}
