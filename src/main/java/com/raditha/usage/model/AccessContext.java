package com.raditha.usage.model;

/**
 * Immediate syntactic shape around one occurrence of a tracked identifier.
 */
public enum AccessContext {
    /** Left operand of a plain {@code =}. */
    ASSIGNMENT_TARGET_SIMPLE,
    /** Left operand of a compound assignment such as {@code +=}. */
    ASSIGNMENT_TARGET_COMPOUND,
    /** Right operand of an assignment. */
    ASSIGNMENT_VALUE,
    /** Operand of a prefix or postfix {@code ++} or {@code --}. */
    INCREMENT_DECREMENT,
    /** Bound to an output-only parameter position of a call. */
    OUTPUT_BINDING,
    /** Any other position: receivers, arguments, conditions, returns and captures. Read by default. */
    OTHER
}
