package com.raditha.usage.model;

/**
 * Facts about a declaration site established by the front-end and consulted by the
 * exemption policies.
 */
public enum DeclarationTrait {
    /** The declaration carries the {@code private} modifier. */
    PRIVATE,
    STATIC,
    FINAL,
    /** Accessors for the field are generated (Lombok {@code @Getter}, {@code @Data} and friends). */
    SYNTHESIZED_ACCESS,
    /** A constant variable in the JLS sense: final, primitive or String, constant initializer. */
    COMPILE_TIME_CONSTANT,
    /** The enclosing callable overrides or implements a supertype member. */
    CONTRACT_BOUND,
    /** The enclosing callable is a {@code public static void main(String[])} entry point. */
    ENTRY_POINT,
    /** The enclosing callable has no body (abstract, native or interface method). */
    NO_BODY,
    /** A resource variable of a try-with-resources statement. */
    TRY_RESOURCE
}
