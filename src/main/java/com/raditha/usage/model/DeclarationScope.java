package com.raditha.usage.model;

/**
 * Breadth over which occurrences of a declaration are collected.
 */
public enum DeclarationScope {
    /** Every compilation unit of the analyzed program. Fields live here. */
    WHOLE_PROGRAM,
    /** The body of one callable. Parameters and local variables live here. */
    SINGLE_BODY
}
