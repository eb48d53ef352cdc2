package org.circuitry.circuit;

/**
 * Relational operator of a classical {@link Condition}.
 */
public enum Comparison {
    EQUAL,
    NOT_EQUAL,
    LESS,
    LESS_OR_EQUAL,
    GREATER,
    GREATER_OR_EQUAL
}
