package org.circuitry.circuit;

/**
 * Something a classical condition can compare against an integer: a whole register or a single bit.
 */
public sealed interface ConditionTarget permits ClassicalRegister, Clbit {
}
