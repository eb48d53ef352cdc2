package org.circuitry.circuit;

/**
 * A real-valued, already bound parameter.
 *
 * @param value The numeric value, usually an angle in radians.
 */
public record Constant(double value) implements ParameterValue {
}
