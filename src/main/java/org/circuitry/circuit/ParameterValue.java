package org.circuitry.circuit;

/**
 * The value of an operation parameter: either a real constant or a free symbol that is bound
 * later, for example by a program input.
 */
public sealed interface ParameterValue permits Constant, Parameter {

    /**
     * @param value A real number.
     * @return The constant wrapping {@code value}.
     */
    static ParameterValue of(double value) {
        return new Constant(value);
    }
}
