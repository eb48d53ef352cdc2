package org.circuitry.circuit;

import java.util.Comparator;
import java.util.Objects;

/**
 * A named free symbol. Two parameters with the same name denote the same symbol.
 *
 * @param name The symbol name, e.g. {@code θ}.
 */
public record Parameter(String name) implements ParameterValue {

    /** Orders parameters by name, the order in which a circuit reports its free parameters. */
    public static final Comparator<Parameter> BY_NAME = Comparator.comparing(Parameter::name);

    public Parameter {
        Objects.requireNonNull(name, "name");
        if (name.isBlank()) {
            throw new IllegalArgumentException("Parameter name must not be blank");
        }
    }
}
