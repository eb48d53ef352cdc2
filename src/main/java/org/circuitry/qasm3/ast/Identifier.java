package org.circuitry.qasm3.ast;

import java.util.Objects;

/**
 * A plain name.
 *
 * @param name The identifier text.
 */
public record Identifier(String name) implements Expression {

    public Identifier {
        Objects.requireNonNull(name, "name");
    }

    @Override
    public String qasm() {
        return name;
    }
}
