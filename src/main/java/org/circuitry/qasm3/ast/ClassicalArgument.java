package org.circuitry.qasm3.ast;

/**
 * A typed classical formal argument of a subroutine, e.g. {@code float[32] theta}.
 */
public record ClassicalArgument(ClassicalType type, Identifier identifier) implements Expression {

    @Override
    public String qasm() {
        return type.qasm() + " " + identifier.qasm();
    }
}
