package org.circuitry.qasm3.ast;

/**
 * A single-qubit formal argument of a subroutine, {@code qubit <name>}.
 */
public record QuantumArgument(Identifier identifier) implements Expression {

    @Override
    public String qasm() {
        return "qubit " + identifier.qasm();
    }
}
