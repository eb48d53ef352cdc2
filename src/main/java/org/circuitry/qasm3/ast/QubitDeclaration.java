package org.circuitry.qasm3.ast;

/**
 * {@code qubit[<size>] <name>;}
 */
public record QubitDeclaration(Identifier identifier, Designator designator) implements Statement {

    @Override
    public String prefix() {
        return "qubit" + designator.qasm() + " " + identifier.qasm() + ";\n";
    }
}
