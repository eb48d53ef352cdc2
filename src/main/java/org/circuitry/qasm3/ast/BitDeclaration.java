package org.circuitry.qasm3.ast;

/**
 * {@code bit[<size>] <name>;}
 */
public record BitDeclaration(Identifier identifier, Designator designator) implements Statement {

    @Override
    public String prefix() {
        return "bit" + designator.qasm() + " " + identifier.qasm() + ";\n";
    }
}
