package org.circuitry.qasm3.ast;

/**
 * {@code input <type> <name>;}, the declaration of a value supplied when the program runs.
 */
public record InputDeclaration(ClassicalType type, Identifier identifier) implements Statement {

    @Override
    public String prefix() {
        return "input " + type.qasm() + " " + identifier.qasm() + ";\n";
    }
}
