package org.circuitry.qasm3.ast;

public record ReturnStatement() implements Statement {

    @Override
    public String prefix() {
        return "return;\n";
    }
}
