package org.circuitry.qasm3.ast;

public record IntegerLiteral(long value) implements Expression {

    @Override
    public String qasm() {
        return Long.toString(value);
    }
}
