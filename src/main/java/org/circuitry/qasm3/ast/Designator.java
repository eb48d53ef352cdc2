package org.circuitry.qasm3.ast;

/**
 * A size designator, {@code [expression]}.
 */
public record Designator(Expression expression) implements Expression {

    public static Designator of(int size) {
        return new Designator(new IntegerLiteral(size));
    }

    @Override
    public String qasm() {
        return "[" + expression.qasm() + "]";
    }
}
