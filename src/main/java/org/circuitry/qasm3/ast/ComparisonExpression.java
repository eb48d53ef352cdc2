package org.circuitry.qasm3.ast;

/**
 * {@code left <op> right}, as used in branching conditions.
 */
public record ComparisonExpression(Expression left, RelationalOperator operator, Expression right) implements Expression {

    @Override
    public String qasm() {
        return left.qasm() + " " + operator.symbol() + " " + right.qasm();
    }
}
