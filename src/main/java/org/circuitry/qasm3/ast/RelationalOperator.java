package org.circuitry.qasm3.ast;

/**
 * Relational operators of branching conditions. Only equality is ever lowered.
 */
public enum RelationalOperator {
    EQUALS("==");

    private final String symbol;

    RelationalOperator(String symbol) {
        this.symbol = symbol;
    }

    public String symbol() {
        return symbol;
    }
}
