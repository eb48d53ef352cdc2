package org.circuitry.qasm3.ast;

/**
 * An inline fragment of a statement, such as an identifier or a literal.
 */
public interface Expression {

    /**
     * @return The canonical text of this expression.
     */
    String qasm();
}
