package org.circuitry.qasm3.ast;

import java.util.List;

/**
 * {@code measure <operands>}, the right-hand side of a measurement assignment.
 */
public record QuantumMeasurement(List<IndexedIdentifier> operands) implements Expression {

    public QuantumMeasurement {
        operands = List.copyOf(operands);
    }

    @Override
    public String qasm() {
        return "measure " + Expressions.join(operands);
    }
}
