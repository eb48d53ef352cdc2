package org.circuitry.qasm3.ast;

import java.util.List;

/**
 * {@code barrier <operands>;}
 */
public record QuantumBarrier(List<IndexedIdentifier> operands) implements Statement {

    public QuantumBarrier {
        operands = List.copyOf(operands);
    }

    @Override
    public String prefix() {
        return "barrier " + Expressions.join(operands) + ";\n";
    }
}
