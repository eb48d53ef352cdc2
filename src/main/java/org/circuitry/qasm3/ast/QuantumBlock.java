package org.circuitry.qasm3.ast;

import java.util.List;

/**
 * The braced body of a gate definition.
 */
public record QuantumBlock(List<Statement> statements) implements QasmNode {

    public QuantumBlock {
        statements = List.copyOf(statements);
    }

    @Override
    public String prefix() {
        return "{\n";
    }

    @Override
    public List<Statement> getChildren() {
        return statements;
    }

    @Override
    public String suffix() {
        return "}\n";
    }
}
