package org.circuitry.qasm3.ast;

import java.util.List;

/**
 * A braced statement list used as a branch body.
 */
public record ProgramBlock(List<Statement> statements) implements QasmNode {

    public ProgramBlock {
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
