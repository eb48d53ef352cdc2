package org.circuitry.qasm3.ast;

import java.util.ArrayList;
import java.util.List;

/**
 * The braced body of a subroutine, always closed by a return statement.
 */
public record SubroutineBlock(List<Statement> statements, ReturnStatement returnStatement) implements QasmNode {

    public SubroutineBlock {
        statements = List.copyOf(statements);
    }

    @Override
    public String prefix() {
        return "{\n";
    }

    @Override
    public List<Statement> getChildren() {
        List<Statement> children = new ArrayList<>(statements);
        children.add(returnStatement);
        return children;
    }

    @Override
    public String suffix() {
        return "}\n";
    }
}
