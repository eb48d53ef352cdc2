package org.circuitry.qasm3.ast;

import java.util.ArrayList;
import java.util.List;

/**
 * The root of an OpenQASM 3 program: a header followed by global statements.
 */
public record Program(Header header, List<Statement> statements) implements QasmNode {

    public Program {
        statements = List.copyOf(statements);
    }

    @Override
    public String prefix() {
        return "";
    }

    @Override
    public List<QasmNode> getChildren() {
        List<QasmNode> children = new ArrayList<>(statements.size() + 1);
        children.add(header);
        children.addAll(statements);
        return children;
    }
}
