package org.circuitry.qasm3.ast;

import java.util.ArrayList;
import java.util.List;

public record Header(Version version, List<Include> includes) implements QasmNode {

    public Header {
        includes = List.copyOf(includes);
    }

    @Override
    public String prefix() {
        return "";
    }

    @Override
    public List<QasmNode> getChildren() {
        List<QasmNode> children = new ArrayList<>(includes.size() + 1);
        children.add(version);
        children.addAll(includes);
        return children;
    }
}
