package org.circuitry.qasm3.ast;

import java.util.Collections;
import java.util.List;

/**
 * The base interface for all line-producing nodes of the OpenQASM 3 tree.
 * <p>
 * A node renders as its {@link #prefix()}, then each child in order, then its {@link #suffix()}.
 * Leaves put their complete text, terminator included, into the prefix.
 */
public interface QasmNode {

    /**
     * @return The text emitted before the children.
     */
    String prefix();

    /**
     * Returns the direct child nodes, so a serializer can fold the tree without knowing the
     * structure of each node.
     *
     * @return The children; an empty list for leaves.
     */
    default List<? extends QasmNode> getChildren() {
        return Collections.emptyList();
    }

    /**
     * @return The text emitted after the children.
     */
    default String suffix() {
        return "";
    }
}
