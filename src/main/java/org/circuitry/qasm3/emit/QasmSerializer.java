package org.circuitry.qasm3.emit;

import org.circuitry.qasm3.ast.QasmNode;

import java.io.IOException;
import java.io.UncheckedIOException;

/**
 * Folds an OpenQASM 3 tree into text, depth first: a node's prefix, then its children in order,
 * then its suffix. Nothing is reordered or buffered, so {@link #write(QasmNode, Appendable)} streams
 * exactly the characters {@link #serialize(QasmNode)} returns.
 */
public final class QasmSerializer {

    /**
     * Renders a tree into a string.
     *
     * @param root The root node, usually a {@link org.circuitry.qasm3.ast.Program}.
     * @return The program text.
     */
    public String serialize(QasmNode root) {
        StringBuilder sb = new StringBuilder();
        try {
            write(root, sb);
        } catch (IOException e) {
            // StringBuilder never throws
            throw new UncheckedIOException(e);
        }
        return sb.toString();
    }

    /**
     * Writes a tree to a character sink.
     *
     * @param root The root node.
     * @param out The sink, e.g. a {@link java.io.Writer}. It is neither flushed nor closed.
     * @throws IOException if the sink fails.
     */
    public void write(QasmNode root, Appendable out) throws IOException {
        out.append(root.prefix());
        for (QasmNode child : root.getChildren()) {
            write(child, out);
        }
        out.append(root.suffix());
    }
}
