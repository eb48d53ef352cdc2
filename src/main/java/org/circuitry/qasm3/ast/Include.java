package org.circuitry.qasm3.ast;

/**
 * {@code include <file>;}. The file name is written as given.
 */
public record Include(String filename) implements QasmNode {

    @Override
    public String prefix() {
        return "include " + filename + ";\n";
    }
}
