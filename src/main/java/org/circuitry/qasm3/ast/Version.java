package org.circuitry.qasm3.ast;

/**
 * {@code OPENQASM <number>;}
 */
public record Version(String number) implements QasmNode {

    @Override
    public String prefix() {
        return "OPENQASM " + number + ";\n";
    }
}
