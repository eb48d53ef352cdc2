package org.circuitry.qasm3.ast;

/**
 * A node that may appear in a statement list: a declaration, a definition or a quantum
 * instruction.
 */
public interface Statement extends QasmNode {
}
