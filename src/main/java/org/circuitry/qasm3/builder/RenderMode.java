package org.circuitry.qasm3.builder;

import org.circuitry.qasm3.ast.IndexedIdentifier;

/**
 * How a register bit is named in the output.
 */
public enum RenderMode {

    /** Top-level statements address bits as {@code register[index]}. */
    INDEXED {
        @Override
        IndexedIdentifier bit(String register, int index) {
            return IndexedIdentifier.of(register, index);
        }
    },

    /**
     * Definition bodies address bits as {@code register_index}: the formals of a definition are
     * individual qubits, not whole registers.
     */
    FLAT {
        @Override
        IndexedIdentifier bit(String register, int index) {
            return IndexedIdentifier.of(register + "_" + index);
        }
    };

    abstract IndexedIdentifier bit(String register, int index);
}
