package org.circuitry.qasm3.hoist;

import org.circuitry.circuit.Operation;

/**
 * An operation that needs a definition block, together with its bound output name.
 *
 * @param kind What kind of block to emit.
 * @param operation The operation.
 * @param name The name bound in the namespace.
 */
public record HoistedDeclaration(Kind kind, Operation operation, String name) {

    public enum Kind {
        /** A body-less custom operation, declared as a calibration grammar. */
        OPAQUE,
        /** A composite gate, emitted as a {@code gate} block. */
        GATE,
        /** A composite non-unitary operation, emitted as a {@code def} block. */
        SUBROUTINE
    }
}
