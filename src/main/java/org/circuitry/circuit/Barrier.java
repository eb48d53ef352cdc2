package org.circuitry.circuit;

import java.util.List;
import java.util.Optional;

/**
 * A scheduling barrier across a number of qubits. Built into the output language; never defined.
 */
public final class Barrier implements Operation {

    private final int numQubits;

    public Barrier(int numQubits) {
        this.numQubits = numQubits;
    }

    @Override
    public String name() {
        return "barrier";
    }

    @Override
    public int numQubits() {
        return numQubits;
    }

    @Override
    public int numClbits() {
        return 0;
    }

    @Override
    public List<ParameterValue> params() {
        return List.of();
    }

    @Override
    public Optional<Definition> definition() {
        return Optional.empty();
    }

    @Override
    public <R, X extends Exception> R accept(OperationVisitor<R, X> visitor) throws X {
        return visitor.visitBarrier(this);
    }

    @Override
    public String toString() {
        return "Barrier{qubits=" + numQubits + '}';
    }
}
