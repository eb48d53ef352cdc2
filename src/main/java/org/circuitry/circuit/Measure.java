package org.circuitry.circuit;

import java.util.List;
import java.util.Optional;

/**
 * Measurement of one qubit into one clbit. Built into the output language; never defined.
 */
public final class Measure implements Operation {

    @Override
    public String name() {
        return "measure";
    }

    @Override
    public int numQubits() {
        return 1;
    }

    @Override
    public int numClbits() {
        return 1;
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
        return visitor.visitMeasure(this);
    }

    @Override
    public String toString() {
        return "Measure";
    }
}
