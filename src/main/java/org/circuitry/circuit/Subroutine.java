package org.circuitry.circuit;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * A non-unitary instruction, typically a circuit converted with {@link Circuit#toSubroutine()}.
 * Exported as a {@code def} block when it has a definition.
 */
public final class Subroutine implements Operation {

    private final String name;
    private final int numQubits;
    private final int numClbits;
    private final List<ParameterValue> params;
    private final Definition definition;

    public Subroutine(String name, int numQubits, int numClbits, List<ParameterValue> params, Definition definition) {
        this.name = Objects.requireNonNull(name, "name");
        this.numQubits = numQubits;
        this.numClbits = numClbits;
        this.params = List.copyOf(params);
        this.definition = definition;
        Definition.checkArity(name, this.params, definition);
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public int numQubits() {
        return numQubits;
    }

    @Override
    public int numClbits() {
        return numClbits;
    }

    @Override
    public List<ParameterValue> params() {
        return params;
    }

    @Override
    public Optional<Definition> definition() {
        return Optional.ofNullable(definition);
    }

    @Override
    public <R, X extends Exception> R accept(OperationVisitor<R, X> visitor) throws X {
        return visitor.visitSubroutine(this);
    }

    @Override
    public String toString() {
        return "Subroutine{name='" + name + "', qubits=" + numQubits + ", clbits=" + numClbits + '}';
    }
}
