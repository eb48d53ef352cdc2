package org.circuitry.circuit;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * A reversible unitary operation on qubits only.
 * <p>
 * A gate without a definition is a primitive: either a member of a standard gate vocabulary
 * (see {@link StandardGates}) recognised by name, or an opaque gate. A gate with a definition is a
 * composite whose body is exported as a {@code gate} block.
 */
public final class Gate implements Operation {

    static final String UNIVERSAL_NAME = "u";

    private final String name;
    private final int numQubits;
    private final List<ParameterValue> params;
    private final Definition definition;

    public Gate(String name, int numQubits, List<ParameterValue> params) {
        this(name, numQubits, params, null);
    }

    public Gate(String name, int numQubits, List<ParameterValue> params, Definition definition) {
        this.name = Objects.requireNonNull(name, "name");
        if (numQubits < 0) {
            throw new IllegalArgumentException("Gate '" + name + "' cannot act on " + numQubits + " qubits");
        }
        this.numQubits = numQubits;
        this.params = List.copyOf(params);
        this.definition = definition;
        Definition.checkArity(name, this.params, definition);
    }

    /**
     * Creates a gate sharing this gate's name and definition but called with other parameter values.
     * Both gates are exported with a single definition.
     *
     * @param newParams The call-site parameter values.
     * @return A new gate.
     * @throws IllegalArgumentException if the gate has a definition whose formal parameter count
     *         differs from {@code newParams}.
     */
    public Gate withParams(List<ParameterValue> newParams) {
        return new Gate(name, numQubits, newParams, definition);
    }

    /**
     * @return {@code true} for the primitive universal one-qubit gate {@code U(θ, φ, λ)}.
     */
    public boolean isUniversal() {
        return UNIVERSAL_NAME.equals(name) && definition == null && numQubits == 1 && params.size() == 3;
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
        return 0;
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
        return visitor.visitGate(this);
    }

    @Override
    public String toString() {
        return "Gate{name='" + name + "', qubits=" + numQubits + ", params=" + params
                + (definition != null ? ", composite" : "") + '}';
    }
}
