package org.circuitry.circuit;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * The body of a composite operation: formal qubits (grouped in registers), formal parameters and
 * an ordered list of instructions over those formals.
 * <p>
 * A definition is an immutable snapshot. It is owned by the operation that declares it and can
 * only refer to operations that existed when it was taken, so definitions never form a cycle.
 */
public final class Definition {

    private final String name;
    private final List<QuantumRegister> qregs;
    private final List<Parameter> parameters;
    private final List<CircuitInstruction> body;

    public Definition(String name, List<QuantumRegister> qregs, List<Parameter> parameters, List<CircuitInstruction> body) {
        this.name = Objects.requireNonNull(name, "name");
        this.qregs = List.copyOf(qregs);
        this.parameters = List.copyOf(parameters);
        this.body = List.copyOf(body);
    }

    /**
     * Rejects call-site values that do not match the formal parameters of a definition.
     */
    static void checkArity(String operationName, List<ParameterValue> params, Definition definition) {
        if (definition != null && params.size() != definition.parameters.size()) {
            throw new IllegalArgumentException("Operation '" + operationName + "' expects "
                    + definition.parameters.size() + " parameters, got " + params.size());
        }
    }

    public String name() {
        return name;
    }

    public List<QuantumRegister> qregs() {
        return qregs;
    }

    /**
     * @return The formal qubits, register by register.
     */
    public List<Qubit> qubits() {
        List<Qubit> qubits = new ArrayList<>();
        for (QuantumRegister qreg : qregs) {
            qubits.addAll(qreg.bits());
        }
        return qubits;
    }

    public List<Parameter> parameters() {
        return parameters;
    }

    public List<CircuitInstruction> body() {
        return body;
    }

    @Override
    public String toString() {
        return "Definition{name='" + name + "', qregs=" + qregs + ", parameters=" + parameters
                + ", instructions=" + body.size() + '}';
    }
}
