package org.circuitry.circuit;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * An ordered list of instructions over registers of qubits and clbits.
 * <p>
 * The appending methods return the circuit itself so calls can be chained;
 * {@link #cIf(ConditionTarget, long)} guards the instruction appended last:
 * <pre>
 *   circuit.x(qr.get(0)).cIf(cr, 1);
 * </pre>
 * A circuit is not thread-safe. Exporters only read it.
 */
public final class Circuit {

    private final String name;
    private final List<QuantumRegister> qregs = new ArrayList<>();
    private final List<ClassicalRegister> cregs = new ArrayList<>();
    private final List<CircuitInstruction> data = new ArrayList<>();

    public Circuit(String name) {
        this.name = Objects.requireNonNull(name, "name");
    }

    /**
     * Creates a circuit over a quantum register {@code q} and a classical register {@code c}.
     * Registers of size zero are omitted.
     *
     * @param name The circuit name, used when it is converted to a gate or subroutine.
     * @param numQubits The size of {@code q}.
     * @param numClbits The size of {@code c}.
     * @return The new circuit.
     */
    public static Circuit withSize(String name, int numQubits, int numClbits) {
        Circuit circuit = new Circuit(name);
        if (numQubits > 0) {
            circuit.addRegister(new QuantumRegister(numQubits, "q"));
        }
        if (numClbits > 0) {
            circuit.addRegister(new ClassicalRegister(numClbits, "c"));
        }
        return circuit;
    }

    public Circuit addRegister(QuantumRegister qreg) {
        requireUniqueRegisterName(qreg.name());
        qregs.add(qreg);
        return this;
    }

    public Circuit addRegister(ClassicalRegister creg) {
        requireUniqueRegisterName(creg.name());
        cregs.add(creg);
        return this;
    }

    private void requireUniqueRegisterName(String registerName) {
        boolean taken = qregs.stream().anyMatch(r -> r.name().equals(registerName))
                || cregs.stream().anyMatch(r -> r.name().equals(registerName));
        if (taken) {
            throw new IllegalArgumentException("Register name '" + registerName + "' is already used in circuit '" + name + "'");
        }
    }

    public String name() {
        return name;
    }

    public List<QuantumRegister> qregs() {
        return Collections.unmodifiableList(qregs);
    }

    public List<ClassicalRegister> cregs() {
        return Collections.unmodifiableList(cregs);
    }

    public List<CircuitInstruction> instructions() {
        return Collections.unmodifiableList(data);
    }

    /**
     * @return All qubits of all quantum registers, in register order.
     */
    public List<Qubit> qubits() {
        List<Qubit> qubits = new ArrayList<>();
        qregs.forEach(r -> qubits.addAll(r.bits()));
        return qubits;
    }

    /**
     * @return All clbits of all classical registers, in register order.
     */
    public List<Clbit> clbits() {
        List<Clbit> clbits = new ArrayList<>();
        cregs.forEach(r -> clbits.addAll(r.bits()));
        return clbits;
    }

    public Qubit qubit(int index) {
        return qubits().get(index);
    }

    public Clbit clbit(int index) {
        return clbits().get(index);
    }

    /**
     * The free parameters of this circuit: every {@link Parameter} used by a top-level instruction,
     * sorted by name. Parameters used only inside definitions are formals of those definitions.
     *
     * @return The free parameters.
     */
    public SortedSet<Parameter> parameters() {
        SortedSet<Parameter> parameters = new TreeSet<>(Parameter.BY_NAME);
        for (CircuitInstruction instruction : data) {
            for (ParameterValue value : instruction.operation().params()) {
                if (value instanceof Parameter parameter) {
                    parameters.add(parameter);
                }
            }
        }
        return parameters;
    }

    public Circuit append(CircuitInstruction instruction) {
        Objects.requireNonNull(instruction, "instruction");
        data.add(instruction);
        return this;
    }

    public Circuit append(Operation operation, List<Qubit> qubits, List<Clbit> clbits) {
        if (qubits.size() != operation.numQubits() || clbits.size() != operation.numClbits()) {
            throw new IllegalArgumentException("Operation '" + operation.name() + "' expects "
                    + operation.numQubits() + " qubits and " + operation.numClbits() + " clbits, got "
                    + qubits.size() + " and " + clbits.size());
        }
        return append(new CircuitInstruction(operation, qubits, clbits));
    }

    public Circuit append(Operation operation, Qubit... qubits) {
        return append(operation, Arrays.asList(qubits), List.of());
    }

    /**
     * Guards the most recently appended instruction with {@code target == value}.
     *
     * @param target The register or clbit to compare.
     * @param value The expected value.
     * @return This circuit.
     */
    public Circuit cIf(ConditionTarget target, long value) {
        if (data.isEmpty()) {
            throw new IllegalStateException("No instruction to condition in circuit '" + name + "'");
        }
        int last = data.size() - 1;
        data.set(last, data.get(last).withCondition(Condition.equalTo(target, value)));
        return this;
    }

    public Circuit h(Qubit qubit) { return append(StandardGates.h(), qubit); }
    public Circuit x(Qubit qubit) { return append(StandardGates.x(), qubit); }
    public Circuit y(Qubit qubit) { return append(StandardGates.y(), qubit); }
    public Circuit z(Qubit qubit) { return append(StandardGates.z(), qubit); }
    public Circuit s(Qubit qubit) { return append(StandardGates.s(), qubit); }
    public Circuit sdg(Qubit qubit) { return append(StandardGates.sdg(), qubit); }
    public Circuit cx(Qubit control, Qubit target) { return append(StandardGates.cx(), control, target); }

    public Circuit p(double lambda, Qubit qubit) {
        return append(StandardGates.p(ParameterValue.of(lambda)), qubit);
    }

    public Circuit rx(ParameterValue theta, Qubit qubit) {
        return append(StandardGates.rx(theta), qubit);
    }

    public Circuit rz(ParameterValue phi, Qubit qubit) {
        return append(StandardGates.rz(phi), qubit);
    }

    public Circuit u(double theta, double phi, double lambda, Qubit qubit) {
        return append(StandardGates.u(theta, phi, lambda), qubit);
    }

    /**
     * Appends a barrier across every qubit of the circuit.
     */
    public Circuit barrier() {
        List<Qubit> targets = qubits();
        return append(new Barrier(targets.size()), targets, List.of());
    }

    public Circuit barrier(Qubit... qubits) {
        return append(new Barrier(qubits.length), Arrays.asList(qubits), List.of());
    }

    public Circuit barrier(QuantumRegister... registers) {
        List<Qubit> targets = new ArrayList<>();
        for (QuantumRegister register : registers) {
            targets.addAll(register.bits());
        }
        return append(new Barrier(targets.size()), targets, List.of());
    }

    public Circuit measure(Qubit qubit, Clbit clbit) {
        return append(new Measure(), List.of(qubit), List.of(clbit));
    }

    /**
     * Converts this circuit into a composite gate. The definition is a snapshot: instructions
     * appended afterwards do not change the gate. The gate's call-site parameters are the
     * circuit's free parameters.
     *
     * @return A new gate named after this circuit.
     * @throws IllegalStateException if the circuit has classical registers or non-gate instructions.
     */
    public Gate toGate() {
        if (!cregs.isEmpty()) {
            throw new IllegalStateException("Circuit '" + name + "' has classical bits and cannot become a gate");
        }
        for (CircuitInstruction instruction : data) {
            if (!(instruction.operation() instanceof Gate) || instruction.isConditioned()) {
                throw new IllegalStateException("Circuit '" + name + "' contains '"
                        + instruction.operation().name() + "', which is not an unconditioned gate");
            }
        }
        List<Parameter> formals = new ArrayList<>(parameters());
        return new Gate(name, qubits().size(), new ArrayList<ParameterValue>(formals), snapshot(formals));
    }

    /**
     * Converts this circuit into a subroutine. Like {@link #toGate()} the body is a snapshot.
     *
     * @return A new subroutine named after this circuit.
     */
    public Subroutine toSubroutine() {
        List<Parameter> formals = new ArrayList<>(parameters());
        return new Subroutine(name, qubits().size(), clbits().size(), new ArrayList<ParameterValue>(formals), snapshot(formals));
    }

    private Definition snapshot(List<Parameter> formals) {
        return new Definition(name, qregs, formals, data);
    }

    @Override
    public String toString() {
        return "Circuit{name='" + name + "', qregs=" + qregs + ", cregs=" + cregs + ", instructions=" + data.size() + '}';
    }
}
