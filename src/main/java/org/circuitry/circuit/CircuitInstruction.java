package org.circuitry.circuit;

import java.util.List;
import java.util.Objects;

/**
 * One entry of a circuit's instruction list: an operation applied to ordered qubit and clbit
 * targets, optionally guarded by a classical condition.
 * <p>
 * The condition belongs to the instruction, not to the operation, so an unconditioned copy still
 * refers to the very same operation.
 *
 * @param operation The applied operation.
 * @param qubits The quantum targets, in operand order.
 * @param clbits The classical targets, in operand order.
 * @param condition The guard, or {@code null} for an unconditional instruction.
 */
public record CircuitInstruction(Operation operation, List<Qubit> qubits, List<Clbit> clbits, Condition condition) {

    public CircuitInstruction {
        Objects.requireNonNull(operation, "operation");
        qubits = List.copyOf(qubits);
        clbits = List.copyOf(clbits);
    }

    public CircuitInstruction(Operation operation, List<Qubit> qubits, List<Clbit> clbits) {
        this(operation, qubits, clbits, null);
    }

    public boolean isConditioned() {
        return condition != null;
    }

    /**
     * @return A copy of this instruction with the condition cleared.
     */
    public CircuitInstruction withoutCondition() {
        return new CircuitInstruction(operation, qubits, clbits, null);
    }

    /**
     * @param newCondition The guard to attach.
     * @return A copy of this instruction guarded by {@code newCondition}.
     */
    public CircuitInstruction withCondition(Condition newCondition) {
        return new CircuitInstruction(operation, qubits, clbits, newCondition);
    }
}
