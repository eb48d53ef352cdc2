package org.circuitry.circuit;

import java.util.Optional;

/**
 * A single quantum bit.
 * <p>
 * A qubit is either owned by exactly one {@link QuantumRegister}, in which case {@link #index()} is
 * its position inside that register, or it is anonymous and {@link #index()} is its physical index
 * on the device. Qubits compare by identity.
 */
public final class Qubit {

    private final QuantumRegister register;
    private final int index;

    Qubit(QuantumRegister register, int index) {
        this.register = register;
        this.index = index;
    }

    /**
     * Creates an anonymous qubit addressed by a physical index.
     *
     * @param index The physical index, must not be negative.
     * @return A new qubit that belongs to no register.
     */
    public static Qubit physical(int index) {
        if (index < 0) {
            throw new IllegalArgumentException("Physical qubit index must not be negative: " + index);
        }
        return new Qubit(null, index);
    }

    public Optional<QuantumRegister> register() {
        return Optional.ofNullable(register);
    }

    public int index() {
        return index;
    }

    @Override
    public String toString() {
        return register != null ? register.name() + "[" + index + "]" : "$" + index;
    }
}
