package org.circuitry.circuit;

/**
 * A named register of qubits.
 */
public final class QuantumRegister extends Register<Qubit> {

    public QuantumRegister(int size, String name) {
        super(name, size);
    }

    @Override
    Qubit createBit(int index) {
        return new Qubit(this, index);
    }
}
