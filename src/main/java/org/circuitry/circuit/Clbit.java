package org.circuitry.circuit;

import java.util.Optional;

/**
 * A single classical bit. Like {@link Qubit} it compares by identity.
 * A clbit can be the target of a {@link Condition}.
 */
public final class Clbit implements ConditionTarget {

    private final ClassicalRegister register;
    private final int index;

    Clbit(ClassicalRegister register, int index) {
        this.register = register;
        this.index = index;
    }

    /**
     * Creates a classical bit that belongs to no register.
     *
     * @param index The position of the bit in the circuit.
     * @return A new register-less clbit.
     */
    public static Clbit loose(int index) {
        if (index < 0) {
            throw new IllegalArgumentException("Clbit index must not be negative: " + index);
        }
        return new Clbit(null, index);
    }

    public Optional<ClassicalRegister> register() {
        return Optional.ofNullable(register);
    }

    public int index() {
        return index;
    }

    @Override
    public String toString() {
        return register != null ? register.name() + "[" + index + "]" : "clbit " + index;
    }
}
