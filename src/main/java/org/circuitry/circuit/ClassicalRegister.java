package org.circuitry.circuit;

/**
 * A named register of classical bits. A whole register can be the target of a {@link Condition},
 * in which case its bits are read as one unsigned integer.
 */
public final class ClassicalRegister extends Register<Clbit> implements ConditionTarget {

    public ClassicalRegister(int size, String name) {
        super(name, size);
    }

    @Override
    Clbit createBit(int index) {
        return new Clbit(this, index);
    }
}
