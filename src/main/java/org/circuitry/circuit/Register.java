package org.circuitry.circuit;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A named, ordered group of bits. The register creates its own bits, so every bit belongs to
 * exactly one register.
 *
 * @param <B> The bit type, {@link Qubit} or {@link Clbit}.
 */
public abstract class Register<B> {

    private final String name;
    private final List<B> bits;

    Register(String name, int size) {
        this.name = Objects.requireNonNull(name, "name");
        if (size < 0) {
            throw new IllegalArgumentException("Register size must not be negative: " + size);
        }
        List<B> created = new ArrayList<>(size);
        for (int i = 0; i < size; i++) {
            created.add(createBit(i));
        }
        this.bits = Collections.unmodifiableList(created);
    }

    /**
     * Creates the bit at the given position. Called once per position while the register is
     * constructed, so implementations must not depend on subclass state.
     */
    abstract B createBit(int index);

    public String name() {
        return name;
    }

    public int size() {
        return bits.size();
    }

    /**
     * @param index The position of the bit inside this register.
     * @return The bit at that position.
     */
    public B get(int index) {
        return bits.get(index);
    }

    public List<B> bits() {
        return bits;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "(" + size() + ", '" + name + "')";
    }
}
