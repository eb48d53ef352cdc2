package org.circuitry.qasm3.namespace;

import org.circuitry.circuit.Operation;

import java.util.IdentityHashMap;
import java.util.Map;
import java.util.OptionalInt;

/**
 * Assigns every distinct operation a dense index on first sight. The index, not the object, is
 * what the namespace keys on, and it doubles as the disambiguating suffix of colliding names, so
 * two exports of the same circuit produce the same names.
 * <p>
 * Composite operations are identified by their definition: gates that share one definition (see
 * {@link org.circuitry.circuit.Gate#withParams}) share one index. Primitives are identified by the
 * operation object itself.
 */
public final class OperationArena {

    private final Map<Object, Integer> indices = new IdentityHashMap<>();

    /**
     * Returns the index of an operation, assigning the next free one if it was never seen.
     *
     * @param operation The operation.
     * @return Its index, starting at 0.
     */
    public int indexOf(Operation operation) {
        Object key = identityOf(operation);
        Integer index = indices.get(key);
        if (index == null) {
            index = indices.size();
            indices.put(key, index);
        }
        return index;
    }

    /**
     * @param operation The operation.
     * @return Its index if it was seen before, without assigning one.
     */
    public OptionalInt find(Operation operation) {
        Integer index = indices.get(identityOf(operation));
        return index == null ? OptionalInt.empty() : OptionalInt.of(index);
    }

    public int size() {
        return indices.size();
    }

    private static Object identityOf(Operation operation) {
        return operation.definition().<Object>map(d -> d).orElse(operation);
    }
}
