package org.circuitry.qasm3.namespace;

import org.circuitry.circuit.Gate;
import org.circuitry.circuit.Operation;
import org.circuitry.qasm3.ExportErrorCode;
import org.circuitry.qasm3.ExportException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.Map;
import java.util.OptionalInt;
import java.util.Set;

/**
 * The per-export registry of output names.
 * <p>
 * Custom operations are recognised by identity (their {@link OperationArena} index); standard
 * gates by name. Every name is bound at most once, so a custom operation whose name is already
 * taken, by another custom operation or by the standard vocabulary, is bound under
 * {@code name_<index>} instead. Once bound, a name never changes. Not thread-safe; create one per
 * export.
 */
public final class GlobalNamespace {

    private static final Logger LOGGER = LoggerFactory.getLogger(GlobalNamespace.class);

    /** The output name of the universal one-qubit gate. */
    public static final String UNIVERSAL_GATE = "U";

    private static final int BUILTIN = -1;

    private final OperationArena arena;
    private final Set<String> standardGates;
    private final Map<String, Integer> forward = new HashMap<>();
    private final Map<Integer, String> backward = new HashMap<>();

    /**
     * @param standardGates Names of the gates provided by the includes.
     * @param arena The arena assigning operation indices for this export.
     */
    public GlobalNamespace(Set<String> standardGates, OperationArena arena) {
        this.arena = arena;
        this.standardGates = Set.copyOf(standardGates);
        forward.put(UNIVERSAL_GATE, BUILTIN);
        for (String name : standardGates) {
            forward.put(name, BUILTIN);
        }
    }

    /**
     * @param operation The operation.
     * @return {@code true} for the universal gate and for body-less gates named in the standard
     *         vocabulary.
     */
    public boolean isBuiltin(Operation operation) {
        if (!(operation instanceof Gate gate) || gate.definition().isPresent()) {
            return false;
        }
        return gate.isUniversal() || standardGates.contains(gate.name());
    }

    /**
     * @param operation The operation.
     * @return {@code true} if the operation needs no further registration: it is built in, or it
     *         was registered before.
     */
    public boolean exists(Operation operation) {
        if (isBuiltin(operation)) {
            return true;
        }
        OptionalInt index = arena.find(operation);
        return index.isPresent() && backward.containsKey(index.getAsInt());
    }

    /**
     * Binds an operation to an output name. Registering the same operation again returns the name
     * it already has.
     *
     * @param operation The operation to bind.
     * @return The bound name.
     */
    public String register(Operation operation) {
        int index = arena.indexOf(operation);
        String existing = backward.get(index);
        if (existing != null) {
            return existing;
        }

        String name = operation.name();
        if (forward.containsKey(name)) {
            String candidate = name + "_" + index;
            while (forward.containsKey(candidate)) {
                candidate = candidate + "_" + index;
            }
            LOGGER.debug("Name '{}' is already taken, binding operation #{} as '{}'", name, index, candidate);
            name = candidate;
        }
        forward.put(name, index);
        backward.put(index, name);
        return name;
    }

    /**
     * Resolves the name an operation is called by.
     *
     * @param operation A built-in or registered operation.
     * @return {@code U} for the universal gate, the plain name for standard gates, otherwise the
     *         registered name.
     * @throws ExportException with {@link ExportErrorCode#MALFORMED_INPUT} if the operation is
     *         neither built in nor registered.
     */
    public String nameOf(Operation operation) throws ExportException {
        if (operation instanceof Gate gate && gate.isUniversal()) {
            return UNIVERSAL_GATE;
        }
        if (isBuiltin(operation)) {
            return operation.name();
        }
        OptionalInt index = arena.find(operation);
        if (index.isPresent() && backward.containsKey(index.getAsInt())) {
            return backward.get(index.getAsInt());
        }
        throw new ExportException(ExportErrorCode.MALFORMED_INPUT,
                "Operation '" + operation.name() + "' was never declared: " + operation);
    }

    /**
     * @return The number of registered (non-builtin) operations.
     */
    public int registeredCount() {
        return backward.size();
    }
}
