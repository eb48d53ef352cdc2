package org.circuitry.qasm3.hoist;

import org.circuitry.circuit.Barrier;
import org.circuitry.circuit.CircuitInstruction;
import org.circuitry.circuit.Definition;
import org.circuitry.circuit.Gate;
import org.circuitry.circuit.Measure;
import org.circuitry.circuit.Operation;
import org.circuitry.circuit.OperationVisitor;
import org.circuitry.circuit.Subroutine;
import org.circuitry.qasm3.namespace.GlobalNamespace;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Discovers every operation that needs a definition block and registers it in the namespace.
 * <p>
 * The walk is depth first and post order: a composite's body is hoisted before the composite
 * itself is registered, so the returned list puts every callee before its callers. Operations
 * that already exist in the namespace, barriers and measurements are skipped. Definitions are
 * immutable snapshots and cannot reach their own operation, so the walk needs no cycle check.
 */
public final class DeclarationHoister {

    private static final Logger LOGGER = LoggerFactory.getLogger(DeclarationHoister.class);

    private final GlobalNamespace namespace;

    public DeclarationHoister(GlobalNamespace namespace) {
        this.namespace = namespace;
    }

    /**
     * @param instructions The top-level instructions of a circuit.
     * @return The declarations in emission order.
     */
    public List<HoistedDeclaration> hoist(List<CircuitInstruction> instructions) {
        List<HoistedDeclaration> declarations = new ArrayList<>();
        hoistInto(instructions, declarations);
        return Collections.unmodifiableList(declarations);
    }

    private void hoistInto(List<CircuitInstruction> instructions, List<HoistedDeclaration> declarations) {
        for (CircuitInstruction instruction : instructions) {
            Operation operation = instruction.operation();
            if (namespace.exists(operation)) {
                continue;
            }
            Optional<HoistedDeclaration.Kind> kind = operation.accept(KIND_OF);
            if (kind.isEmpty()) {
                continue;
            }

            Optional<Definition> definition = operation.definition();
            if (definition.isPresent()) {
                hoistInto(definition.get().body(), declarations);
            }
            String name = namespace.register(operation);
            LOGGER.debug("Hoisted {} '{}' as '{}'", kind.get(), operation.name(), name);
            declarations.add(new HoistedDeclaration(kind.get(), operation, name));
        }
    }

    private static final OperationVisitor<Optional<HoistedDeclaration.Kind>, RuntimeException> KIND_OF =
            new OperationVisitor<>() {
                @Override
                public Optional<HoistedDeclaration.Kind> visitGate(Gate gate) {
                    return Optional.of(gate.definition().isPresent()
                            ? HoistedDeclaration.Kind.GATE
                            : HoistedDeclaration.Kind.OPAQUE);
                }

                @Override
                public Optional<HoistedDeclaration.Kind> visitBarrier(Barrier barrier) {
                    return Optional.empty();
                }

                @Override
                public Optional<HoistedDeclaration.Kind> visitMeasure(Measure measure) {
                    return Optional.empty();
                }

                @Override
                public Optional<HoistedDeclaration.Kind> visitSubroutine(Subroutine subroutine) {
                    return Optional.of(subroutine.definition().isPresent()
                            ? HoistedDeclaration.Kind.SUBROUTINE
                            : HoistedDeclaration.Kind.OPAQUE);
                }
            };
}
