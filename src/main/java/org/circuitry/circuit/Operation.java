package org.circuitry.circuit;

import java.util.List;
import java.util.Optional;

/**
 * An operation that can be applied to qubits and clbits. The set of kinds is closed; consumers
 * dispatch on it through {@link OperationVisitor}, so a new kind has to be handled everywhere at
 * compile time.
 * <p>
 * Operations compare by identity. Appending the same operation twice is one operation used twice.
 */
public sealed interface Operation permits Gate, Barrier, Measure, Subroutine {

    String name();

    int numQubits();

    int numClbits();

    List<ParameterValue> params();

    /**
     * @return The body of this operation, empty for primitives and opaque operations.
     */
    Optional<Definition> definition();

    /**
     * Dispatches to the visitor method matching this operation's kind.
     *
     * @param visitor The visitor.
     * @param <R> The visitor's result type.
     * @param <X> The checked exception the visitor may throw.
     * @return The visitor's result.
     * @throws X if the visitor fails.
     */
    <R, X extends Exception> R accept(OperationVisitor<R, X> visitor) throws X;
}
