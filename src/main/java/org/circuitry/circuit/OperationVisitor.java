package org.circuitry.circuit;

/**
 * Exhaustive dispatch over the {@link Operation} kinds.
 *
 * @param <R> The result type.
 * @param <X> The checked exception the visit methods may throw.
 */
public interface OperationVisitor<R, X extends Exception> {

    R visitGate(Gate gate) throws X;

    R visitBarrier(Barrier barrier) throws X;

    R visitMeasure(Measure measure) throws X;

    R visitSubroutine(Subroutine subroutine) throws X;
}
