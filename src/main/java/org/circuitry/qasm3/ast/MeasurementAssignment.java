package org.circuitry.qasm3.ast;

/**
 * {@code <clbit> = measure <qubit>;}
 */
public record MeasurementAssignment(IndexedIdentifier target, QuantumMeasurement measurement) implements Statement {

    @Override
    public String prefix() {
        return target.qasm() + " = " + measurement.qasm() + ";\n";
    }
}
