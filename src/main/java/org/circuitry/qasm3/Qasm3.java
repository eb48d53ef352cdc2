package org.circuitry.qasm3;

import org.circuitry.circuit.Circuit;

import java.io.Writer;

/**
 * Shortcuts for exporting with the default {@link ExporterOptions}.
 */
public final class Qasm3 {

    private Qasm3() {}

    public static String dumps(Circuit circuit) throws ExportException {
        return new Exporter().dumps(circuit);
    }

    public static void dump(Circuit circuit, Writer writer) throws ExportException {
        new Exporter().dump(circuit, writer);
    }
}
