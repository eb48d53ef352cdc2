package org.circuitry.qasm3;

import org.circuitry.circuit.Circuit;
import org.circuitry.qasm3.ast.Program;
import org.circuitry.qasm3.builder.Qasm3Builder;
import org.circuitry.qasm3.emit.QasmSerializer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Writer;

/**
 * Exports circuits as OpenQASM 3 programs.
 * <p>
 * The export runs in two phases:
 * <ol>
 *   <li>Building: declarations are hoisted and named, and the circuit is lowered into a complete
 *       program tree. Every {@link ExportException} is raised here.</li>
 *   <li>Serialization: the tree is folded into text.</li>
 * </ol>
 * An exporter is immutable and may be shared; each call uses its own namespace, so exporting the
 * same circuit twice yields identical text.
 */
public final class Exporter {

    private static final Logger LOGGER = LoggerFactory.getLogger(Exporter.class);

    private final ExporterOptions options;
    private final QasmSerializer serializer = new QasmSerializer();

    /**
     * Creates an exporter with the options from the application configuration.
     */
    public Exporter() {
        this(ExporterOptions.defaults());
    }

    public Exporter(ExporterOptions options) {
        this.options = options;
    }

    public ExporterOptions options() {
        return options;
    }

    /**
     * Builds the program tree of a circuit without serializing it.
     *
     * @param circuit The circuit to export.
     * @return The program.
     * @throws ExportException if the circuit cannot be exported.
     */
    public Program buildProgram(Circuit circuit) throws ExportException {
        if (circuit == null) {
            throw new ExportException(ExportErrorCode.MALFORMED_INPUT, "Circuit must not be null");
        }
        LOGGER.debug("Exporting circuit '{}' with {} instructions", circuit.name(), circuit.instructions().size());
        return new Qasm3Builder(circuit, options).buildProgram();
    }

    /**
     * Exports a circuit into a string.
     *
     * @param circuit The circuit to export.
     * @return The OpenQASM 3 program text.
     * @throws ExportException if the circuit cannot be exported.
     */
    public String dumps(Circuit circuit) throws ExportException {
        String text = serializer.serialize(buildProgram(circuit));
        LOGGER.debug("Exported circuit '{}' ({} characters)", circuit.name(), text.length());
        return text;
    }

    /**
     * Exports a circuit into a writer. The program is built completely before the first character
     * is written, so an export error never leaves partial output behind. The writer is flushed but
     * not closed.
     *
     * @param circuit The circuit to export.
     * @param writer The destination.
     * @throws ExportException if the circuit cannot be exported, or with
     *         {@link ExportErrorCode#IO_ERROR} if the writer fails.
     */
    public void dump(Circuit circuit, Writer writer) throws ExportException {
        Program program = buildProgram(circuit);
        try {
            serializer.write(program, writer);
            writer.flush();
        } catch (IOException e) {
            throw new ExportException(ExportErrorCode.IO_ERROR,
                    "Failed to write circuit '" + circuit.name() + "': " + e.getMessage(), e);
        }
        LOGGER.debug("Exported circuit '{}' to writer", circuit.name());
    }
}
