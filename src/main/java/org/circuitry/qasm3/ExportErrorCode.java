package org.circuitry.qasm3;

/**
 * Testable error codes for every failure of an export, independent of the message text.
 */
public enum ExportErrorCode {
    /** An instruction the exporter cannot lower, e.g. a non-equality condition. */
    UNSUPPORTED_CONSTRUCT,
    /** The circuit violates the input contract, e.g. a condition without a target. */
    MALFORMED_INPUT,
    /** The output stream failed while the program was written. */
    IO_ERROR
}
