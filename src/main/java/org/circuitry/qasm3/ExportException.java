package org.circuitry.qasm3;

/**
 * Thrown when a circuit cannot be exported. No output is produced by a failed export.
 */
public class ExportException extends Exception {

    private final ExportErrorCode code;

    /**
     * @param code The error code.
     * @param message The detail message.
     */
    public ExportException(ExportErrorCode code, String message) {
        super(message);
        this.code = code;
    }

    /**
     * @param code The error code.
     * @param message The detail message.
     * @param cause The cause.
     */
    public ExportException(ExportErrorCode code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    public ExportErrorCode code() {
        return code;
    }

    @Override
    public String toString() {
        return String.format("[%s] %s", code, getMessage());
    }
}
