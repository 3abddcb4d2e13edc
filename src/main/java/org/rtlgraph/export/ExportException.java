package org.rtlgraph.export;

/**
 * Thrown when rendered graphs cannot be written.
 */
public class ExportException extends RuntimeException {

    /**
     * Creates an ExportException with the specified message and cause.
     *
     * @param message Description of the failure
     * @param cause The underlying exception that caused the failure
     */
    public ExportException(String message, Throwable cause) {
        super(message, cause);
    }
}
