package org.rtlgraph.frontend.verilator;

/**
 * Thrown when the Verilator frontend cannot produce a syntax tree.
 * <p>
 * Carries the frontend's captured output, if any, so the caller can show why elaboration failed.
 */
public class VerilatorException extends RuntimeException {

    private final String output;

    /**
     * Creates a VerilatorException with the specified message.
     *
     * @param message Description of the failure
     * @param output  Captured frontend output, may be empty
     */
    public VerilatorException(String message, String output) {
        super(message);
        this.output = output;
    }

    /**
     * Creates a VerilatorException with the specified message and cause.
     *
     * @param message Description of the failure
     * @param cause The underlying exception that caused the failure
     */
    public VerilatorException(String message, Throwable cause) {
        super(message, cause);
        this.output = "";
    }

    public String getOutput() {
        return output;
    }
}
