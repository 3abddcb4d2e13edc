package org.rtlgraph.diagnostics;

/**
 * A single reported finding.
 *
 * @param severity   How severe the finding is.
 * @param category   What kind of problem it is.
 * @param message    Human-readable description.
 * @param sourceName The module or file the finding refers to, may be null.
 * @param lineNumber The source line, or 0 if unknown.
 */
public record Diagnostic(Severity severity, DiagnosticCategory category, String message,
                         String sourceName, int lineNumber) {

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(severity.name()).append(" [").append(category).append(']');
        if (sourceName != null) {
            sb.append(' ').append(sourceName);
            if (lineNumber > 0) {
                sb.append(':').append(lineNumber);
            }
        }
        return sb.append(": ").append(message).toString();
    }
}
