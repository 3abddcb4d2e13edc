package org.rtlgraph.frontend.ast;

/**
 * Position of a syntax-tree node in the HDL source.
 *
 * @param fileId The frontend's file identifier (e.g. Verilator's "d" or "e").
 * @param line   The 1-based first line of the construct.
 * @param column The 1-based first column of the construct.
 */
public record SourceLocation(String fileId, int line, int column) {

    /**
     * Parses a Verilator-style locator {@code "fileId,line,col[,lastLine,lastCol]"}.
     *
     * @param loc The raw attribute value, may be null.
     * @return The parsed location, or null if the value is absent or malformed.
     */
    public static SourceLocation parse(String loc) {
        if (loc == null || loc.isBlank()) {
            return null;
        }
        String[] parts = loc.split(",");
        if (parts.length < 2) {
            return null;
        }
        try {
            int line = Integer.parseInt(parts[1].trim());
            int column = parts.length > 2 ? Integer.parseInt(parts[2].trim()) : 0;
            return new SourceLocation(parts[0].trim(), line, column);
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
