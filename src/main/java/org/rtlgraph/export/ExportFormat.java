package org.rtlgraph.export;

import java.util.Locale;

/**
 * Output formats of the {@code graph} command.
 */
public enum ExportFormat {
    DOT,
    JSON;

    /**
     * Parses a format name, case-insensitive.
     *
     * @throws IllegalArgumentException for an unknown name.
     */
    public static ExportFormat parse(String value) {
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "dot" -> DOT;
            case "json" -> JSON;
            default -> throw new IllegalArgumentException("Unknown export format '" + value + "' (expected dot or json)");
        };
    }
}
