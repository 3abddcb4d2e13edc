package org.rtlgraph.frontend.ast;

import java.util.Locale;

/**
 * Direction of a module port or of an instance pin.
 */
public enum PortDirection {
    IN("input"),
    OUT("output"),
    INOUT("inout");

    private final String keyword;

    PortDirection(String keyword) {
        this.keyword = keyword;
    }

    public String keyword() {
        return keyword;
    }

    /**
     * Normalizes a frontend direction string. Unrecognized or missing values map to {@link #INOUT}.
     *
     * @param value e.g. "in", "input", "OUT", "output", "inout"
     * @return the normalized direction
     */
    public static PortDirection normalize(String value) {
        if (value == null) {
            return INOUT;
        }
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "in", "input" -> IN;
            case "out", "output" -> OUT;
            default -> INOUT;
        };
    }
}
