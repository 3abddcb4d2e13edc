package org.rtlgraph.frontend.ast;

/**
 * Kinds of procedural blocks. The keyword is the tag the frontend uses for the block.
 */
public enum ProcessKind {
    ALWAYS("always"),
    ALWAYS_COMB("always_comb"),
    ALWAYS_FF("always_ff"),
    ALWAYS_LATCH("always_latch"),
    INITIAL("initial"),
    FINAL("final"),
    FUNCTION("function"),
    TASK("task");

    private final String keyword;

    ProcessKind(String keyword) {
        this.keyword = keyword;
    }

    public String keyword() {
        return keyword;
    }

    /**
     * Whether this kind is an always/initial style block rather than a subroutine.
     */
    public boolean isAlwaysOrInitial() {
        return this == ALWAYS || this == ALWAYS_COMB || this == ALWAYS_FF || this == INITIAL;
    }

    /**
     * Looks up a kind by its frontend tag.
     *
     * @param tag The tag, case-insensitive.
     * @return The kind, or null if the tag names no procedural block.
     */
    public static ProcessKind fromTag(String tag) {
        if (tag == null) {
            return null;
        }
        for (ProcessKind kind : values()) {
            if (kind.keyword.equalsIgnoreCase(tag)) {
                return kind;
            }
        }
        return null;
    }
}
