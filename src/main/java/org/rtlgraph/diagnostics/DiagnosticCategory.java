package org.rtlgraph.diagnostics;

/**
 * What went wrong, independent of how severe it is.
 */
public enum DiagnosticCategory {
    /** An expected child or attribute was absent; a sentinel or skipped edge was used instead. */
    MALFORMED_INPUT,
    /** A construct had no specific rule and was handled by the generic traversal. */
    UNRECOGNIZED_CONSTRUCT,
    /** A block matched none of the classification heuristics and got the default label. */
    CLASSIFICATION_AMBIGUITY,
    /** A failure outside the graph core (reading input, writing output). */
    IO
}
