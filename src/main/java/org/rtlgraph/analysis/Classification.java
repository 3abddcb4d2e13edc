package org.rtlgraph.analysis;

/**
 * Result of classifying a block.
 *
 * @param kind  The heuristic role.
 * @param label The display label, e.g. "Counter" or "Block: task".
 */
public record Classification(BlockKind kind, String label) {

    public static Classification of(BlockKind kind) {
        return new Classification(kind, kind.label());
    }

    public static Classification other(String tag) {
        return new Classification(BlockKind.OTHER, BlockKind.OTHER.label() + ": " + tag);
    }
}
