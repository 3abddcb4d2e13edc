package org.rtlgraph.builder.lowering;

/**
 * The control-flow nodes a lowered statement is entered at and left from.
 *
 * @param entry First node of the statement, {@link #NONE} if it produced no nodes.
 * @param exit  Node control falls through from, {@link #NONE} if control never falls through
 *              (break, continue) or the statement produced no nodes.
 */
public record Fragment(int entry, int exit) {

    public static final int NONE = -1;

    /** A statement that produced no control-flow nodes. */
    public static final Fragment EMPTY = new Fragment(NONE, NONE);

    public static Fragment single(int nodeId) {
        return new Fragment(nodeId, nodeId);
    }

    public boolean isEmpty() {
        return entry == NONE;
    }

    public boolean fallsThrough() {
        return exit != NONE;
    }
}
