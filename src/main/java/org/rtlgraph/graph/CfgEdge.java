package org.rtlgraph.graph;

/**
 * A directed control-flow (or, in the architecture graph, connection) edge.
 *
 * @param source The source node id.
 * @param target The target node id.
 * @param label  The edge label, never null.
 */
public record CfgEdge(int source, int target, EdgeLabel label) {

    public CfgEdge {
        if (label == null) {
            label = EdgeLabel.none();
        }
    }
}
