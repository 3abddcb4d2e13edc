package org.rtlgraph.graph;

/**
 * "The value at {@code source} feeds {@code target}."
 */
public record DfgEdge(int source, int target) {
}
