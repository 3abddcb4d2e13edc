package org.rtlgraph.graph;

/**
 * Read-only view of one control-flow node.
 *
 * @param id         Dense node id within its graph.
 * @param label      Display label, may span several lines.
 * @param clusterId  Owning cluster, or null.
 * @param lineNumber Source line, or null.
 */
public record CfgNode(int id, String label, Integer clusterId, Integer lineNumber) {
}
