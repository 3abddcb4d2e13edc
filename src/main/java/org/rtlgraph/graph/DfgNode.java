package org.rtlgraph.graph;

/**
 * A data-flow value.
 *
 * @param id   Dense node id within its graph.
 * @param name SSA-qualified variable name ({@code count_2}), a free variable ({@code a}) or a
 *             synthetic operation result ({@code op_result_ADD_4}).
 */
public record DfgNode(int id, String name) {
}
