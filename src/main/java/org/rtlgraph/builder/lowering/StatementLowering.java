package org.rtlgraph.builder.lowering;

import org.rtlgraph.frontend.ast.AstNode;

/**
 * Lowers one kind of statement into control-flow nodes and data-flow edges of a detail graph.
 *
 * <p>Implementations are stateless; all output goes through the {@link DetailContext}.</p>
 *
 * @param <T> The statement variant handled.
 */
public interface StatementLowering<T extends AstNode> {

    /**
     * Lowers a statement.
     *
     * @param node The statement.
     * @param ctx  The detail graph being built.
     * @return Where control enters and leaves the lowered statement.
     */
    Fragment lower(T node, DetailContext ctx);
}
