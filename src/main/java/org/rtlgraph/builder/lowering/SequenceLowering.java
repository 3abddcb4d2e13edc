package org.rtlgraph.builder.lowering;

import org.rtlgraph.frontend.ast.AstNode;

/**
 * Fallback for statements without a dedicated lowering: descends into the children and chains
 * them in document order.
 */
public final class SequenceLowering implements StatementLowering<AstNode> {

    @Override
    public Fragment lower(AstNode node, DetailContext ctx) {
        return ctx.lowerSequence(node.getChildren());
    }
}
