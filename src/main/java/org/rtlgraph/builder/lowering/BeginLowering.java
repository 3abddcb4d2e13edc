package org.rtlgraph.builder.lowering;

import org.rtlgraph.frontend.ast.BeginNode;

/**
 * Chains the statements of a {@code begin ... end} block.
 */
public final class BeginLowering implements StatementLowering<BeginNode> {

    @Override
    public Fragment lower(BeginNode node, DetailContext ctx) {
        return ctx.lowerSequence(node.statements());
    }
}
