package org.rtlgraph.builder.lowering;

import org.rtlgraph.frontend.ast.UnknownNode;

/**
 * Reports a construct the reader did not recognize and lowers its children in order.
 */
public final class UnknownLowering implements StatementLowering<UnknownNode> {

    @Override
    public Fragment lower(UnknownNode node, DetailContext ctx) {
        ctx.module().reportUnrecognized("no dedicated lowering for <" + node.tag() + ">", node);
        return ctx.lowerSequence(node.children());
    }
}
