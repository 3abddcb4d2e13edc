package org.rtlgraph.builder.lowering;

import org.rtlgraph.frontend.ast.ContinueNode;

/**
 * Lowers {@code continue} into a node wired back to the innermost loop's header.
 */
public final class ContinueLowering implements StatementLowering<ContinueNode> {

    @Override
    public Fragment lower(ContinueNode node, DetailContext ctx) {
        int id = ctx.addNode("continue", node);
        DetailContext.LoopFrame loop = ctx.innermostLoop();
        if (loop == null) {
            ctx.module().reportMalformed("continue outside of a loop", node);
            return Fragment.single(id);
        }
        ctx.edge(id, loop.header());
        return new Fragment(id, Fragment.NONE);
    }
}
