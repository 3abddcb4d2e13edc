package org.rtlgraph.builder.lowering;

import org.rtlgraph.frontend.ast.BreakNode;

/**
 * Lowers {@code break} into a node wired to the innermost loop's exit. Control does not fall
 * through it.
 */
public final class BreakLowering implements StatementLowering<BreakNode> {

    @Override
    public Fragment lower(BreakNode node, DetailContext ctx) {
        int id = ctx.addNode("break", node);
        DetailContext.LoopFrame loop = ctx.innermostLoop();
        if (loop == null) {
            ctx.module().reportMalformed("break outside of a loop", node);
            return Fragment.single(id);
        }
        ctx.edge(id, loop.exit());
        return new Fragment(id, Fragment.NONE);
    }
}
