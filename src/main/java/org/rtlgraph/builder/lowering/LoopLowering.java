package org.rtlgraph.builder.lowering;

import org.rtlgraph.analysis.ExpressionFormatter;
import org.rtlgraph.frontend.ast.LoopKind;
import org.rtlgraph.frontend.ast.LoopNode;

import java.util.Set;

/**
 * Lowers a loop into its init statements, a header node and a generated exit node.
 *
 * <p>The body is entered from the header on True and loops back to it; False leaves to the
 * exit. {@code break} and {@code continue} inside the body target the exit and the header.
 * A do-while loop is entered at its body.</p>
 */
public final class LoopLowering implements StatementLowering<LoopNode> {

    @Override
    public Fragment lower(LoopNode node, DetailContext ctx) {
        Fragment init = ctx.lowerSequence(node.init());

        Set<String> uses = ctx.expressions().latestReads(node.condition());
        ctx.expressions().lower(node.condition());

        String condition = node.condition() == null ? "" : " (" + ExpressionFormatter.format(node.condition()) + ")";
        int header = ctx.addNode(node.kind().keyword() + condition + "\nUSE: " + DetailContext.formatUses(uses), node);
        ctx.graph().setUses(header, uses);
        int exit = ctx.addNode("LoopExit", null);

        ctx.pushLoop(header, exit);
        Fragment body;
        try {
            body = ctx.lowerSequence(node.body());
        } finally {
            ctx.popLoop();
        }

        if (!body.isEmpty()) {
            ctx.edge(header, body.entry(), IfLowering.TRUE);
            ctx.connect(body, header);
        }
        ctx.edge(header, exit, IfLowering.FALSE);

        int loopEntry = node.kind() == LoopKind.DO_WHILE && !body.isEmpty() ? body.entry() : header;
        if (init.isEmpty()) {
            return new Fragment(loopEntry, exit);
        }
        ctx.connect(init, loopEntry);
        return new Fragment(init.entry(), exit);
    }
}
