package org.rtlgraph.builder.lowering;

import org.rtlgraph.analysis.ExpressionFormatter;
import org.rtlgraph.frontend.ast.IfNode;

import java.util.Set;

/**
 * Lowers a conditional into a condition node, the two branches and a join node.
 *
 * <p>A missing branch becomes a direct edge from the condition to the join, labelled with the
 * branch it stands for. Each present branch is entered on its label and its fall-through exit
 * is wired to the join.</p>
 */
public final class IfLowering implements StatementLowering<IfNode> {

    static final String TRUE = "True";
    static final String FALSE = "False";

    @Override
    public Fragment lower(IfNode node, DetailContext ctx) {
        if (node.condition() == null) {
            ctx.module().reportMalformed("if statement without a condition", node);
        }
        Set<String> uses = ctx.expressions().latestReads(node.condition());
        ctx.expressions().lower(node.condition());

        String condition = node.condition() == null ? "?" : ExpressionFormatter.format(node.condition());
        int conditionNode = ctx.addNode("if (" + condition + ")\nUSE: " + DetailContext.formatUses(uses), node);
        ctx.graph().setUses(conditionNode, uses);
        int join = ctx.addNode("EndIf", null);

        wireBranch(ctx, conditionNode, ctx.lower(node.thenBranch()), join, TRUE);
        wireBranch(ctx, conditionNode, ctx.lower(node.elseBranch()), join, FALSE);
        return new Fragment(conditionNode, join);
    }

    private static void wireBranch(DetailContext ctx, int condition, Fragment branch, int join, String label) {
        if (branch.isEmpty()) {
            ctx.edge(condition, join, label);
            return;
        }
        ctx.edge(condition, branch.entry(), label);
        ctx.connect(branch, join);
    }
}
