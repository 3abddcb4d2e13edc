package org.rtlgraph.builder.lowering;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntList;
import org.rtlgraph.analysis.ExpressionFormatter;
import org.rtlgraph.analysis.VariableCollector;
import org.rtlgraph.frontend.ast.AssignNode;
import org.rtlgraph.frontend.ast.AstNode;
import org.rtlgraph.graph.GraphModel;

import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Lowers an assignment into one control-flow node and a new SSA version of the written variable.
 *
 * <p>The right-hand side is lowered first, so reads of the written variable refer to its
 * previous version. The node label reads {@code lhs OP rhs} followed by the DEF and USE sets.</p>
 */
public final class AssignLowering implements StatementLowering<AssignNode> {

    /** Stand-in for a write target without a variable reference. */
    public static final String UNNAMED = "<unnamed>";

    @Override
    public Fragment lower(AssignNode node, DetailContext ctx) {
        GraphModel graph = ctx.graph();

        String lhs = VariableCollector.firstVariable(node.target());
        if (lhs == null) {
            lhs = UNNAMED;
            ctx.module().reportMalformed("assignment without a target variable", node);
        }
        if (node.rhs() == null) {
            ctx.module().reportMalformed("assignment to '" + lhs + "' without a right-hand side", node);
        }

        Set<String> uses = new LinkedHashSet<>();
        IntList outputs = new IntArrayList();
        for (AstNode source : node.sources()) {
            uses.addAll(ctx.expressions().latestReads(source));
            outputs.addAll(ctx.expressions().lower(source));
        }

        String def = ctx.ssa().newVersion(lhs);
        int defNode = graph.dfgNode(def);
        for (int i = 0; i < outputs.size(); i++) {
            graph.dfgEdge(outputs.getInt(i), defNode);
        }

        String label = lhs + " " + node.kind().operator() + " " + ExpressionFormatter.format(node.rhs())
                + "\nDEF: " + def
                + "\nUSE: " + DetailContext.formatUses(uses);
        int id = ctx.addNode(label, node);
        graph.setDef(id, def);
        graph.setUses(id, uses);
        return Fragment.single(id);
    }
}
