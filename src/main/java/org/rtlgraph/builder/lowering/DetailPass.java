package org.rtlgraph.builder.lowering;

import org.rtlgraph.analysis.ExpressionFormatter;
import org.rtlgraph.builder.ModuleTraversalContext;
import org.rtlgraph.frontend.ast.AssignNode;
import org.rtlgraph.frontend.ast.AstNode;
import org.rtlgraph.frontend.ast.ProcessNode;
import org.rtlgraph.frontend.ast.SensitivityNode;
import org.rtlgraph.graph.GraphModel;

import java.util.stream.Collectors;

/**
 * Builds the statement-level detail graph of one procedural block or continuous assignment.
 *
 * <p>Versions allocated here come from the module's shared SSA state, so a variable written
 * in several blocks keeps increasing its version across their detail graphs.</p>
 */
public final class DetailPass {

    private final LoweringRegistry registry;

    public DetailPass(LoweringRegistry registry) {
        this.registry = registry;
    }

    /**
     * Builds a detail graph.
     *
     * @param key    The sub-graph key, used as the graph name.
     * @param block  A {@link ProcessNode}, an {@link AssignNode} or any other module item.
     * @param module The traversal context of the enclosing module.
     * @return The populated detail graph.
     */
    public GraphModel build(String key, AstNode block, ModuleTraversalContext module) {
        GraphModel graph = new GraphModel(key);
        int cluster = graph.addCluster(clusterName(block), module.options().blockClusterColor());
        DetailContext ctx = new DetailContext(graph, cluster, module, registry);

        if (block instanceof ProcessNode process) {
            int entry = ctx.addNode("Enter " + process.kind().keyword(), process);
            Fragment body = ctx.lowerSequence(process.body());
            if (!body.isEmpty()) {
                ctx.edge(entry, body.entry());
            }
        } else {
            ctx.lower(block);
        }
        return graph;
    }

    /**
     * Display name of a block's cluster, e.g. {@code always @(posedge clk or negedge rst_n)}.
     */
    public static String clusterName(AstNode block) {
        if (block instanceof ProcessNode process) {
            String name = process.kind().keyword();
            if (process.name() != null && !process.name().isEmpty()) {
                name += " " + process.name();
            }
            SensitivityNode sensitivity = process.sensitivity();
            if (sensitivity != null && !sensitivity.items().isEmpty()) {
                name += " @(" + sensitivity.items().stream()
                        .map(item -> (item.edge() != null ? item.edge() + " " : "") + ExpressionFormatter.format(item.signal()))
                        .collect(Collectors.joining(" or ")) + ")";
            }
            return name;
        }
        if (block instanceof AssignNode assign) {
            return "assign " + ExpressionFormatter.format(assign.target());
        }
        return "block";
    }
}
