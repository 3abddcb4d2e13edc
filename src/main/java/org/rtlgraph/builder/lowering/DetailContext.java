package org.rtlgraph.builder.lowering;

import org.rtlgraph.builder.ModuleTraversalContext;
import org.rtlgraph.builder.SsaState;
import org.rtlgraph.frontend.ast.AstNode;
import org.rtlgraph.graph.EdgeLabel;
import org.rtlgraph.graph.GraphModel;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Set;

/**
 * State of one detail-graph build: the graph, its block cluster, the enclosing loops and access
 * to the module-wide SSA state.
 */
public final class DetailContext {

    /**
     * Targets of {@code break} and {@code continue} inside one loop.
     */
    public record LoopFrame(int header, int exit) {}

    private final GraphModel graph;
    private final int clusterId;
    private final ModuleTraversalContext module;
    private final LoweringRegistry registry;
    private final ExpressionLowering expressions;
    private final Deque<LoopFrame> loops = new ArrayDeque<>();

    public DetailContext(GraphModel graph, int clusterId, ModuleTraversalContext module, LoweringRegistry registry) {
        this.graph = graph;
        this.clusterId = clusterId;
        this.module = module;
        this.registry = registry;
        this.expressions = new ExpressionLowering(graph, module.ssa());
    }

    public GraphModel graph() {
        return graph;
    }

    public ModuleTraversalContext module() {
        return module;
    }

    public SsaState ssa() {
        return module.ssa();
    }

    public ExpressionLowering expressions() {
        return expressions;
    }

    /**
     * Lowers a single statement through the registry.
     *
     * @param node The statement, may be null.
     * @return The fragment, {@link Fragment#EMPTY} for a null statement.
     */
    public Fragment lower(AstNode node) {
        if (node == null) {
            return Fragment.EMPTY;
        }
        return registry.resolve(node).lower(node, this);
    }

    /**
     * Lowers statements in order and chains each fall-through exit to the next entry.
     * Statements following a break or continue stay unconnected.
     *
     * @param statements The statements.
     * @return Entry of the first non-empty statement and exit of the last one.
     */
    public Fragment lowerSequence(List<? extends AstNode> statements) {
        int entry = Fragment.NONE;
        int exit = Fragment.NONE;
        for (AstNode statement : statements) {
            Fragment fragment = lower(statement);
            if (fragment.isEmpty()) {
                continue;
            }
            if (entry == Fragment.NONE) {
                entry = fragment.entry();
            } else if (exit != Fragment.NONE) {
                graph.addCfgEdge(exit, fragment.entry());
            }
            exit = fragment.exit();
        }
        return new Fragment(entry, exit);
    }

    /**
     * Adds a node to the block cluster and annotates it with the origin's source line.
     *
     * @param label  The node label.
     * @param origin The statement the node stands for, may be null for synthetic nodes.
     * @return The node id.
     */
    public int addNode(String label, AstNode origin) {
        int id = graph.addCfgNode(label, clusterId);
        int line = ModuleTraversalContext.lineOf(origin);
        if (line > 0) {
            graph.setLineNumber(id, line);
            String text = module.sourceLine(line);
            if (text != null) {
                graph.setSourceText(id, text);
            }
        }
        return id;
    }

    public void edge(int source, int target) {
        graph.addCfgEdge(source, target, EdgeLabel.none());
    }

    public void edge(int source, int target, String label) {
        graph.addCfgEdge(source, target, EdgeLabel.of(label));
    }

    /**
     * Wires a fragment's exit to a target if control falls through it.
     */
    public void connect(Fragment fragment, int target) {
        if (fragment.fallsThrough()) {
            graph.addCfgEdge(fragment.exit(), target, EdgeLabel.none());
        }
    }

    // --- Loop scope ---

    public void pushLoop(int header, int exit) {
        loops.push(new LoopFrame(header, exit));
    }

    public void popLoop() {
        loops.pop();
    }

    /**
     * Returns the innermost enclosing loop, or null outside any loop.
     */
    public LoopFrame innermostLoop() {
        return loops.peek();
    }

    /**
     * Renders a USE set for a node label.
     */
    public static String formatUses(Set<String> uses) {
        return uses.isEmpty() ? "none" : String.join(", ", uses);
    }
}
