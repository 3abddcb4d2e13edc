package org.rtlgraph.builder.lowering;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntList;
import it.unimi.dsi.fastutil.ints.IntLists;
import org.rtlgraph.analysis.VariableCollector;
import org.rtlgraph.builder.SsaState;
import org.rtlgraph.frontend.ast.AstNode;
import org.rtlgraph.frontend.ast.ConstNode;
import org.rtlgraph.frontend.ast.OperatorNode;
import org.rtlgraph.frontend.ast.VarRefNode;
import org.rtlgraph.graph.GraphModel;

import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Lowers expressions into the data-flow graph.
 *
 * <p>Every operator becomes a synthetic node named {@code op_result_<KIND>_<id>}, fed by the
 * nodes of its operands. A variable contributes the node of its latest SSA version; constants
 * contribute nothing.</p>
 */
public final class ExpressionLowering {

    private final GraphModel graph;
    private final SsaState ssa;

    public ExpressionLowering(GraphModel graph, SsaState ssa) {
        this.graph = graph;
        this.ssa = ssa;
    }

    /**
     * Lowers an expression.
     *
     * @param expression The expression, may be null.
     * @return The data-flow nodes producing the expression's value.
     */
    public IntList lower(AstNode expression) {
        if (expression == null || expression instanceof ConstNode) {
            return IntLists.emptyList();
        }
        if (expression instanceof VarRefNode ref) {
            if (ref.name() == null || ref.name().isEmpty()) {
                return IntLists.emptyList();
            }
            return IntLists.singleton(graph.dfgNode(ssa.latest(ref.name())));
        }
        if (expression instanceof OperatorNode op) {
            String name = "op_result_" + op.operator().dfgKind() + "_" + graph.nextDfgNodeId();
            int result = graph.dfgNode(name);
            for (AstNode operand : op.operands()) {
                IntList inputs = lower(operand);
                for (int i = 0; i < inputs.size(); i++) {
                    graph.dfgEdge(inputs.getInt(i), result);
                }
            }
            return IntLists.singleton(result);
        }
        IntList outputs = new IntArrayList();
        for (AstNode child : expression.getChildren()) {
            outputs.addAll(lower(child));
        }
        return outputs;
    }

    /**
     * Returns the latest SSA names of all variables an expression reads.
     */
    public Set<String> latestReads(AstNode expression) {
        Set<String> reads = new LinkedHashSet<>();
        for (String variable : VariableCollector.collect(expression)) {
            reads.add(ssa.latest(variable));
        }
        return reads;
    }
}
