package org.rtlgraph.builder.lowering;

import org.rtlgraph.frontend.ast.AssignNode;
import org.rtlgraph.frontend.ast.AstNode;
import org.rtlgraph.frontend.ast.BeginNode;
import org.rtlgraph.frontend.ast.BreakNode;
import org.rtlgraph.frontend.ast.CaseNode;
import org.rtlgraph.frontend.ast.ConstNode;
import org.rtlgraph.frontend.ast.ContinueNode;
import org.rtlgraph.frontend.ast.DeclarationNode;
import org.rtlgraph.frontend.ast.IfNode;
import org.rtlgraph.frontend.ast.LoopNode;
import org.rtlgraph.frontend.ast.OperatorNode;
import org.rtlgraph.frontend.ast.PortDeclNode;
import org.rtlgraph.frontend.ast.SensitivityNode;
import org.rtlgraph.frontend.ast.TernaryNode;
import org.rtlgraph.frontend.ast.UnknownNode;
import org.rtlgraph.frontend.ast.VarRefNode;

import java.util.HashMap;
import java.util.Map;

/**
 * Registry mapping statement variants to their lowering. Variants without an entry are lowered
 * by {@link SequenceLowering}, which descends into the children and chains them in document
 * order.
 */
public final class LoweringRegistry {

    private final Map<Class<? extends AstNode>, StatementLowering<?>> lowerings = new HashMap<>();
    private final StatementLowering<AstNode> fallback;

    public LoweringRegistry(StatementLowering<AstNode> fallback) {
        this.fallback = fallback;
    }

    /**
     * Registers the lowering for a statement variant, replacing any previous one.
     */
    public <T extends AstNode> void register(Class<T> nodeType, StatementLowering<T> lowering) {
        lowerings.put(nodeType, lowering);
    }

    /**
     * Resolves the lowering for a node, falling back to the generic one.
     *
     * @param node The statement.
     * @return The lowering, never null.
     */
    @SuppressWarnings("unchecked")
    public StatementLowering<AstNode> resolve(AstNode node) {
        StatementLowering<?> lowering = lowerings.get(node.getClass());
        return lowering != null ? (StatementLowering<AstNode>) lowering : fallback;
    }

    /**
     * Creates a registry with the lowerings for all statement variants.
     */
    public static LoweringRegistry initializeWithDefaults() {
        LoweringRegistry registry = new LoweringRegistry(new SequenceLowering());

        registry.register(AssignNode.class, new AssignLowering());
        registry.register(BeginNode.class, new BeginLowering());
        registry.register(IfNode.class, new IfLowering());
        registry.register(CaseNode.class, new CaseLowering());
        registry.register(LoopNode.class, new LoopLowering());
        registry.register(BreakNode.class, new BreakLowering());
        registry.register(ContinueNode.class, new ContinueLowering());
        registry.register(UnknownNode.class, new UnknownLowering());

        // Declarations and bare expressions produce no control flow.
        StatementLowering<AstNode> none = (node, ctx) -> Fragment.EMPTY;
        registry.register(DeclarationNode.class, none::lower);
        registry.register(PortDeclNode.class, none::lower);
        registry.register(SensitivityNode.class, none::lower);
        registry.register(VarRefNode.class, none::lower);
        registry.register(ConstNode.class, none::lower);
        registry.register(OperatorNode.class, none::lower);
        registry.register(TernaryNode.class, none::lower);

        return registry;
    }
}
