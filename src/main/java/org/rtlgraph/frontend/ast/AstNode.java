package org.rtlgraph.frontend.ast;

import java.util.List;

/**
 * A node of the hardware-description syntax tree handed over by the frontend.
 *
 * <p>The set of variants is closed: statements and expressions each carry only the fields of
 * their own shape, and anything the reader does not recognize arrives as an {@link UnknownNode}
 * so consumers can fall back to a generic traversal.</p>
 */
public sealed interface AstNode permits DesignNode, ModuleNode, PortDeclNode, DeclarationNode,
        ProcessNode, SensitivityNode, AssignNode, BeginNode, IfNode, CaseNode, CaseItemNode,
        LoopNode, BreakNode, ContinueNode, InstanceNode, PortConnectionNode, VarRefNode,
        ConstNode, OperatorNode, TernaryNode, UnknownNode {

    /**
     * Returns the structural children of this node in document order.
     *
     * @return the children, never null.
     */
    default List<AstNode> getChildren() {
        return List.of();
    }

    /**
     * Returns the source location of this node, or null if the frontend did not supply one.
     */
    default SourceLocation location() {
        return null;
    }
}
