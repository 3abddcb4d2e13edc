package org.rtlgraph.frontend.ast;

import java.util.List;

/**
 * An operator application.
 *
 * @param operator The operator.
 * @param operands The operands in order. The frontend may supply more or fewer than the operator's arity.
 * @param location Where the expression appears.
 */
public record OperatorNode(Operator operator, List<AstNode> operands, SourceLocation location) implements AstNode {

    public OperatorNode {
        operands = List.copyOf(operands);
    }

    public OperatorNode(Operator operator, AstNode... operands) {
        this(operator, List.of(operands), null);
    }

    @Override
    public List<AstNode> getChildren() {
        return operands;
    }
}
