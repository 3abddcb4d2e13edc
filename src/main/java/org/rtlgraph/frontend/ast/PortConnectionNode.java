package org.rtlgraph.frontend.ast;

import java.util.List;

/**
 * Binds one port of an instance to an expression of the enclosing module.
 *
 * @param portName   The port of the instantiated module.
 * @param direction  The direction string as supplied by the frontend (not normalized), may be null.
 * @param expression The bound expression, may be null for unconnected ports.
 */
public record PortConnectionNode(String portName, String direction, AstNode expression) implements AstNode {

    @Override
    public List<AstNode> getChildren() {
        return expression != null ? List.of(expression) : List.of();
    }
}
