package org.rtlgraph.frontend.ast;

import java.util.List;

/**
 * A sequential {@code begin ... end} block.
 *
 * @param name       The block label, may be null.
 * @param statements The statements in order.
 * @param location   Where the block starts.
 */
public record BeginNode(String name, List<AstNode> statements, SourceLocation location) implements AstNode {

    public BeginNode {
        statements = List.copyOf(statements);
    }

    @Override
    public List<AstNode> getChildren() {
        return statements;
    }
}
