package org.rtlgraph.frontend.ast;

import java.util.ArrayList;
import java.util.List;

/**
 * A conditional statement.
 *
 * @param condition  The condition expression, may be null when the frontend omitted it.
 * @param thenBranch The statement taken when the condition holds, may be null.
 * @param elseBranch The statement taken otherwise, may be null.
 * @param location   Where the statement appears.
 */
public record IfNode(AstNode condition, AstNode thenBranch, AstNode elseBranch, SourceLocation location)
        implements AstNode {

    @Override
    public List<AstNode> getChildren() {
        List<AstNode> children = new ArrayList<>(3);
        if (condition != null) children.add(condition);
        if (thenBranch != null) children.add(thenBranch);
        if (elseBranch != null) children.add(elseBranch);
        return children;
    }
}
