package org.rtlgraph.frontend.ast;

import java.util.ArrayList;
import java.util.List;

/**
 * One arm of a {@link CaseNode}. An item without values is the default arm.
 *
 * @param values     The matched values.
 * @param statements The statements executed for this arm.
 * @param location   Where the arm appears.
 */
public record CaseItemNode(List<AstNode> values, List<AstNode> statements, SourceLocation location)
        implements AstNode {

    public CaseItemNode {
        values = List.copyOf(values);
        statements = List.copyOf(statements);
    }

    public boolean isDefault() {
        return values.isEmpty();
    }

    @Override
    public List<AstNode> getChildren() {
        List<AstNode> children = new ArrayList<>(values);
        children.addAll(statements);
        return children;
    }
}
