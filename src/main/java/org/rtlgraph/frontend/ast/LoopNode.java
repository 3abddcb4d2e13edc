package org.rtlgraph.frontend.ast;

import java.util.ArrayList;
import java.util.List;

/**
 * A loop statement.
 *
 * @param kind      The loop flavour.
 * @param init      Initialization statements executed once before the header (for loops).
 * @param condition The loop condition or repeat count, may be null.
 * @param body      The loop body statements.
 * @param location  Where the loop appears.
 */
public record LoopNode(LoopKind kind, List<AstNode> init, AstNode condition, List<AstNode> body,
                       SourceLocation location) implements AstNode {

    public LoopNode {
        init = List.copyOf(init);
        body = List.copyOf(body);
    }

    @Override
    public List<AstNode> getChildren() {
        List<AstNode> children = new ArrayList<>(init);
        if (condition != null) {
            children.add(condition);
        }
        children.addAll(body);
        return children;
    }
}
