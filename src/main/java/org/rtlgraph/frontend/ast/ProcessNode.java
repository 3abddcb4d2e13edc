package org.rtlgraph.frontend.ast;

import java.util.ArrayList;
import java.util.List;

/**
 * A procedural block: always/initial variants, functions and tasks.
 *
 * @param kind        The block kind.
 * @param name        The block name (functions, tasks, named blocks), may be null.
 * @param sensitivity The sensitivity list, null when the block has none.
 * @param body        The statements of the block in document order.
 * @param location    Where the block starts.
 */
public record ProcessNode(
        ProcessKind kind,
        String name,
        SensitivityNode sensitivity,
        List<AstNode> body,
        SourceLocation location
) implements AstNode {

    public ProcessNode {
        body = List.copyOf(body);
    }

    @Override
    public List<AstNode> getChildren() {
        List<AstNode> children = new ArrayList<>();
        if (sensitivity != null) {
            children.add(sensitivity);
        }
        children.addAll(body);
        return children;
    }
}
