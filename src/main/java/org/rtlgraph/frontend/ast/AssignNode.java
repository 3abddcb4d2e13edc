package org.rtlgraph.frontend.ast;

import java.util.ArrayList;
import java.util.List;

/**
 * An assignment. Mirrors the frontend's positional layout: every child but the last is read,
 * the last child is the write target.
 *
 * @param kind     Blocking, non-blocking or continuous.
 * @param sources  The read children, usually a single right-hand-side expression.
 * @param target   The written child, may be null when the frontend omitted it.
 * @param location Where the assignment appears.
 */
public record AssignNode(AssignKind kind, List<AstNode> sources, AstNode target, SourceLocation location)
        implements AstNode {

    public AssignNode {
        sources = List.copyOf(sources);
    }

    /**
     * Returns the right-hand side, i.e. the first read child, or null if there is none.
     */
    public AstNode rhs() {
        return sources.isEmpty() ? null : sources.get(0);
    }

    @Override
    public List<AstNode> getChildren() {
        List<AstNode> children = new ArrayList<>(sources);
        if (target != null) {
            children.add(target);
        }
        return children;
    }
}
