package org.rtlgraph.frontend.ast;

import java.util.ArrayList;
import java.util.List;

/**
 * A multi-way dispatch ({@code case}, {@code casez}, {@code casex}).
 *
 * @param selector The dispatched expression, may be null.
 * @param items    The case items in order.
 * @param location Where the statement appears.
 */
public record CaseNode(AstNode selector, List<CaseItemNode> items, SourceLocation location) implements AstNode {

    public CaseNode {
        items = List.copyOf(items);
    }

    @Override
    public List<AstNode> getChildren() {
        List<AstNode> children = new ArrayList<>();
        if (selector != null) {
            children.add(selector);
        }
        children.addAll(items);
        return children;
    }
}
