package org.rtlgraph.frontend.ast;

import java.util.List;
import java.util.Map;

/**
 * Any construct the reader has no dedicated variant for. Consumers descend into its children.
 *
 * @param tag        The frontend tag.
 * @param attributes The raw attributes.
 * @param children   The children in document order.
 * @param location   Where the construct appears.
 */
public record UnknownNode(String tag, Map<String, String> attributes, List<AstNode> children,
                          SourceLocation location) implements AstNode {

    public UnknownNode {
        attributes = Map.copyOf(attributes);
        children = List.copyOf(children);
    }

    public UnknownNode(String tag, List<AstNode> children) {
        this(tag, Map.of(), children, null);
    }

    @Override
    public List<AstNode> getChildren() {
        return children;
    }
}
