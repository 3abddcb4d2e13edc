package org.rtlgraph.frontend.ast;

/**
 * A {@code continue} to the innermost loop header.
 */
public record ContinueNode(SourceLocation location) implements AstNode {
}
