package org.rtlgraph.frontend.ast;

/**
 * A {@code break} out of the innermost loop.
 */
public record BreakNode(SourceLocation location) implements AstNode {
}
