package org.rtlgraph.frontend.ast;

/**
 * A literal constant as spelled by the frontend, e.g. {@code 8'h0} or {@code 32'sh1}.
 *
 * @param value The constant text.
 */
public record ConstNode(String value) implements AstNode {
}
