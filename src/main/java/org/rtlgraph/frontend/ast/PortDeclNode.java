package org.rtlgraph.frontend.ast;

/**
 * A module port declaration ({@code input a}, {@code output y}, ...).
 *
 * @param name      The port name.
 * @param direction The normalized port direction.
 * @param location  Where the port is declared.
 */
public record PortDeclNode(String name, PortDirection direction, SourceLocation location) implements AstNode {
}
