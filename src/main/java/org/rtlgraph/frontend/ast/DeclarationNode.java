package org.rtlgraph.frontend.ast;

/**
 * A non-port declaration (wire, reg, parameter, genvar). Carries no control or data flow.
 *
 * @param tag      The frontend tag, e.g. "var" or "param".
 * @param name     The declared name, may be null.
 * @param location Where the declaration appears.
 */
public record DeclarationNode(String tag, String name, SourceLocation location) implements AstNode {
}
