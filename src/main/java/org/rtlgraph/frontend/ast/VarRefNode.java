package org.rtlgraph.frontend.ast;

/**
 * A reference to a variable, wire or port.
 *
 * @param name     The referenced name.
 * @param location Where the reference appears.
 */
public record VarRefNode(String name, SourceLocation location) implements AstNode {

    public VarRefNode(String name) {
        this(name, null);
    }
}
