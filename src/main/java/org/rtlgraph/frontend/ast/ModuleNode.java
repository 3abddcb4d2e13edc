package org.rtlgraph.frontend.ast;

import java.util.List;

/**
 * A module definition.
 *
 * @param name     The module name.
 * @param items    Ports, declarations, procedural blocks, assignments and instances in document order.
 * @param location Where the module is defined.
 */
public record ModuleNode(String name, List<AstNode> items, SourceLocation location) implements AstNode {

    public ModuleNode {
        items = List.copyOf(items);
    }

    @Override
    public List<AstNode> getChildren() {
        return items;
    }
}
