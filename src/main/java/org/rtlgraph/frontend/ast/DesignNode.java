package org.rtlgraph.frontend.ast;

import java.util.List;

/**
 * Root of a design: the elaborated modules in document order.
 *
 * @param modules The modules of the design.
 */
public record DesignNode(List<ModuleNode> modules) implements AstNode {

    public DesignNode {
        modules = List.copyOf(modules);
    }

    @Override
    public List<AstNode> getChildren() {
        return List.copyOf(modules);
    }
}
