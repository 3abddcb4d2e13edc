package org.rtlgraph.analysis;

import org.rtlgraph.frontend.ast.AstNode;
import org.rtlgraph.frontend.ast.AstNodes;
import org.rtlgraph.frontend.ast.VarRefNode;

import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Collects the variables referenced by a subtree.
 */
public final class VariableCollector {

    private VariableCollector() {}

    /**
     * Returns the distinct variable names referenced anywhere in the subtree, the root included.
     * Iteration order is first occurrence in pre-order.
     *
     * @param root The subtree, may be null.
     * @return The names; empty for a null subtree.
     */
    public static Set<String> collect(AstNode root) {
        Set<String> names = new LinkedHashSet<>();
        for (VarRefNode ref : AstNodes.findAll(root, VarRefNode.class)) {
            if (ref.name() != null && !ref.name().isEmpty()) {
                names.add(ref.name());
            }
        }
        return names;
    }

    /**
     * Returns the name of the first variable reference in pre-order, or null if there is none.
     */
    public static String firstVariable(AstNode root) {
        for (VarRefNode ref : AstNodes.findAll(root, VarRefNode.class)) {
            if (ref.name() != null && !ref.name().isEmpty()) {
                return ref.name();
            }
        }
        return null;
    }
}
