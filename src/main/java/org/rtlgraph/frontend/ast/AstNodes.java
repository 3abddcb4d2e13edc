package org.rtlgraph.frontend.ast;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Traversal helpers over syntax trees.
 */
public final class AstNodes {

    private AstNodes() {}

    /**
     * Lists a subtree in pre-order (node before its children, children in document order).
     *
     * @param root The subtree root, may be null.
     * @return All nodes of the subtree including the root; empty for a null root.
     */
    public static List<AstNode> preorder(AstNode root) {
        List<AstNode> result = new ArrayList<>();
        if (root == null) {
            return result;
        }
        Deque<AstNode> stack = new ArrayDeque<>();
        stack.push(root);
        while (!stack.isEmpty()) {
            AstNode node = stack.pop();
            result.add(node);
            List<AstNode> children = node.getChildren();
            for (int i = children.size() - 1; i >= 0; i--) {
                AstNode child = children.get(i);
                if (child != null) {
                    stack.push(child);
                }
            }
        }
        return result;
    }

    /**
     * Lists all nodes of the given variant in a subtree, in pre-order.
     */
    public static <T extends AstNode> List<T> findAll(AstNode root, Class<T> type) {
        List<T> result = new ArrayList<>();
        for (AstNode node : preorder(root)) {
            if (type.isInstance(node)) {
                result.add(type.cast(node));
            }
        }
        return result;
    }

    /**
     * Returns the first node of the given variant in pre-order, or null.
     */
    public static <T extends AstNode> T findFirst(AstNode root, Class<T> type) {
        for (AstNode node : preorder(root)) {
            if (type.isInstance(node)) {
                return type.cast(node);
            }
        }
        return null;
    }
}
