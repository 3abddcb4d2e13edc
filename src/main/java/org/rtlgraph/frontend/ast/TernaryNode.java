package org.rtlgraph.frontend.ast;

import java.util.List;
import java.util.Objects;
import java.util.stream.Stream;

/**
 * A conditional expression {@code cond ? a : b}.
 *
 * @param condition The selecting condition.
 * @param whenTrue  The value when the condition holds.
 * @param whenFalse The value otherwise.
 */
public record TernaryNode(AstNode condition, AstNode whenTrue, AstNode whenFalse) implements AstNode {

    @Override
    public List<AstNode> getChildren() {
        return Stream.of(condition, whenTrue, whenFalse).filter(Objects::nonNull).toList();
    }
}
