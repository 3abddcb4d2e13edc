package org.rtlgraph.frontend.ast;

/**
 * Flavours of assignment. The operator is the one shown in labels.
 */
public enum AssignKind {
    BLOCKING("="),
    NON_BLOCKING("<="),
    CONTINUOUS("=");

    private final String operator;

    AssignKind(String operator) {
        this.operator = operator;
    }

    public String operator() {
        return operator;
    }
}
