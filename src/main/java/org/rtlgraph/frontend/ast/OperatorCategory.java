package org.rtlgraph.frontend.ast;

public enum OperatorCategory {
    COMPARISON,
    LOGICAL,
    ARITHMETIC,
    BITWISE,
    UNARY,
    SELECT,
    CONCAT
}
