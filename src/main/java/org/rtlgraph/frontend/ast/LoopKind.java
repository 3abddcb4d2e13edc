package org.rtlgraph.frontend.ast;

public enum LoopKind {
    FOR("for"),
    WHILE("while"),
    REPEAT("repeat"),
    DO_WHILE("dowhile");

    private final String keyword;

    LoopKind(String keyword) {
        this.keyword = keyword;
    }

    public String keyword() {
        return keyword;
    }
}
