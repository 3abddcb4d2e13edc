package org.rtlgraph.analysis;

/**
 * Heuristic roles a procedural block or assignment can be given in the architecture view.
 */
public enum BlockKind {
    CONTINUOUS_ASSIGNMENT("Continuous Assignment"),
    FSM_CONTROLLER("FSM Controller"),
    COUNTER("Counter"),
    COMBINATIONAL_DATAPATH("Combinational Datapath"),
    SEQUENTIAL_LOGIC("Sequential Logic"),
    COMBINATIONAL_LOGIC("Combinational Logic"),
    INIT("Init"),
    OTHER("Block");

    private final String label;

    BlockKind(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    /**
     * Whether no specific heuristic matched and the block got one of the catch-all labels.
     */
    public boolean isFallback() {
        return this == SEQUENTIAL_LOGIC || this == COMBINATIONAL_LOGIC || this == OTHER;
    }
}
