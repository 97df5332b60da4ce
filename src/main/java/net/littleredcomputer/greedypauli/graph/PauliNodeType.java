package net.littleredcomputer.greedypauli.graph;

public enum PauliNodeType {
    ROTATION,
    MID_MEASURE,
    RESET,
    PROPAGATION,
    CLASSICAL,
    CONDITIONAL_BLOCK
}
