package net.littleredcomputer.greedypauli;

import net.littleredcomputer.greedypauli.circuit.OpType;

/**
 * Raised for an input operation with no Pauli-graph representation.
 */
public class BadOpTypeException extends GreedyPauliSimpException {
    private final OpType opType;

    public BadOpTypeException(OpType opType, String context) {
        super("cannot synthesise " + opType + " " + context);
        this.opType = opType;
    }

    public OpType opType() { return opType; }
}
