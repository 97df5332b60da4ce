package net.littleredcomputer.greedypauli.graph;

import net.littleredcomputer.greedypauli.pauli.Pauli;

/**
 * One row of the trailing Clifford tableau: the images of Z and X of its home qubit.
 */
public class PauliPropagation extends ACPairNode {
    private final int qubit;

    public PauliPropagation(Pauli[] zString, Pauli[] xString, boolean zSign, boolean xSign, int qubit) {
        super(zString, xString, zSign, xSign);
        this.qubit = qubit;
    }

    public int qubit() { return qubit; }

    @Override
    public PauliNodeType type() { return PauliNodeType.PROPAGATION; }
}
