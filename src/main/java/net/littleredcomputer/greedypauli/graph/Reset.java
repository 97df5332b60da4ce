package net.littleredcomputer.greedypauli.graph;

import net.littleredcomputer.greedypauli.pauli.Pauli;

/**
 * Reset of the virtual qubit whose Z and X are the given strings, to the +1 eigenstate of the
 * z string.
 */
public class Reset extends ACPairNode {
    public Reset(Pauli[] zString, Pauli[] xString, boolean zSign, boolean xSign) {
        super(zString, xString, zSign, xSign);
    }

    @Override
    public PauliNodeType type() { return PauliNodeType.RESET; }
}
