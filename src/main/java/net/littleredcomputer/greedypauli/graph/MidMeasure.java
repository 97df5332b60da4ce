package net.littleredcomputer.greedypauli.graph;

import com.google.common.collect.ImmutableList;
import net.littleredcomputer.greedypauli.pauli.Pauli;

/**
 * Measurement of &plusmn;P into a bit, leaving the qubits in place.
 */
public class MidMeasure extends SingleNode {
    private final int bit;

    public MidMeasure(Pauli[] string, boolean sign, int bit) {
        super(string, sign);
        this.bit = bit;
    }

    public int bit() { return bit; }

    @Override
    public PauliNodeType type() { return PauliNodeType.MID_MEASURE; }

    @Override
    public CommuteInfo commuteInfo() {
        return new CommuteInfo(ImmutableList.<Pauli[]>of(string), new int[0], new int[]{bit});
    }

    @Override
    public String toString() { return "Measure " + pauliString() + " -> c[" + bit + "]"; }
}
