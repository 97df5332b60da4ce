package net.littleredcomputer.greedypauli.circuit;

import com.google.common.base.Preconditions;

/**
 * A purely classical operation. A command carrying one lists its input bits followed by its
 * output bits.
 */
public abstract class ClassicalOp extends Op {
    private final String name;
    private final int nInputs;
    private final int nOutputs;

    protected ClassicalOp(String name, int nInputs, int nOutputs) {
        super(OpType.Classical);
        Preconditions.checkArgument(nInputs >= 0 && nOutputs > 0, "%s: bad bit counts %s/%s", name, nInputs, nOutputs);
        this.name = name;
        this.nInputs = nInputs;
        this.nOutputs = nOutputs;
    }

    public String name() { return name; }
    public int nInputs() { return nInputs; }
    public int nOutputs() { return nOutputs; }

    @Override
    public int nQubits() { return 0; }

    @Override
    public int nBits() { return nInputs + nOutputs; }

    /** Computes the output bits from the input bits. */
    public abstract boolean[] eval(boolean[] inputs);

    @Override
    public String toString() { return name; }
}
