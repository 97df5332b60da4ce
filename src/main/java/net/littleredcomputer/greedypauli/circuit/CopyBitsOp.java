package net.littleredcomputer.greedypauli.circuit;

/** Copies its n input bits to its n output bits. */
public class CopyBitsOp extends ClassicalOp {
    public CopyBitsOp(int n) {
        super("CopyBits", n, n);
    }

    @Override
    public boolean[] eval(boolean[] inputs) {
        return inputs.clone();
    }

    @Override
    public boolean equals(Object o) {
        return super.equals(o) && nInputs() == ((CopyBitsOp) o).nInputs();
    }

    @Override
    public int hashCode() { return nInputs(); }
}
