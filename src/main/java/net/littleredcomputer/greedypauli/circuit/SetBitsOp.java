package net.littleredcomputer.greedypauli.circuit;

import java.util.Arrays;

/** Writes constant values to its output bits. */
public class SetBitsOp extends ClassicalOp {
    private final boolean[] values;

    public SetBitsOp(boolean... values) {
        super("SetBits", 0, values.length);
        this.values = values.clone();
    }

    @Override
    public boolean[] eval(boolean[] inputs) {
        return values.clone();
    }

    @Override
    public boolean equals(Object o) {
        return super.equals(o) && Arrays.equals(values, ((SetBitsOp) o).values);
    }

    @Override
    public int hashCode() { return Arrays.hashCode(values); }

    @Override
    public String toString() { return "SetBits" + Arrays.toString(values); }
}
