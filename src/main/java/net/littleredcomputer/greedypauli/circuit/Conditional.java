package net.littleredcomputer.greedypauli.circuit;

import com.google.common.base.Preconditions;

/**
 * An op applied only when its condition bits, read as a little-endian integer, equal a value.
 * A command carrying one lists the condition bits first, then the inner op's bits.
 */
public class Conditional extends Op {
    private final Op op;
    private final int width;
    private final int value;

    public Conditional(Op op, int width, int value) {
        super(OpType.Conditional);
        Preconditions.checkArgument(width > 0 && width < 31, "condition width %s out of range", width);
        Preconditions.checkArgument(value >= 0 && value < (1 << width), "condition value %s does not fit in %s bits", value, width);
        this.op = Preconditions.checkNotNull(op);
        this.width = width;
        this.value = value;
    }

    public Op op() { return op; }
    public int width() { return width; }
    public int value() { return value; }

    @Override
    public int nQubits() { return op.nQubits(); }

    @Override
    public int nBits() { return width + op.nBits(); }

    @Override
    public boolean equals(Object o) {
        if (!super.equals(o)) return false;
        Conditional that = (Conditional) o;
        return width == that.width && value == that.value && op.equals(that.op);
    }

    @Override
    public int hashCode() { return 31 * (31 * op.hashCode() + width) + value; }

    @Override
    public String toString() { return "if(" + width + "==" + value + ") " + op; }
}
