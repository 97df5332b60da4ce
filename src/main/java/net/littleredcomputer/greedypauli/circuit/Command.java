package net.littleredcomputer.greedypauli.circuit;

import com.google.common.base.Joiner;
import com.google.common.base.Preconditions;
import com.google.common.primitives.Ints;

import java.util.Arrays;

/**
 * An op applied to specific qubits and bits.
 */
public final class Command {
    private final Op op;
    private final int[] qubits;
    private final int[] bits;

    public Command(Op op, int[] qubits, int[] bits) {
        this.op = Preconditions.checkNotNull(op);
        Preconditions.checkArgument(qubits.length == op.nQubits(), "%s expects %s qubits, got %s",
                op, op.nQubits(), qubits.length);
        Preconditions.checkArgument(bits.length == op.nBits(), "%s expects %s bits, got %s",
                op, op.nBits(), bits.length);
        checkDistinct(qubits, "qubit");
        checkDistinct(bits, "bit");
        this.qubits = qubits.clone();
        this.bits = bits.clone();
    }

    private static void checkDistinct(int[] xs, String what) {
        for (int i = 0; i < xs.length; ++i) {
            Preconditions.checkArgument(xs[i] >= 0, "negative %s index %s", what, xs[i]);
            for (int j = i + 1; j < xs.length; ++j) {
                Preconditions.checkArgument(xs[i] != xs[j], "%s %s used twice", what, xs[i]);
            }
        }
    }

    /** A parameterless gate on the given qubits. */
    public static Command of(OpType type, int... qubits) {
        return new Command(Op.gate(type), qubits, new int[0]);
    }

    public Op op() { return op; }
    public OpType type() { return op.type(); }
    public int[] qubits() { return qubits.clone(); }
    public int qubit(int i) { return qubits[i]; }
    public int[] bits() { return bits.clone(); }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Command)) return false;
        Command that = (Command) o;
        return op.equals(that.op) && Arrays.equals(qubits, that.qubits) && Arrays.equals(bits, that.bits);
    }

    @Override
    public int hashCode() {
        return 31 * (31 * op.hashCode() + Arrays.hashCode(qubits)) + Arrays.hashCode(bits);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(op.toString()).append(' ');
        Joiner.on(", ").appendTo(sb, Ints.asList(qubits).stream().map(q -> "q[" + q + "]").iterator());
        if (bits.length > 0) {
            if (qubits.length > 0) sb.append(", ");
            Joiner.on(", ").appendTo(sb, Ints.asList(bits).stream().map(b -> "c[" + b + "]").iterator());
        }
        return sb.append(';').toString();
    }
}
