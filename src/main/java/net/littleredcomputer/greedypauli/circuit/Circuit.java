package net.littleredcomputer.greedypauli.circuit;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * An ordered command stream over a fixed register of qubits and bits.
 *
 * <p>A circuit may end with an implicit wire permutation: after the commands have run, the
 * state of qubit q is found on output wire {@code permutation()[q]}.
 */
public class Circuit {
    private final int nQubits;
    private final int nBits;
    private final List<Command> commands = new ArrayList<>();
    private final int[] permutation;

    public Circuit(int nQubits, int nBits) {
        Preconditions.checkArgument(nQubits >= 0 && nBits >= 0, "negative register size");
        this.nQubits = nQubits;
        this.nBits = nBits;
        this.permutation = new int[nQubits];
        for (int i = 0; i < nQubits; ++i) permutation[i] = i;
    }

    public Circuit(int nQubits) {
        this(nQubits, 0);
    }

    public Circuit(Circuit other) {
        this.nQubits = other.nQubits;
        this.nBits = other.nBits;
        this.commands.addAll(other.commands);
        this.permutation = other.permutation.clone();
    }

    public int nQubits() { return nQubits; }
    public int nBits() { return nBits; }
    public List<Command> commands() { return ImmutableList.copyOf(commands); }
    public int[] permutation() { return permutation.clone(); }

    public boolean isPermutationTrivial() {
        for (int i = 0; i < nQubits; ++i) if (permutation[i] != i) return false;
        return true;
    }

    public Circuit add(Command c) {
        for (int q : c.qubits()) Preconditions.checkArgument(q < nQubits, "qubit %s out of range in %s", q, c);
        for (int b : c.bits()) Preconditions.checkArgument(b < nBits, "bit %s out of range in %s", b, c);
        commands.add(c);
        return this;
    }

    public Circuit add(Op op, int[] qubits, int[] bits) {
        return add(new Command(op, qubits, bits));
    }

    public Circuit add(Op op, int... qubits) {
        return add(new Command(op, qubits, new int[0]));
    }

    public Circuit add(OpType type, int... qubits) {
        return add(Command.of(type, qubits));
    }

    /** Adds a gate with one angle parameter (in half-turns). */
    public Circuit addRotation(OpType type, double angle, int... qubits) {
        return add(Op.gate(type, angle), qubits);
    }

    /** Adds a box op (a Pauli exponential box or a {@link CircBox}) over the given qubits. */
    public Circuit addBox(Op box, int... qubits) {
        Preconditions.checkArgument(box.nQubits() == qubits.length, "%s spans %s qubits, given %s",
                box, box.nQubits(), qubits.length);
        return add(box, qubits);
    }

    public Circuit addMeasure(int qubit, int bit) {
        return add(Op.gate(OpType.Measure), new int[]{qubit}, new int[]{bit});
    }

    public Circuit addReset(int qubit) {
        return add(OpType.Reset, qubit);
    }

    public Circuit addClassical(ClassicalOp op, int... bits) {
        return add(op, new int[0], bits);
    }

    /**
     * Adds {@code op} conditioned on {@code condBits} holding {@code value}. {@code opBits} are the
     * bits the inner op itself uses.
     */
    public Circuit addConditional(Op op, int[] qubits, int[] condBits, int value, int... opBits) {
        int[] bits = Arrays.copyOf(condBits, condBits.length + opBits.length);
        System.arraycopy(opBits, 0, bits, condBits.length, opBits.length);
        return add(new Conditional(op, condBits.length, value), qubits, bits);
    }

    /**
     * Absorbs SWAP gates at the end of the circuit into the implicit permutation.
     * @return the number of SWAPs removed
     */
    public int replaceTrailingSwaps() {
        int removed = 0;
        while (!commands.isEmpty() && commands.get(commands.size() - 1).type() == OpType.SWAP) {
            Command c = commands.remove(commands.size() - 1);
            int a = c.qubit(0), b = c.qubit(1);
            int t = permutation[a];
            permutation[a] = permutation[b];
            permutation[b] = t;
            ++removed;
        }
        return removed;
    }

    public int nGates() { return commands.size(); }

    public int n2qGates() {
        int n = 0;
        for (Command c : commands) if (c.qubits().length == 2) ++n;
        return n;
    }

    public int countGates(OpType type) {
        int n = 0;
        for (Command c : commands) if (c.type() == type) ++n;
        return n;
    }

    /** Length of the longest chain of commands sharing a qubit or bit. */
    public int depth() {
        int[] qDepth = new int[nQubits];
        int[] bDepth = new int[nBits];
        int max = 0;
        for (Command c : commands) {
            int d = 0;
            for (int q : c.qubits()) d = Math.max(d, qDepth[q]);
            for (int b : c.bits()) d = Math.max(d, bDepth[b]);
            ++d;
            for (int q : c.qubits()) qDepth[q] = d;
            for (int b : c.bits()) bDepth[b] = d;
            max = Math.max(max, d);
        }
        return max;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Circuit)) return false;
        Circuit that = (Circuit) o;
        return nQubits == that.nQubits && nBits == that.nBits && commands.equals(that.commands)
                && Arrays.equals(permutation, that.permutation);
    }

    @Override
    public int hashCode() {
        return 31 * commands.hashCode() + Arrays.hashCode(permutation);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append("qubits ").append(nQubits).append(" bits ").append(nBits).append('\n');
        for (Command c : commands) sb.append(c).append('\n');
        if (!isPermutationTrivial()) sb.append("permutation ").append(Arrays.toString(permutation)).append('\n');
        return sb.toString();
    }
}
