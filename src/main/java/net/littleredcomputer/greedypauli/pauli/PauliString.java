package net.littleredcomputer.greedypauli.pauli;

import com.google.common.base.Preconditions;

import java.util.Arrays;
import java.util.List;

/**
 * An immutable dense Pauli string with a phase i^k, k in {0,1,2,3}. Hermitian strings (k even)
 * carry a sign.
 */
public final class PauliString {
    private final Pauli[] letters;
    private final int phase;

    private PauliString(Pauli[] letters, int phase) {
        this.letters = letters;
        this.phase = phase & 3;
    }

    public static PauliString of(Pauli... letters) {
        return new PauliString(letters.clone(), 0);
    }

    public static PauliString of(List<Pauli> letters) {
        return new PauliString(letters.toArray(new Pauli[0]), 0);
    }

    public static PauliString of(boolean sign, Pauli... letters) {
        return new PauliString(letters.clone(), sign ? 0 : 2);
    }

    public static PauliString identity(int n) {
        Pauli[] ps = new Pauli[n];
        Arrays.fill(ps, Pauli.I);
        return new PauliString(ps, 0);
    }

    public static PauliString single(int n, int qubit, Pauli p) {
        Pauli[] ps = identity(n).letters;
        ps[qubit] = p;
        return new PauliString(ps, 0);
    }

    /** Places letters[i] on qubits[i] within an n-qubit identity string. */
    public static PauliString onQubits(int n, Pauli[] letters, int[] qubits) {
        Preconditions.checkArgument(letters.length == qubits.length, "%s letters for %s qubits",
                letters.length, qubits.length);
        Pauli[] ps = identity(n).letters;
        for (int i = 0; i < qubits.length; ++i) {
            Preconditions.checkArgument(ps[qubits[i]] == Pauli.I, "repeated qubit %s", qubits[i]);
            ps[qubits[i]] = letters[i];
        }
        return new PauliString(ps, 0);
    }

    public static PauliString parse(String s) {
        int phase = 0;
        int i = 0;
        if (s.startsWith("+")) i = 1;
        else if (s.startsWith("-")) { phase = 2; i = 1; }
        if (s.startsWith("i", i)) { phase += 1; ++i; }
        Pauli[] ps = new Pauli[s.length() - i];
        for (int j = 0; j < ps.length; ++j) ps[j] = Pauli.parse(s.charAt(i + j));
        return new PauliString(ps, phase);
    }

    public int size() { return letters.length; }
    public Pauli get(int i) { return letters[i]; }
    public Pauli[] letters() { return letters.clone(); }
    public int phase() { return phase; }

    public boolean isHermitian() { return (phase & 1) == 0; }

    /** True for +P, false for -P. */
    public boolean sign() {
        Preconditions.checkState(isHermitian(), "%s has no sign", this);
        return phase == 0;
    }

    public int weight() {
        int w = 0;
        for (Pauli p : letters) if (p != Pauli.I) ++w;
        return w;
    }

    public boolean isIdentity() { return weight() == 0; }

    public boolean commutes(PauliString other) {
        return commutes(letters, other.letters);
    }

    /** Two strings commute iff they carry differing non-identity letters at an even number of positions. */
    public static boolean commutes(Pauli[] a, Pauli[] b) {
        Preconditions.checkArgument(a.length == b.length, "length mismatch %s vs %s", a.length, b.length);
        int conflicts = 0;
        for (int i = 0; i < a.length; ++i) if (!a[i].commutesWith(b[i])) ++conflicts;
        return conflicts % 2 == 0;
    }

    /** The operator product this * other. */
    public PauliString multiply(PauliString other) {
        Preconditions.checkArgument(size() == other.size(), "length mismatch %s vs %s", size(), other.size());
        Pauli[] ps = new Pauli[letters.length];
        int k = phase + other.phase;
        for (int i = 0; i < ps.length; ++i) {
            k += letters[i].productPhase(other.letters[i]);
            ps[i] = letters[i].times(other.letters[i]);
        }
        return new PauliString(ps, k);
    }

    /** Multiplies by i^k. */
    public PauliString timesI(int k) {
        return new PauliString(letters, phase + k);
    }

    public PauliString negate() {
        return timesI(2);
    }

    public PauliString withSign(boolean sign) {
        return new PauliString(letters, sign ? 0 : 2);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof PauliString)) return false;
        PauliString that = (PauliString) o;
        return phase == that.phase && Arrays.equals(letters, that.letters);
    }

    @Override
    public int hashCode() {
        return 31 * Arrays.hashCode(letters) + phase;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append(phase < 2 ? '+' : '-');
        if ((phase & 1) != 0) sb.append('i');
        for (Pauli p : letters) sb.append(p.name());
        return sb.toString();
    }
}
