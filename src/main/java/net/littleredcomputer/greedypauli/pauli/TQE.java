package net.littleredcomputer.greedypauli.pauli;

import com.google.common.base.Preconditions;
import com.google.common.collect.ComparisonChain;

import java.util.Objects;

/**
 * A two-qubit basis change of a given type on the ordered qubit pair (a, b).
 */
public final class TQE implements Comparable<TQE> {
    private final TQEType type;
    private final int a;
    private final int b;

    public TQE(TQEType type, int a, int b) {
        Preconditions.checkArgument(a >= 0 && b >= 0, "negative qubit in (%s, %s)", a, b);
        Preconditions.checkArgument(a != b, "TQE %s needs two distinct qubits, got %s twice", type, a);
        this.type = Preconditions.checkNotNull(type);
        this.a = a;
        this.b = b;
    }

    public TQEType type() { return type; }
    public int a() { return a; }
    public int b() { return b; }

    @Override
    public int compareTo(TQE o) {
        return ComparisonChain.start()
                .compare(type, o.type)
                .compare(a, o.a)
                .compare(b, o.b)
                .result();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TQE)) return false;
        TQE that = (TQE) o;
        return type == that.type && a == that.a && b == that.b;
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, a, b);
    }

    @Override
    public String toString() {
        return type + "(" + a + "," + b + ")";
    }
}
