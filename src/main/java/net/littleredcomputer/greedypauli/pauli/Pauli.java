package net.littleredcomputer.greedypauli.pauli;

/**
 * A single-qubit Pauli letter, encoded by its symplectic (x, z) bits. The declaration order is
 * significant: the lookup tables hash on the ordinal.
 */
public enum Pauli {
    I(false, false),
    X(true, false),
    Y(true, true),
    Z(false, true);

    private final boolean x;
    private final boolean z;

    Pauli(boolean x, boolean z) {
        this.x = x;
        this.z = z;
    }

    public boolean x() { return x; }
    public boolean z() { return z; }

    public static Pauli of(boolean x, boolean z) {
        if (x) return z ? Y : X;
        return z ? Z : I;
    }

    public boolean commutesWith(Pauli other) {
        return this == I || other == I || this == other;
    }

    /**
     * The phase exponent k such that this * other = i^k * of(x^x', z^z'). For instance
     * X * Y = iZ gives 1, and Y * X = -iZ gives 3.
     */
    public int productPhase(Pauli other) {
        if (this == I || other == I || this == other) return 0;
        // X->Y->Z->X is the cyclic (positive) order.
        return (other.ordinal() - ordinal() + 3) % 3 == 1 ? 1 : 3;
    }

    public Pauli times(Pauli other) {
        return of(x ^ other.x, z ^ other.z);
    }

    public static String join(Iterable<Pauli> ps) {
        StringBuilder sb = new StringBuilder();
        for (Pauli p : ps) sb.append(p.name());
        return sb.toString();
    }

    public static Pauli parse(char c) {
        switch (c) {
            case 'I': return I;
            case 'X': return X;
            case 'Y': return Y;
            case 'Z': return Z;
            default: throw new IllegalArgumentException("not a Pauli letter: " + c);
        }
    }
}
