package net.littleredcomputer.greedypauli.pauli;

import com.google.common.base.VerifyException;
import com.google.common.collect.ImmutableList;
import net.littleredcomputer.greedypauli.circuit.OpType;

import java.util.List;

/**
 * Single-qubit Clifford gates, and how they conjugate Pauli letters.
 */
public enum LocalClifford {
    H(OpType.H, "ZYX", "+-+"),
    S(OpType.S, "YXZ", "+-+"),
    Sdg(OpType.Sdg, "YXZ", "-++"),
    V(OpType.V, "XZY", "++-"),
    Vdg(OpType.Vdg, "XZY", "+-+"),
    X(OpType.X, "XYZ", "+--"),
    Y(OpType.Y, "XYZ", "-+-"),
    Z(OpType.Z, "XYZ", "--+");

    private final OpType opType;
    // Images of X, Y, Z under P -> g P g^dagger.
    private final Pauli[] image = new Pauli[3];
    private final boolean[] sign = new boolean[3];

    LocalClifford(OpType opType, String images, String signs) {
        this.opType = opType;
        for (int i = 0; i < 3; ++i) {
            image[i] = Pauli.parse(images.charAt(i));
            sign[i] = signs.charAt(i) == '+';
        }
    }

    public OpType opType() { return opType; }

    /** The letter of g P g&dagger;. */
    public Pauli image(Pauli p) {
        return p == Pauli.I ? Pauli.I : image[p.ordinal() - 1];
    }

    /** The sign of g P g&dagger;; true for +. */
    public boolean sign(Pauli p) {
        return p == Pauli.I || sign[p.ordinal() - 1];
    }

    public LocalClifford dagger() {
        switch (this) {
            case S: return Sdg;
            case Sdg: return S;
            case V: return Vdg;
            case Vdg: return V;
            default: return this;
        }
    }

    /**
     * Gates, in emission order, that conjugate an anticommuting letter pair (z, x) to (&plusmn;Z, &plusmn;X).
     */
    public static List<LocalClifford> toZX(Pauli z, Pauli x) {
        switch (z) {
            case Z:
                if (x == Pauli.X) return ImmutableList.of();
                if (x == Pauli.Y) return ImmutableList.of(Sdg);
                break;
            case X:
                if (x == Pauli.Z) return ImmutableList.of(H);
                if (x == Pauli.Y) return ImmutableList.of(H, Sdg);
                break;
            case Y:
                if (x == Pauli.X) return ImmutableList.of(V);
                if (x == Pauli.Z) return ImmutableList.of(S, H);
                break;
            default:
                break;
        }
        throw new VerifyException("letters " + z + ", " + x + " do not anticommute");
    }

    /** Gates, in emission order, that conjugate a non-identity letter to &plusmn;Z. */
    public static List<LocalClifford> toZ(Pauli p) {
        switch (p) {
            case X: return ImmutableList.of(H);
            case Y: return ImmutableList.of(V);
            case Z: return ImmutableList.of();
            default: throw new VerifyException("identity letter has no Z basis change");
        }
    }
}
