package net.littleredcomputer.greedypauli.graph;

import net.littleredcomputer.greedypauli.GreedyPauliSimpException;
import net.littleredcomputer.greedypauli.pauli.*;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * A node carrying an anticommuting pair of signed strings (z, x), such as the images of Z_q and
 * X_q. It is ready when both strings live on a single qubit.
 *
 * <p>Each position is classified by {@link CommuteType}. With nA anticommuting and nC commuting
 * non-identity positions the cost is 1.5 (nA - 1) + nC. Since the strings anticommute nA is odd,
 * and every TQE changes nA by an even amount, so costs and their deltas are integral.
 */
public abstract class ACPairNode extends PauliNode {
    final Pauli[] zString;
    final Pauli[] xString;
    boolean zSign;
    boolean xSign;
    private final CommuteType[] types;
    private int nAnti;
    private int nComm;

    ACPairNode(Pauli[] zString, Pauli[] xString, boolean zSign, boolean xSign) {
        if (zString.length == 0) throw new GreedyPauliSimpException("Pauli strings cannot be empty");
        if (zString.length != xString.length) {
            throw new GreedyPauliSimpException(String.format("Pauli strings of unequal length %d and %d",
                    zString.length, xString.length));
        }
        this.zString = zString.clone();
        this.xString = xString.clone();
        this.zSign = zSign;
        this.xSign = xSign;
        this.types = new CommuteType[zString.length];
        for (int i = 0; i < types.length; ++i) {
            types[i] = CommuteType.of(zString[i], xString[i]);
            if (types[i] == CommuteType.A) ++nAnti;
            else if (types[i] == CommuteType.C) ++nComm;
        }
        if (nAnti % 2 == 0) {
            throw new GreedyPauliSimpException(String.format(
                    "strings %s and %s must anticommute, but differ at %d positions",
                    Pauli.join(Arrays.asList(zString)), Pauli.join(Arrays.asList(xString)), nAnti));
        }
    }

    public Pauli[] zString() { return zString.clone(); }
    public Pauli[] xString() { return xString.clone(); }
    public boolean zSign() { return zSign; }
    public boolean xSign() { return xSign; }

    public PauliString zPauliString() { return PauliString.of(zSign, zString); }
    public PauliString xPauliString() { return PauliString.of(xSign, xString); }

    private static int cost(int nAnti, int nComm) {
        return (int) (1.5 * (nAnti - 1) + nComm);
    }

    @Override
    public int tqeCost() { return cost(nAnti, nComm); }

    @Override
    public int tqeCostIncrease(TQE tqe) {
        int a = tqe.a(), b = tqe.b();
        TQEType t = tqe.type();
        CommuteType newA = CommuteType.of(TQETables.newFirst(t, zString[a], zString[b]), TQETables.newFirst(t, xString[a], xString[b]));
        CommuteType newB = CommuteType.of(TQETables.newSecond(t, zString[a], zString[b]), TQETables.newSecond(t, xString[a], xString[b]));
        int anti = nAnti - count(types[a], types[b], CommuteType.A) + count(newA, newB, CommuteType.A);
        int comm = nComm - count(types[a], types[b], CommuteType.C) + count(newA, newB, CommuteType.C);
        return cost(anti, comm) - tqeCost();
    }

    private static int count(CommuteType a, CommuteType b, CommuteType target) {
        return (a == target ? 1 : 0) + (b == target ? 1 : 0);
    }

    @Override
    public void update(TQE tqe) {
        int a = tqe.a(), b = tqe.b();
        TQEType t = tqe.type();
        Pauli za = zString[a], zb = zString[b], xa = xString[a], xb = xString[b];
        zString[a] = TQETables.newFirst(t, za, zb);
        zString[b] = TQETables.newSecond(t, za, zb);
        if (!TQETables.sign(t, za, zb)) zSign = !zSign;
        xString[a] = TQETables.newFirst(t, xa, xb);
        xString[b] = TQETables.newSecond(t, xa, xb);
        if (!TQETables.sign(t, xa, xb)) xSign = !xSign;
        retype(a);
        retype(b);
    }

    @Override
    public void update(LocalClifford g, int q) {
        if (!g.sign(zString[q])) zSign = !zSign;
        if (!g.sign(xString[q])) xSign = !xSign;
        zString[q] = g.image(zString[q]);
        xString[q] = g.image(xString[q]);
    }

    @Override
    public void swap(int a, int b) {
        Pauli t = zString[a];
        zString[a] = zString[b];
        zString[b] = t;
        t = xString[a];
        xString[a] = xString[b];
        xString[b] = t;
        CommuteType c = types[a];
        types[a] = types[b];
        types[b] = c;
    }

    private void retype(int i) {
        CommuteType old = types[i];
        if (old == CommuteType.A) --nAnti;
        else if (old == CommuteType.C) --nComm;
        types[i] = CommuteType.of(zString[i], xString[i]);
        if (types[i] == CommuteType.A) ++nAnti;
        else if (types[i] == CommuteType.C) ++nComm;
    }

    @Override
    public List<TQE> reductionTqes() {
        List<TQE> tqes = new ArrayList<>();
        for (int a = 0; a < types.length; ++a) {
            if (types[a] == CommuteType.I) continue;
            for (int b = a + 1; b < types.length; ++b) {
                if (types[b] == CommuteType.I) continue;
                if (types[a] == CommuteType.A && types[b] == CommuteType.A) {
                    for (TQEType t : TQETables.aaToCc(zString[a], zString[b], xString[a], xString[b])) tqes.add(new TQE(t, a, b));
                } else if (types[a] == CommuteType.A) {
                    for (TQEType t : TQETables.acToAi(zString[a], zString[b], xString[a], xString[b])) tqes.add(new TQE(t, a, b));
                } else if (types[b] == CommuteType.A) {
                    for (TQEType t : TQETables.acToAi(zString[b], zString[a], xString[b], xString[a])) tqes.add(new TQE(t, b, a));
                } else {
                    for (TQEType t : TQETables.ccToIcOrCi(zString[a], zString[b], xString[a], xString[b])) tqes.add(new TQE(t, a, b));
                }
            }
        }
        return tqes;
    }

    /** The first position at which the strings anticommute. */
    public int firstSupport() {
        for (int i = 0; i < types.length; ++i) if (types[i] == CommuteType.A) return i;
        throw new IllegalStateException("strings do not anticommute");
    }

    @Override
    public CommuteInfo commuteInfo() {
        return CommuteInfo.ofStrings(zString, xString);
    }

    @Override
    public String toString() {
        return type() + " " + zPauliString() + "/" + xPauliString();
    }
}
