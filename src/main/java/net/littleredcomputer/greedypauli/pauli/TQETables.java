// Copyright 2018 Colin Smith. MIT License.
package net.littleredcomputer.greedypauli.pauli;

import com.google.common.base.Verify;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import net.littleredcomputer.greedypauli.circuit.Command;
import net.littleredcomputer.greedypauli.circuit.OpType;

import java.util.List;

import static net.littleredcomputer.greedypauli.pauli.Pauli.*;
import static net.littleredcomputer.greedypauli.pauli.TQEType.*;

/**
 * Fixed tables describing how the nine TQE types act on pairs of Pauli letters, and which TQE
 * types reduce small letter configurations.
 *
 * <p>For a TQE T acting on qubits (0, 1), the entry for (T, P, Q) is (P', Q', sign) such that
 * {@code T; P(0)Q(1) = k * P'(0)Q'(1); T} with k = +1 when sign is true and -1 otherwise.
 * All TQE gate fragments are self-inverse, so the same entry gives T P T&dagger; as well as
 * T&dagger; P T.
 */
public final class TQETables {
    private TQETables() {}

    private static final Pauli[] newP0 = new Pauli[144];
    private static final Pauli[] newP1 = new Pauli[144];
    private static final boolean[] signs = new boolean[144];
    private static final boolean[] filled = new boolean[144];
    private static final boolean[] commuteTable = new boolean[144];
    private static final int[] costTable = new int[144];

    // Reverse maps, keyed by the letters of the configuration to reduce.
    private static final ImmutableMap<Integer, ImmutableList<TQEType>> reductionMap;
    private static final ImmutableMap<Integer, ImmutableList<TQEType>> ccMap;
    private static final ImmutableMap<Integer, ImmutableList<TQEType>> aaMap;
    private static final ImmutableMap<Integer, ImmutableList<TQEType>> acMap;

    static int hash(TQEType t, Pauli p0, Pauli p1) {
        return (t.ordinal() << 4) | (p0.ordinal() << 2) | p1.ordinal();
    }

    private static int hash(Pauli a, Pauli b, Pauli c, Pauli d) {
        return (a.ordinal() << 6) | (b.ordinal() << 4) | (c.ordinal() << 2) | d.ordinal();
    }

    private static void pauliMap(TQEType t, Pauli p0, Pauli p1, Pauli q0, Pauli q1, boolean sign) {
        int h = hash(t, p0, p1);
        Verify.verify(!filled[h], "duplicate entry for %s %s %s", t, p0, p1);
        filled[h] = true;
        newP0[h] = q0;
        newP1[h] = q1;
        signs[h] = sign;
        commuteTable[h] = p0 == q0 && p1 == q1 && sign;
        costTable[h] = (p0 == I ? 1 : 0) + (p1 == I ? 1 : 0) - (q0 == I ? 1 : 0) - (q1 == I ? 1 : 0);
    }

    private static void reduction(ImmutableMap.Builder<Integer, ImmutableList<TQEType>> map,
                                  Pauli p, Pauli q, TQEType... ts) {
        map.put((p.ordinal() << 2) | q.ordinal(), ImmutableList.copyOf(ts));
    }

    private static void entry(ImmutableMap.Builder<Integer, ImmutableList<TQEType>> map,
                              Pauli za, Pauli zb, Pauli xa, Pauli xb, TQEType... ts) {
        map.put(hash(za, zb, xa, xb), ImmutableList.copyOf(ts));
    }

    static {
        pauliMap(XX, X, X, X, X, true);
        pauliMap(XY, X, X, I, X, true);
        pauliMap(XZ, X, X, I, X, true);
        pauliMap(YX, X, X, X, I, true);
        pauliMap(YY, X, X, Z, Z, true);
        pauliMap(YZ, X, X, Z, Y, false);
        pauliMap(ZX, X, X, X, I, true);
        pauliMap(ZY, X, X, Y, Z, false);
        pauliMap(ZZ, X, X, Y, Y, true);
        pauliMap(XX, X, Y, I, Y, true);
        pauliMap(XY, X, Y, X, Y, true);
        pauliMap(XZ, X, Y, I, Y, true);
        pauliMap(YX, X, Y, Z, Z, false);
        pauliMap(YY, X, Y, X, I, true);
        pauliMap(YZ, X, Y, Z, X, true);
        pauliMap(ZX, X, Y, Y, Z, true);
        pauliMap(ZY, X, Y, X, I, true);
        pauliMap(ZZ, X, Y, Y, X, false);
        pauliMap(XX, X, Z, I, Z, true);
        pauliMap(XY, X, Z, I, Z, true);
        pauliMap(XZ, X, Z, X, Z, true);
        pauliMap(YX, X, Z, Z, Y, true);
        pauliMap(YY, X, Z, Z, X, false);
        pauliMap(YZ, X, Z, X, I, true);
        pauliMap(ZX, X, Z, Y, Y, false);
        pauliMap(ZY, X, Z, Y, X, true);
        pauliMap(ZZ, X, Z, X, I, true);
        pauliMap(XX, X, I, X, I, true);
        pauliMap(XY, X, I, X, I, true);
        pauliMap(XZ, X, I, X, I, true);
        pauliMap(YX, X, I, X, X, true);
        pauliMap(YY, X, I, X, Y, true);
        pauliMap(YZ, X, I, X, Z, true);
        pauliMap(ZX, X, I, X, X, true);
        pauliMap(ZY, X, I, X, Y, true);
        pauliMap(ZZ, X, I, X, Z, true);
        pauliMap(XX, Y, X, Y, I, true);
        pauliMap(XY, Y, X, Z, Z, false);
        pauliMap(XZ, Y, X, Z, Y, true);
        pauliMap(YX, Y, X, Y, X, true);
        pauliMap(YY, Y, X, I, X, true);
        pauliMap(YZ, Y, X, I, X, true);
        pauliMap(ZX, Y, X, Y, I, true);
        pauliMap(ZY, Y, X, X, Z, true);
        pauliMap(ZZ, Y, X, X, Y, false);
        pauliMap(XX, Y, Y, Z, Z, true);
        pauliMap(XY, Y, Y, Y, I, true);
        pauliMap(XZ, Y, Y, Z, X, false);
        pauliMap(YX, Y, Y, I, Y, true);
        pauliMap(YY, Y, Y, Y, Y, true);
        pauliMap(YZ, Y, Y, I, Y, true);
        pauliMap(ZX, Y, Y, X, Z, false);
        pauliMap(ZY, Y, Y, Y, I, true);
        pauliMap(ZZ, Y, Y, X, X, true);
        pauliMap(XX, Y, Z, Z, Y, false);
        pauliMap(XY, Y, Z, Z, X, true);
        pauliMap(XZ, Y, Z, Y, I, true);
        pauliMap(YX, Y, Z, I, Z, true);
        pauliMap(YY, Y, Z, I, Z, true);
        pauliMap(YZ, Y, Z, Y, Z, true);
        pauliMap(ZX, Y, Z, X, Y, true);
        pauliMap(ZY, Y, Z, X, X, false);
        pauliMap(ZZ, Y, Z, Y, I, true);
        pauliMap(XX, Y, I, Y, X, true);
        pauliMap(XY, Y, I, Y, Y, true);
        pauliMap(XZ, Y, I, Y, Z, true);
        pauliMap(YX, Y, I, Y, I, true);
        pauliMap(YY, Y, I, Y, I, true);
        pauliMap(YZ, Y, I, Y, I, true);
        pauliMap(ZX, Y, I, Y, X, true);
        pauliMap(ZY, Y, I, Y, Y, true);
        pauliMap(ZZ, Y, I, Y, Z, true);
        pauliMap(XX, Z, X, Z, I, true);
        pauliMap(XY, Z, X, Y, Z, true);
        pauliMap(XZ, Z, X, Y, Y, false);
        pauliMap(YX, Z, X, Z, I, true);
        pauliMap(YY, Z, X, X, Z, false);
        pauliMap(YZ, Z, X, X, Y, true);
        pauliMap(ZX, Z, X, Z, X, true);
        pauliMap(ZY, Z, X, I, X, true);
        pauliMap(ZZ, Z, X, I, X, true);
        pauliMap(XX, Z, Y, Y, Z, false);
        pauliMap(XY, Z, Y, Z, I, true);
        pauliMap(XZ, Z, Y, Y, X, true);
        pauliMap(YX, Z, Y, X, Z, true);
        pauliMap(YY, Z, Y, Z, I, true);
        pauliMap(YZ, Z, Y, X, X, false);
        pauliMap(ZX, Z, Y, I, Y, true);
        pauliMap(ZY, Z, Y, Z, Y, true);
        pauliMap(ZZ, Z, Y, I, Y, true);
        pauliMap(XX, Z, Z, Y, Y, true);
        pauliMap(XY, Z, Z, Y, X, false);
        pauliMap(XZ, Z, Z, Z, I, true);
        pauliMap(YX, Z, Z, X, Y, false);
        pauliMap(YY, Z, Z, X, X, true);
        pauliMap(YZ, Z, Z, Z, I, true);
        pauliMap(ZX, Z, Z, I, Z, true);
        pauliMap(ZY, Z, Z, I, Z, true);
        pauliMap(ZZ, Z, Z, Z, Z, true);
        pauliMap(XX, Z, I, Z, X, true);
        pauliMap(XY, Z, I, Z, Y, true);
        pauliMap(XZ, Z, I, Z, Z, true);
        pauliMap(YX, Z, I, Z, X, true);
        pauliMap(YY, Z, I, Z, Y, true);
        pauliMap(YZ, Z, I, Z, Z, true);
        pauliMap(ZX, Z, I, Z, I, true);
        pauliMap(ZY, Z, I, Z, I, true);
        pauliMap(ZZ, Z, I, Z, I, true);
        pauliMap(XX, I, X, I, X, true);
        pauliMap(XY, I, X, X, X, true);
        pauliMap(XZ, I, X, X, X, true);
        pauliMap(YX, I, X, I, X, true);
        pauliMap(YY, I, X, Y, X, true);
        pauliMap(YZ, I, X, Y, X, true);
        pauliMap(ZX, I, X, I, X, true);
        pauliMap(ZY, I, X, Z, X, true);
        pauliMap(ZZ, I, X, Z, X, true);
        pauliMap(XX, I, Y, X, Y, true);
        pauliMap(XY, I, Y, I, Y, true);
        pauliMap(XZ, I, Y, X, Y, true);
        pauliMap(YX, I, Y, Y, Y, true);
        pauliMap(YY, I, Y, I, Y, true);
        pauliMap(YZ, I, Y, Y, Y, true);
        pauliMap(ZX, I, Y, Z, Y, true);
        pauliMap(ZY, I, Y, I, Y, true);
        pauliMap(ZZ, I, Y, Z, Y, true);
        pauliMap(XX, I, Z, X, Z, true);
        pauliMap(XY, I, Z, X, Z, true);
        pauliMap(XZ, I, Z, I, Z, true);
        pauliMap(YX, I, Z, Y, Z, true);
        pauliMap(YY, I, Z, Y, Z, true);
        pauliMap(YZ, I, Z, I, Z, true);
        pauliMap(ZX, I, Z, Z, Z, true);
        pauliMap(ZY, I, Z, Z, Z, true);
        pauliMap(ZZ, I, Z, I, Z, true);
        pauliMap(XX, I, I, I, I, true);
        pauliMap(XY, I, I, I, I, true);
        pauliMap(XZ, I, I, I, I, true);
        pauliMap(YX, I, I, I, I, true);
        pauliMap(YY, I, I, I, I, true);
        pauliMap(YZ, I, I, I, I, true);
        pauliMap(ZX, I, I, I, I, true);
        pauliMap(ZY, I, I, I, I, true);
        pauliMap(ZZ, I, I, I, I, true);
    }

    static {
        ImmutableMap.Builder<Integer, ImmutableList<TQEType>> reductions = ImmutableMap.builder();
        reduction(reductions, X, X, XY, XZ, YX, ZX);
        reduction(reductions, X, Y, XX, XZ, YY, ZY);
        reduction(reductions, X, Z, XX, XY, YZ, ZZ);
        reduction(reductions, Y, X, XX, YY, YZ, ZX);
        reduction(reductions, Y, Y, XY, YX, YZ, ZY);
        reduction(reductions, Y, Z, XZ, YX, YY, ZZ);
        reduction(reductions, Z, X, XX, YX, ZY, ZZ);
        reduction(reductions, Z, Y, XY, YY, ZX, ZZ);
        reduction(reductions, Z, Z, XZ, YZ, ZX, ZY);
        reductionMap = reductions.build();
    }

    static {
        ImmutableMap.Builder<Integer, ImmutableList<TQEType>> cc = ImmutableMap.builder();
        entry(cc, X, X, X, X, XY, XZ, YX, ZX);
        entry(cc, X, X, X, I);
        entry(cc, X, X, I, X);
        entry(cc, X, X, I, I, XY, XZ, YX, ZX);
        entry(cc, X, Y, X, Y, XX, XZ, YY, ZY);
        entry(cc, X, Y, X, I);
        entry(cc, X, Y, I, Y);
        entry(cc, X, Y, I, I, XX, XZ, YY, ZY);
        entry(cc, X, Z, X, Z, XX, XY, YZ, ZZ);
        entry(cc, X, Z, X, I);
        entry(cc, X, Z, I, Z);
        entry(cc, X, Z, I, I, XX, XY, YZ, ZZ);
        entry(cc, X, I, X, X);
        entry(cc, X, I, X, Y);
        entry(cc, X, I, X, Z);
        entry(cc, X, I, I, X);
        entry(cc, X, I, I, Y);
        entry(cc, X, I, I, Z);
        entry(cc, Y, X, Y, X, XX, YY, YZ, ZX);
        entry(cc, Y, X, Y, I);
        entry(cc, Y, X, I, X);
        entry(cc, Y, X, I, I, XX, YY, YZ, ZX);
        entry(cc, Y, Y, Y, Y, XY, YX, YZ, ZY);
        entry(cc, Y, Y, Y, I);
        entry(cc, Y, Y, I, Y);
        entry(cc, Y, Y, I, I, XY, YX, YZ, ZY);
        entry(cc, Y, Z, Y, Z, XZ, YX, YY, ZZ);
        entry(cc, Y, Z, Y, I);
        entry(cc, Y, Z, I, Z);
        entry(cc, Y, Z, I, I, XZ, YX, YY, ZZ);
        entry(cc, Y, I, Y, X);
        entry(cc, Y, I, Y, Y);
        entry(cc, Y, I, Y, Z);
        entry(cc, Y, I, I, X);
        entry(cc, Y, I, I, Y);
        entry(cc, Y, I, I, Z);
        entry(cc, Z, X, Z, X, XX, YX, ZY, ZZ);
        entry(cc, Z, X, Z, I);
        entry(cc, Z, X, I, X);
        entry(cc, Z, X, I, I, XX, YX, ZY, ZZ);
        entry(cc, Z, Y, Z, Y, XY, YY, ZX, ZZ);
        entry(cc, Z, Y, Z, I);
        entry(cc, Z, Y, I, Y);
        entry(cc, Z, Y, I, I, XY, YY, ZX, ZZ);
        entry(cc, Z, Z, Z, Z, XZ, YZ, ZX, ZY);
        entry(cc, Z, Z, Z, I);
        entry(cc, Z, Z, I, Z);
        entry(cc, Z, Z, I, I, XZ, YZ, ZX, ZY);
        entry(cc, Z, I, Z, X);
        entry(cc, Z, I, Z, Y);
        entry(cc, Z, I, Z, Z);
        entry(cc, Z, I, I, X);
        entry(cc, Z, I, I, Y);
        entry(cc, Z, I, I, Z);
        entry(cc, I, X, X, X);
        entry(cc, I, X, X, I);
        entry(cc, I, X, Y, X);
        entry(cc, I, X, Y, I);
        entry(cc, I, X, Z, X);
        entry(cc, I, X, Z, I);
        entry(cc, I, Y, X, Y);
        entry(cc, I, Y, X, I);
        entry(cc, I, Y, Y, Y);
        entry(cc, I, Y, Y, I);
        entry(cc, I, Y, Z, Y);
        entry(cc, I, Y, Z, I);
        entry(cc, I, Z, X, Z);
        entry(cc, I, Z, X, I);
        entry(cc, I, Z, Y, Z);
        entry(cc, I, Z, Y, I);
        entry(cc, I, Z, Z, Z);
        entry(cc, I, Z, Z, I);
        entry(cc, I, I, X, X, XY, XZ, YX, ZX);
        entry(cc, I, I, X, Y, XX, XZ, YY, ZY);
        entry(cc, I, I, X, Z, XX, XY, YZ, ZZ);
        entry(cc, I, I, Y, X, XX, YY, YZ, ZX);
        entry(cc, I, I, Y, Y, XY, YX, YZ, ZY);
        entry(cc, I, I, Y, Z, XZ, YX, YY, ZZ);
        entry(cc, I, I, Z, X, XX, YX, ZY, ZZ);
        entry(cc, I, I, Z, Y, XY, YY, ZX, ZZ);
        entry(cc, I, I, Z, Z, XZ, YZ, ZX, ZY);
        ccMap = cc.build();
    }

    static {
        ImmutableMap.Builder<Integer, ImmutableList<TQEType>> aa = ImmutableMap.builder();
        entry(aa, X, X, Y, Y, XY, XZ, YX, YZ, ZX, ZY);
        entry(aa, X, X, Y, Z, XY, XZ, YX, YY, ZX, ZZ);
        entry(aa, X, X, Z, Y, XY, XZ, YX, YY, ZX, ZZ);
        entry(aa, X, X, Z, Z, XY, XZ, YX, YZ, ZX, ZY);
        entry(aa, X, Y, Y, X, XX, XZ, YY, YZ, ZX, ZY);
        entry(aa, X, Y, Y, Z, XX, XZ, YX, YY, ZY, ZZ);
        entry(aa, X, Y, Z, X, XX, XZ, YX, YY, ZY, ZZ);
        entry(aa, X, Y, Z, Z, XX, XZ, YY, YZ, ZX, ZY);
        entry(aa, X, Z, Y, X, XX, XY, YY, YZ, ZX, ZZ);
        entry(aa, X, Z, Y, Y, XX, XY, YX, YZ, ZY, ZZ);
        entry(aa, X, Z, Z, X, XX, XY, YX, YZ, ZY, ZZ);
        entry(aa, X, Z, Z, Y, XX, XY, YY, YZ, ZX, ZZ);
        entry(aa, Y, X, X, Y, XX, XZ, YY, YZ, ZX, ZY);
        entry(aa, Y, X, X, Z, XX, XY, YY, YZ, ZX, ZZ);
        entry(aa, Y, X, Z, Y, XX, XY, YY, YZ, ZX, ZZ);
        entry(aa, Y, X, Z, Z, XX, XZ, YY, YZ, ZX, ZY);
        entry(aa, Y, Y, X, X, XY, XZ, YX, YZ, ZX, ZY);
        entry(aa, Y, Y, X, Z, XX, XY, YX, YZ, ZY, ZZ);
        entry(aa, Y, Y, Z, X, XX, XY, YX, YZ, ZY, ZZ);
        entry(aa, Y, Y, Z, Z, XY, XZ, YX, YZ, ZX, ZY);
        entry(aa, Y, Z, X, X, XY, XZ, YX, YY, ZX, ZZ);
        entry(aa, Y, Z, X, Y, XX, XZ, YX, YY, ZY, ZZ);
        entry(aa, Y, Z, Z, X, XX, XZ, YX, YY, ZY, ZZ);
        entry(aa, Y, Z, Z, Y, XY, XZ, YX, YY, ZX, ZZ);
        entry(aa, Z, X, X, Y, XX, XZ, YX, YY, ZY, ZZ);
        entry(aa, Z, X, X, Z, XX, XY, YX, YZ, ZY, ZZ);
        entry(aa, Z, X, Y, Y, XX, XY, YX, YZ, ZY, ZZ);
        entry(aa, Z, X, Y, Z, XX, XZ, YX, YY, ZY, ZZ);
        entry(aa, Z, Y, X, X, XY, XZ, YX, YY, ZX, ZZ);
        entry(aa, Z, Y, X, Z, XX, XY, YY, YZ, ZX, ZZ);
        entry(aa, Z, Y, Y, X, XX, XY, YY, YZ, ZX, ZZ);
        entry(aa, Z, Y, Y, Z, XY, XZ, YX, YY, ZX, ZZ);
        entry(aa, Z, Z, X, X, XY, XZ, YX, YZ, ZX, ZY);
        entry(aa, Z, Z, X, Y, XX, XZ, YY, YZ, ZX, ZY);
        entry(aa, Z, Z, Y, X, XX, XZ, YY, YZ, ZX, ZY);
        entry(aa, Z, Z, Y, Y, XY, XZ, YX, YZ, ZX, ZY);
        aaMap = aa.build();
    }

    static {
        ImmutableMap.Builder<Integer, ImmutableList<TQEType>> ac = ImmutableMap.builder();
        entry(ac, X, X, Y, X, ZX);
        entry(ac, X, X, Y, I, YX);
        entry(ac, X, X, Z, X, YX);
        entry(ac, X, X, Z, I, ZX);
        entry(ac, X, Y, Y, Y, ZY);
        entry(ac, X, Y, Y, I, YY);
        entry(ac, X, Y, Z, Y, YY);
        entry(ac, X, Y, Z, I, ZY);
        entry(ac, X, Z, Y, Z, ZZ);
        entry(ac, X, Z, Y, I, YZ);
        entry(ac, X, Z, Z, Z, YZ);
        entry(ac, X, Z, Z, I, ZZ);
        entry(ac, X, I, Y, X, XX);
        entry(ac, X, I, Y, Y, XY);
        entry(ac, X, I, Y, Z, XZ);
        entry(ac, X, I, Z, X, XX);
        entry(ac, X, I, Z, Y, XY);
        entry(ac, X, I, Z, Z, XZ);
        entry(ac, Y, X, X, X, ZX);
        entry(ac, Y, X, X, I, XX);
        entry(ac, Y, X, Z, X, XX);
        entry(ac, Y, X, Z, I, ZX);
        entry(ac, Y, Y, X, Y, ZY);
        entry(ac, Y, Y, X, I, XY);
        entry(ac, Y, Y, Z, Y, XY);
        entry(ac, Y, Y, Z, I, ZY);
        entry(ac, Y, Z, X, Z, ZZ);
        entry(ac, Y, Z, X, I, XZ);
        entry(ac, Y, Z, Z, Z, XZ);
        entry(ac, Y, Z, Z, I, ZZ);
        entry(ac, Y, I, X, X, YX);
        entry(ac, Y, I, X, Y, YY);
        entry(ac, Y, I, X, Z, YZ);
        entry(ac, Y, I, Z, X, YX);
        entry(ac, Y, I, Z, Y, YY);
        entry(ac, Y, I, Z, Z, YZ);
        entry(ac, Z, X, X, X, YX);
        entry(ac, Z, X, X, I, XX);
        entry(ac, Z, X, Y, X, XX);
        entry(ac, Z, X, Y, I, YX);
        entry(ac, Z, Y, X, Y, YY);
        entry(ac, Z, Y, X, I, XY);
        entry(ac, Z, Y, Y, Y, XY);
        entry(ac, Z, Y, Y, I, YY);
        entry(ac, Z, Z, X, Z, YZ);
        entry(ac, Z, Z, X, I, XZ);
        entry(ac, Z, Z, Y, Z, XZ);
        entry(ac, Z, Z, Y, I, YZ);
        entry(ac, Z, I, X, X, ZX);
        entry(ac, Z, I, X, Y, ZY);
        entry(ac, Z, I, X, Z, ZZ);
        entry(ac, Z, I, Y, X, ZX);
        entry(ac, Z, I, Y, Y, ZY);
        entry(ac, Z, I, Y, Z, ZZ);
        acMap = ac.build();
    }

    private static int checkedHash(TQEType t, Pauli p0, Pauli p1) {
        int h = hash(t, p0, p1);
        Verify.verify(filled[h], "no TQE table entry for %s %s %s", t, p0, p1);
        return h;
    }

    public static Pauli newFirst(TQEType t, Pauli p0, Pauli p1) { return newP0[checkedHash(t, p0, p1)]; }
    public static Pauli newSecond(TQEType t, Pauli p0, Pauli p1) { return newP1[checkedHash(t, p0, p1)]; }
    public static boolean sign(TQEType t, Pauli p0, Pauli p1) { return signs[checkedHash(t, p0, p1)]; }

    /** True if the TQE leaves the letter pair, and its sign, unchanged. */
    public static boolean commutes(TQEType t, Pauli p0, Pauli p1) { return commuteTable[checkedHash(t, p0, p1)]; }

    /** Change in the number of non-identity letters when the TQE is applied to the pair. */
    public static int costIncrease(TQEType t, Pauli p0, Pauli p1) { return costTable[checkedHash(t, p0, p1)]; }

    /** TQE types that map the non-identity pair (p, q) to a pair containing an identity. */
    public static List<TQEType> reductionTqes(Pauli p, Pauli q) {
        return Verify.verifyNotNull(reductionMap.get((p.ordinal() << 2) | q.ordinal()),
                "no reduction for %s %s", p, q);
    }

    /**
     * For an anticommuting pair of strings (z, x) which commute non-trivially on qubits a and b,
     * the TQE types that take one of the two positions to identity in both strings.
     */
    public static List<TQEType> ccToIcOrCi(Pauli za, Pauli zb, Pauli xa, Pauli xb) {
        return Verify.verifyNotNull(ccMap.get(hash(za, zb, xa, xb)), "no CC entry for %s %s %s %s", za, zb, xa, xb);
    }

    /** For positions a and b where both anticommute, the TQE types making both commute. */
    public static List<TQEType> aaToCc(Pauli za, Pauli zb, Pauli xa, Pauli xb) {
        return Verify.verifyNotNull(aaMap.get(hash(za, zb, xa, xb)), "no AA entry for %s %s %s %s", za, zb, xa, xb);
    }

    /** For a anticommuting and b commuting, the TQE type clearing position b. */
    public static List<TQEType> acToAi(Pauli za, Pauli zb, Pauli xa, Pauli xb) {
        return Verify.verifyNotNull(acMap.get(hash(za, zb, xa, xb)), "no AC entry for %s %s %s %s", za, zb, xa, xb);
    }

    /** The gate fragment realizing a TQE. */
    public static List<Command> fragment(TQE tqe) {
        int a = tqe.a(), b = tqe.b();
        switch (tqe.type()) {
            case XX: return ImmutableList.of(Command.of(OpType.H, a), Command.of(OpType.CX, a, b), Command.of(OpType.H, a));
            case XY: return ImmutableList.of(Command.of(OpType.H, a), Command.of(OpType.CY, a, b), Command.of(OpType.H, a));
            case XZ: return ImmutableList.of(Command.of(OpType.CX, b, a));
            case YX: return ImmutableList.of(Command.of(OpType.H, b), Command.of(OpType.CY, b, a), Command.of(OpType.H, b));
            case YY: return ImmutableList.of(Command.of(OpType.V, a), Command.of(OpType.CY, a, b), Command.of(OpType.Vdg, a));
            case YZ: return ImmutableList.of(Command.of(OpType.CY, b, a));
            case ZX: return ImmutableList.of(Command.of(OpType.CX, a, b));
            case ZY: return ImmutableList.of(Command.of(OpType.CY, a, b));
            case ZZ: return ImmutableList.of(Command.of(OpType.CZ, a, b));
            default: throw new IllegalStateException("unknown TQE type " + tqe.type());
        }
    }
}
