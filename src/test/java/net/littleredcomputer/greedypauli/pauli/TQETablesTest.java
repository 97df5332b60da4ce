// Copyright 2018 Colin Smith. MIT License.
package net.littleredcomputer.greedypauli.pauli;

import net.littleredcomputer.greedypauli.circuit.Command;
import org.junit.Test;

import static net.littleredcomputer.greedypauli.pauli.Pauli.I;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.empty;
import static org.junit.Assert.assertThat;

public class TQETablesTest {
    private static int weight(Pauli a, Pauli b) {
        return (a == I ? 0 : 1) + (b == I ? 0 : 1);
    }

    @Test
    public void entriesAreSelfConsistent() {
        int n = 0;
        for (TQEType t : TQEType.values()) {
            for (Pauli p : Pauli.values()) {
                for (Pauli q : Pauli.values()) {
                    Pauli p1 = TQETables.newFirst(t, p, q), q1 = TQETables.newSecond(t, p, q);
                    boolean sign = TQETables.sign(t, p, q);
                    assertThat(TQETables.costIncrease(t, p, q), is(weight(p1, q1) - weight(p, q)));
                    assertThat(TQETables.commutes(t, p, q), is(p1 == p && q1 == q && sign));
                    ++n;
                }
            }
        }
        assertThat(n, is(144));
    }

    // Each entry must agree with conjugating the pair through the TQE's gate fragment.
    @Test
    public void entriesMatchFragments() {
        for (TQEType t : TQEType.values()) {
            CliffordTableau tab = new CliffordTableau(2);
            for (Command c : TQETables.fragment(new TQE(t, 0, 1))) tab.applyGate(c.op(), c.qubits());
            for (Pauli p : Pauli.values()) {
                for (Pauli q : Pauli.values()) {
                    PauliString expected = PauliString.of(TQETables.sign(t, p, q),
                            TQETables.newFirst(t, p, q), TQETables.newSecond(t, p, q));
                    assertThat(t + " " + p + q, tab.rowProduct(PauliString.of(p, q)), is(expected));
                }
            }
        }
    }

    @Test
    public void reductionsReduce() {
        for (Pauli p : Pauli.values()) {
            for (Pauli q : Pauli.values()) {
                if (p == I || q == I) continue;
                assertThat(TQETables.reductionTqes(p, q).isEmpty(), is(false));
                for (TQEType t : TQETables.reductionTqes(p, q)) {
                    assertThat(t + " " + p + q, TQETables.costIncrease(t, p, q), is(-1));
                }
            }
        }
    }

    @Test
    public void fragmentsAreTwoQubitClifford() {
        for (TQEType t : TQEType.values()) {
            long twoQubit = TQETables.fragment(new TQE(t, 2, 0)).stream().filter(c -> c.qubits().length == 2).count();
            assertThat(twoQubit, is(1L));
        }
    }

    private static boolean letterCommutes(Pauli p, Pauli q) {
        return p == I || q == I || p == q;
    }

    private static boolean clears(TQEType t, Pauli za, Pauli zb, Pauli xa, Pauli xb, boolean first) {
        if (first) return TQETables.newFirst(t, za, zb) == I && TQETables.newFirst(t, xa, xb) == I;
        return TQETables.newSecond(t, za, zb) == I && TQETables.newSecond(t, xa, xb) == I;
    }

    @Test
    public void reverseMapsCoverEveryConfiguration() {
        int cc = 0, aa = 0, ac = 0;
        for (Pauli za : Pauli.values()) for (Pauli zb : Pauli.values()) for (Pauli xa : Pauli.values()) for (Pauli xb : Pauli.values()) {
            boolean aCommutes = letterCommutes(za, xa), bCommutes = letterCommutes(zb, xb);
            boolean aUsed = za != I || xa != I, bUsed = zb != I || xb != I;
            if (aCommutes && bCommutes && aUsed && bUsed) {
                ++cc;
                for (TQEType t : TQETables.ccToIcOrCi(za, zb, xa, xb)) {
                    assertThat(t.toString(), clears(t, za, zb, xa, xb, true) || clears(t, za, zb, xa, xb, false), is(true));
                }
            }
            if (!aCommutes && !bCommutes) {
                ++aa;
                assertThat(TQETables.aaToCc(za, zb, xa, xb).isEmpty(), is(false));
                for (TQEType t : TQETables.aaToCc(za, zb, xa, xb)) {
                    assertThat(letterCommutes(TQETables.newFirst(t, za, zb), TQETables.newFirst(t, xa, xb)), is(true));
                    assertThat(letterCommutes(TQETables.newSecond(t, za, zb), TQETables.newSecond(t, xa, xb)), is(true));
                }
            }
            if (!aCommutes && bCommutes && bUsed) {
                ++ac;
                assertThat(TQETables.acToAi(za, zb, xa, xb).isEmpty(), is(false));
                for (TQEType t : TQETables.acToAi(za, zb, xa, xb)) {
                    assertThat(clears(t, za, zb, xa, xb, false), is(true));
                }
            }
        }
        assertThat(cc, is(81));
        assertThat(aa, is(36));
        assertThat(ac, is(54));
        // Already weight one in the x string: nothing to do.
        assertThat(TQETables.ccToIcOrCi(Pauli.X, Pauli.X, Pauli.X, I), empty());
        assertThat(TQETables.ccToIcOrCi(Pauli.X, Pauli.X, Pauli.X, Pauli.X),
                contains(TQEType.XY, TQEType.XZ, TQEType.YX, TQEType.ZX));
    }

    @Test(expected = IllegalArgumentException.class)
    public void tqeNeedsDistinctQubits() {
        new TQE(TQEType.ZZ, 1, 1);
    }
}
