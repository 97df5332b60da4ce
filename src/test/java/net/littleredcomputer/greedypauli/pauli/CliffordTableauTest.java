package net.littleredcomputer.greedypauli.pauli;

import net.littleredcomputer.greedypauli.GreedyPauliSimpException;
import net.littleredcomputer.greedypauli.circuit.OpType;
import org.junit.Test;

import static org.hamcrest.CoreMatchers.is;
import static org.junit.Assert.assertThat;

public class CliffordTableauTest {
    @Test
    public void hadamard() {
        CliffordTableau t = new CliffordTableau(1);
        t.applyGate(OpType.H, 0);
        assertThat(t.zRow(0), is(PauliString.parse("X")));
        assertThat(t.xRow(0), is(PauliString.parse("Z")));
        assertThat(t.rowProduct(PauliString.parse("Y")), is(PauliString.parse("-Y")));
    }

    @Test
    public void phase() {
        CliffordTableau t = new CliffordTableau(1);
        t.applyGate(OpType.S, 0);
        assertThat(t.zRow(0), is(PauliString.parse("Z")));
        assertThat(t.xRow(0), is(PauliString.parse("-Y")));
    }

    @Test
    public void cnot() {
        CliffordTableau t = new CliffordTableau(2);
        t.applyGate(OpType.CX, 0, 1);
        assertThat(t.zRow(0), is(PauliString.parse("ZI")));
        assertThat(t.zRow(1), is(PauliString.parse("ZZ")));
        assertThat(t.xRow(0), is(PauliString.parse("XX")));
        assertThat(t.xRow(1), is(PauliString.parse("IX")));
    }

    @Test
    public void swapExchangesRows() {
        CliffordTableau t = new CliffordTableau(3);
        t.applyGate(OpType.H, 0);
        t.applyGate(OpType.SWAP, 0, 2);
        assertThat(t.zRow(2), is(PauliString.parse("XII")));
        assertThat(t.zRow(0), is(PauliString.parse("IIZ")));
    }

    @Test
    public void gateThenInverseIsIdentity() {
        CliffordTableau t = new CliffordTableau(2);
        t.applyGate(OpType.V, 1);
        t.applyGate(OpType.CY, 1, 0);
        t.applyGate(OpType.CY, 1, 0);
        t.applyGate(OpType.Vdg, 1);
        CliffordTableau id = new CliffordTableau(2);
        for (int q = 0; q < 2; ++q) {
            assertThat(t.zRow(q), is(id.zRow(q)));
            assertThat(t.xRow(q), is(id.xRow(q)));
        }
    }

    // On the identity, a rotation at the front and at the end are the same thing.
    @Test
    public void frontAndEndAgreeOnIdentity() {
        CliffordTableau a = new CliffordTableau(2), b = new CliffordTableau(2);
        PauliString p = PauliString.parse("XZ");
        a.applyPauliAtEnd(p, 1);
        b.applyPauliAtFront(p, 1);
        for (int q = 0; q < 2; ++q) {
            assertThat(a.zRow(q), is(b.zRow(q)));
            assertThat(a.xRow(q), is(b.xRow(q)));
        }
    }

    @Test
    public void copyIsIndependent() {
        CliffordTableau a = new CliffordTableau(1);
        CliffordTableau b = new CliffordTableau(a);
        b.applyGate(OpType.H, 0);
        assertThat(a.zRow(0), is(PauliString.parse("Z")));
    }

    @Test(expected = GreedyPauliSimpException.class)
    public void rejectsNonClifford() {
        new CliffordTableau(1).applyGate(OpType.T, 0);
    }
}
