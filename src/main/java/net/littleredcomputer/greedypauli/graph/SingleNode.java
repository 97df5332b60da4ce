package net.littleredcomputer.greedypauli.graph;

import net.littleredcomputer.greedypauli.GreedyPauliSimpException;
import net.littleredcomputer.greedypauli.pauli.*;

import java.util.ArrayList;
import java.util.List;

/**
 * A node carrying one signed Pauli string. Its cost is the string's weight minus one.
 */
public abstract class SingleNode extends PauliNode {
    final Pauli[] string;
    boolean sign;
    private int weight;

    SingleNode(Pauli[] string, boolean sign) {
        if (string.length == 0) throw new GreedyPauliSimpException("Pauli string cannot be empty");
        this.string = string.clone();
        this.sign = sign;
        for (Pauli p : string) if (p != Pauli.I) ++weight;
        if (weight == 0) throw new GreedyPauliSimpException("Pauli string cannot be identity");
    }

    public Pauli[] string() { return string.clone(); }
    public boolean sign() { return sign; }
    public int weight() { return weight; }

    public PauliString pauliString() { return PauliString.of(sign, string); }

    @Override
    public int tqeCost() { return weight - 1; }

    @Override
    public int tqeCostIncrease(TQE tqe) {
        return TQETables.costIncrease(tqe.type(), string[tqe.a()], string[tqe.b()]);
    }

    @Override
    public void update(TQE tqe) {
        int a = tqe.a(), b = tqe.b();
        Pauli p = string[a], q = string[b];
        weight += TQETables.costIncrease(tqe.type(), p, q);
        string[a] = TQETables.newFirst(tqe.type(), p, q);
        string[b] = TQETables.newSecond(tqe.type(), p, q);
        if (!TQETables.sign(tqe.type(), p, q)) sign = !sign;
    }

    @Override
    public void update(LocalClifford g, int q) {
        if (!g.sign(string[q])) sign = !sign;
        string[q] = g.image(string[q]);
    }

    @Override
    public void swap(int a, int b) {
        Pauli t = string[a];
        string[a] = string[b];
        string[b] = t;
    }

    @Override
    public List<TQE> reductionTqes() {
        List<TQE> tqes = new ArrayList<>();
        for (int a = 0; a < string.length; ++a) {
            if (string[a] == Pauli.I) continue;
            for (int b = a + 1; b < string.length; ++b) {
                if (string[b] == Pauli.I) continue;
                for (TQEType t : TQETables.reductionTqes(string[a], string[b])) tqes.add(new TQE(t, a, b));
            }
        }
        return tqes;
    }

    /** The first qubit on which the string is not identity. */
    public int firstSupport() {
        for (int i = 0; i < string.length; ++i) if (string[i] != Pauli.I) return i;
        throw new IllegalStateException("identity string");
    }

    /** Qubits on which the string is not identity, in increasing order. */
    public int[] support() {
        int[] s = new int[weight];
        for (int i = 0, j = 0; i < string.length; ++i) if (string[i] != Pauli.I) s[j++] = i;
        return s;
    }
}
