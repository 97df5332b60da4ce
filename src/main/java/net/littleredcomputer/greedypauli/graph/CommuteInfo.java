package net.littleredcomputer.greedypauli.graph;

import com.google.common.collect.ImmutableList;
import gnu.trove.set.TIntSet;
import gnu.trove.set.hash.TIntHashSet;
import net.littleredcomputer.greedypauli.pauli.Pauli;
import net.littleredcomputer.greedypauli.pauli.PauliString;

import java.util.List;

/**
 * What a node exposes for ordering purposes: the Pauli strings it acts with and the classical
 * bits it reads and writes.
 */
public final class CommuteInfo {
    private final ImmutableList<Pauli[]> strings;
    private final TIntSet reads;
    private final TIntSet writes;

    CommuteInfo(List<Pauli[]> strings, int[] reads, int[] writes) {
        this.strings = ImmutableList.copyOf(strings);
        this.reads = new TIntHashSet(reads);
        this.writes = new TIntHashSet(writes);
    }

    static CommuteInfo ofStrings(Pauli[]... strings) {
        return new CommuteInfo(ImmutableList.copyOf(strings), new int[0], new int[0]);
    }

    public List<Pauli[]> strings() { return strings; }
    public TIntSet reads() { return new TIntHashSet(reads); }
    public TIntSet writes() { return new TIntHashSet(writes); }

    /**
     * True if every exposed string commutes with every string of the other, and no bit is
     * written by one side while the other reads or writes it.
     */
    public boolean commutesWith(CommuteInfo other) {
        for (Pauli[] s : strings) {
            for (Pauli[] t : other.strings) {
                if (!PauliString.commutes(s, t)) return false;
            }
        }
        return !hazard(this, other) && !hazard(other, this);
    }

    private static boolean hazard(CommuteInfo w, CommuteInfo r) {
        for (int b : w.writes.toArray()) {
            if (r.writes.contains(b) || r.reads.contains(b)) return true;
        }
        return false;
    }
}
