package net.littleredcomputer.greedypauli.circuit;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.primitives.ImmutableDoubleArray;
import net.littleredcomputer.greedypauli.pauli.Pauli;
import net.littleredcomputer.greedypauli.pauli.PauliString;

import java.util.List;

/**
 * A set of mutually commuting Pauli exponentials on the same qubits.
 */
public class PauliExpCommutingSetBox extends Op {
    private final ImmutableList<ImmutableList<Pauli>> strings;
    private final ImmutableDoubleArray angles;

    public PauliExpCommutingSetBox(List<List<Pauli>> strings, double[] angles) {
        super(OpType.PauliExpCommutingSetBox);
        Preconditions.checkArgument(!strings.isEmpty(), "empty PauliExpCommutingSetBox");
        Preconditions.checkArgument(strings.size() == angles.length, "%s strings but %s angles",
                strings.size(), angles.length);
        ImmutableList.Builder<ImmutableList<Pauli>> b = ImmutableList.builder();
        int n = strings.get(0).size();
        for (List<Pauli> s : strings) {
            Preconditions.checkArgument(s.size() == n && n > 0, "strings must be non-empty and of equal length");
            b.add(ImmutableList.copyOf(s));
        }
        this.strings = b.build();
        for (int i = 0; i < this.strings.size(); ++i) {
            for (int j = i + 1; j < this.strings.size(); ++j) {
                Preconditions.checkArgument(PauliString.of(this.strings.get(i)).commutes(PauliString.of(this.strings.get(j))),
                        "strings %s and %s do not commute", i, j);
            }
        }
        this.angles = ImmutableDoubleArray.copyOf(angles);
    }

    public ImmutableList<ImmutableList<Pauli>> strings() { return strings; }
    public double angle(int i) { return angles.get(i); }

    @Override
    public int nQubits() { return strings.get(0).size(); }

    @Override
    public boolean equals(Object o) {
        if (!super.equals(o)) return false;
        PauliExpCommutingSetBox that = (PauliExpCommutingSetBox) o;
        return strings.equals(that.strings) && angles.equals(that.angles);
    }

    @Override
    public int hashCode() { return 31 * strings.hashCode() + angles.hashCode(); }

    @Override
    public String toString() { return "PauliExpCommutingSetBox" + strings + angles; }
}
