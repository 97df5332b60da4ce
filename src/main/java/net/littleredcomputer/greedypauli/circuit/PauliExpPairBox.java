package net.littleredcomputer.greedypauli.circuit;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import net.littleredcomputer.greedypauli.pauli.Pauli;

import java.util.List;

/**
 * Two Pauli exponentials on the same qubits, the first applied first.
 */
public class PauliExpPairBox extends Op {
    private final ImmutableList<Pauli> paulis0;
    private final double angle0;
    private final ImmutableList<Pauli> paulis1;
    private final double angle1;

    public PauliExpPairBox(List<Pauli> paulis0, double angle0, List<Pauli> paulis1, double angle1) {
        super(OpType.PauliExpPairBox);
        Preconditions.checkArgument(!paulis0.isEmpty() && paulis0.size() == paulis1.size(),
                "PauliExpPairBox strings must be non-empty and of equal length, got %s and %s",
                paulis0.size(), paulis1.size());
        this.paulis0 = ImmutableList.copyOf(paulis0);
        this.angle0 = angle0;
        this.paulis1 = ImmutableList.copyOf(paulis1);
        this.angle1 = angle1;
    }

    public ImmutableList<Pauli> paulis0() { return paulis0; }
    public double angle0() { return angle0; }
    public ImmutableList<Pauli> paulis1() { return paulis1; }
    public double angle1() { return angle1; }

    @Override
    public int nQubits() { return paulis0.size(); }

    @Override
    public boolean equals(Object o) {
        if (!super.equals(o)) return false;
        PauliExpPairBox that = (PauliExpPairBox) o;
        return angle0 == that.angle0 && angle1 == that.angle1
                && paulis0.equals(that.paulis0) && paulis1.equals(that.paulis1);
    }

    @Override
    public int hashCode() {
        return 31 * (31 * paulis0.hashCode() + paulis1.hashCode()) + Double.hashCode(angle0 + 3 * angle1);
    }

    @Override
    public String toString() {
        return "PauliExpPairBox(" + Pauli.join(paulis0) + "," + angle0 + ";"
                + Pauli.join(paulis1) + "," + angle1 + ")";
    }
}
