package net.littleredcomputer.greedypauli.circuit;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import net.littleredcomputer.greedypauli.pauli.Pauli;

import java.util.List;

/**
 * exp(-i * angle * pi/2 * P) for a Pauli string P over the box's qubits.
 */
public class PauliExpBox extends Op {
    private final ImmutableList<Pauli> paulis;
    private final double angle;

    public PauliExpBox(List<Pauli> paulis, double angle) {
        super(OpType.PauliExpBox);
        Preconditions.checkArgument(!paulis.isEmpty(), "PauliExpBox needs at least one qubit");
        this.paulis = ImmutableList.copyOf(paulis);
        this.angle = angle;
    }

    public ImmutableList<Pauli> paulis() { return paulis; }
    public double angle() { return angle; }

    @Override
    public int nQubits() { return paulis.size(); }

    @Override
    public boolean equals(Object o) {
        if (!super.equals(o)) return false;
        PauliExpBox that = (PauliExpBox) o;
        return angle == that.angle && paulis.equals(that.paulis);
    }

    @Override
    public int hashCode() { return 31 * paulis.hashCode() + Double.hashCode(angle); }

    @Override
    public String toString() { return "PauliExpBox(" + Pauli.join(paulis) + "," + angle + ")"; }
}
