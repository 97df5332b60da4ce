package net.littleredcomputer.greedypauli.circuit;

import com.google.common.base.Preconditions;

/** A sub-circuit applied as a single op. */
public class CircBox extends Op {
    private final Circuit circuit;

    public CircBox(Circuit circuit) {
        super(OpType.CircBox);
        Preconditions.checkArgument(circuit.isPermutationTrivial(), "boxed circuit may not carry an implicit permutation");
        this.circuit = new Circuit(circuit);
    }

    public Circuit circuit() { return new Circuit(circuit); }

    @Override
    public int nQubits() { return circuit.nQubits(); }

    @Override
    public int nBits() { return circuit.nBits(); }

    @Override
    public boolean equals(Object o) {
        return super.equals(o) && circuit.equals(((CircBox) o).circuit);
    }

    @Override
    public int hashCode() { return circuit.hashCode(); }

    @Override
    public String toString() { return "CircBox[" + circuit.commands().size() + " commands]"; }
}
