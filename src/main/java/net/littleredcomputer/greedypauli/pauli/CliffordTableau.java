package net.littleredcomputer.greedypauli.pauli;

import com.google.common.base.Preconditions;
import net.littleredcomputer.greedypauli.GreedyPauliSimpException;
import net.littleredcomputer.greedypauli.circuit.Op;
import net.littleredcomputer.greedypauli.circuit.OpType;

import java.util.OptionalInt;

/**
 * A Clifford unitary U on n qubits, held as the images of the single-qubit Paulis under
 * conjugation by U&dagger;: {@code zRow(q) = U† Z_q U} and {@code xRow(q) = U† X_q U}. This is the
 * form needed to pull Pauli operators that follow U back through it.
 */
public class CliffordTableau {
    private final int n;
    private final PauliString[] zRows;
    private final PauliString[] xRows;

    public CliffordTableau(int n) {
        this.n = n;
        zRows = new PauliString[n];
        xRows = new PauliString[n];
        for (int q = 0; q < n; ++q) {
            zRows[q] = PauliString.single(n, q, Pauli.Z);
            xRows[q] = PauliString.single(n, q, Pauli.X);
        }
    }

    public CliffordTableau(CliffordTableau other) {
        this.n = other.n;
        this.zRows = other.zRows.clone();
        this.xRows = other.xRows.clone();
    }

    public int nQubits() { return n; }
    public PauliString zRow(int q) { return zRows[q]; }
    public PauliString xRow(int q) { return xRows[q]; }

    /** U&dagger; p U. */
    public PauliString rowProduct(PauliString p) {
        Preconditions.checkArgument(p.size() == n, "string of length %s on a %s qubit tableau", p.size(), n);
        PauliString r = PauliString.identity(n).timesI(p.phase());
        for (int q = 0; q < n; ++q) {
            switch (p.get(q)) {
                case I: break;
                case X: r = r.multiply(xRows[q]); break;
                case Z: r = r.multiply(zRows[q]); break;
                // Y = iXZ
                case Y: r = r.multiply(xRows[q]).multiply(zRows[q]).timesI(1); break;
            }
        }
        return r;
    }

    /**
     * U becomes exp(-i k pi/4 p) U, where p is expressed on the output side of U.
     */
    public void applyPauliAtEnd(PauliString p, int k) {
        k &= 3;
        if (k == 0) return;
        PauliString r = rowProduct(p);
        for (int q = 0; q < n; ++q) {
            // Z_q anticommutes with X and Y at q, X_q with Y and Z.
            if (p.get(q).x()) zRows[q] = rotate(zRows[q], r, k);
            if (p.get(q).z()) xRows[q] = rotate(xRows[q], r, k);
        }
    }

    /**
     * U becomes U exp(-i k pi/4 p), where p is expressed on the input side of U.
     */
    public void applyPauliAtFront(PauliString p, int k) {
        k &= 3;
        if (k == 0) return;
        for (int q = 0; q < n; ++q) {
            if (!p.commutes(zRows[q])) zRows[q] = rotate(zRows[q], p, k);
            if (!p.commutes(xRows[q])) xRows[q] = rotate(xRows[q], p, k);
        }
    }

    // e^{ik pi/4 P} R e^{-ik pi/4 P} for R anticommuting with P is e^{ik pi/2 P} R.
    private static PauliString rotate(PauliString row, PauliString p, int k) {
        switch (k) {
            case 1: return p.multiply(row).timesI(1);
            case 2: return row.negate();
            case 3: return p.multiply(row).timesI(3);
            default: throw new IllegalStateException("quarter turns " + k);
        }
    }

    /** Applies a Clifford gate at the end of U. */
    public void applyGate(OpType type, int... qubits) {
        applyGate(Op.gate(type), qubits);
    }

    public void applyGate(Op op, int... qubits) {
        for (PauliExp e : GateRotations.of(op)) {
            OptionalInt k = Angles.cliffordQuarterTurns(e.angle());
            if (!k.isPresent()) {
                throw new GreedyPauliSimpException(op + " is not a Clifford gate");
            }
            applyPauliAtEnd(PauliString.onQubits(n, e.paulis().toArray(new Pauli[0]), qubits), k.getAsInt());
        }
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        for (int q = 0; q < n; ++q) sb.append("Z").append(q).append(" -> ").append(zRows[q])
                .append("  X").append(q).append(" -> ").append(xRows[q]).append('\n');
        return sb.toString();
    }
}
