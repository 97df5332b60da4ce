package net.littleredcomputer.greedypauli.pauli;

import com.google.common.collect.ImmutableList;

import java.util.List;

/**
 * exp(-i * angle * pi/2 * P), with the letters of P aligned to the qubits of a command.
 */
public final class PauliExp {
    private final ImmutableList<Pauli> paulis;
    private final double angle;

    public PauliExp(List<Pauli> paulis, double angle) {
        this.paulis = ImmutableList.copyOf(paulis);
        this.angle = angle;
    }

    static PauliExp of(double angle, Pauli... paulis) {
        return new PauliExp(ImmutableList.copyOf(paulis), angle);
    }

    public ImmutableList<Pauli> paulis() { return paulis; }
    public double angle() { return angle; }

    @Override
    public String toString() { return Pauli.join(paulis) + "^" + angle; }
}
