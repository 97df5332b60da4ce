package net.littleredcomputer.greedypauli.graph;

import net.littleredcomputer.greedypauli.pauli.Pauli;

/**
 * How the two strings of an {@link ACPairNode} relate at one position.
 */
enum CommuteType {
    /** Both letters are identity. */
    I,
    /** The letters commute and at least one is not identity. */
    C,
    /** The letters anticommute. */
    A;

    static CommuteType of(Pauli z, Pauli x) {
        if (z == Pauli.I && x == Pauli.I) return I;
        return z.commutesWith(x) ? C : A;
    }
}
