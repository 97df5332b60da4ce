package net.littleredcomputer.greedypauli.pauli;

/**
 * The nine two-qubit entangling basis changes. The declaration order is significant: the lookup
 * tables hash on the ordinal.
 */
public enum TQEType {
    XX, XY, XZ, YX, YY, YZ, ZX, ZY, ZZ
}
