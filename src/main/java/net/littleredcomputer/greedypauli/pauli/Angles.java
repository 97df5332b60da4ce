package net.littleredcomputer.greedypauli.pauli;

import java.util.OptionalInt;

/**
 * Helpers for angles expressed in half-turns.
 */
public final class Angles {
    public static final double EPS = 1e-11;

    private Angles() {}

    /**
     * If the angle is a multiple of a quarter turn (0.5 half-turns), the number of quarter turns
     * mod 4.
     */
    public static OptionalInt cliffordQuarterTurns(double angle) {
        double k = angle * 2;
        double r = Math.rint(k);
        if (Math.abs(k - r) > EPS) return OptionalInt.empty();
        return OptionalInt.of((int) (((long) r % 4 + 4) % 4));
    }

    public static boolean isClifford(double angle) {
        return cliffordQuarterTurns(angle).isPresent();
    }

    /** True if the angle is 0 mod 2 half-turns, i.e. the rotation is the identity up to phase. */
    public static boolean isZero(double angle) {
        double r = angle / 2;
        return Math.abs(r - Math.rint(r)) <= EPS / 2;
    }
}
