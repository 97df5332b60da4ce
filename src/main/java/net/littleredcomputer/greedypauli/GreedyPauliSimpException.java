package net.littleredcomputer.greedypauli;

/**
 * Raised when a synthesis input cannot be represented: a degenerate Pauli string, mismatched
 * arities, or a malformed condition.
 */
public class GreedyPauliSimpException extends IllegalArgumentException {
    public GreedyPauliSimpException(String message) {
        super(message);
    }
}
