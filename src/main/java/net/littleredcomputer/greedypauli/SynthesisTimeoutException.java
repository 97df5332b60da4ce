package net.littleredcomputer.greedypauli;

import java.time.Duration;

/**
 * Raised when no synthesis trial finished within its time budget.
 */
public class SynthesisTimeoutException extends RuntimeException {
    public SynthesisTimeoutException(int trials, Duration timeout) {
        super(String.format("none of %d trials finished within %s", trials, timeout));
    }
}
