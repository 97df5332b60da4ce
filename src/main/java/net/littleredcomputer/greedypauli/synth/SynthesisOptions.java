package net.littleredcomputer.greedypauli.synth;

import com.google.common.base.MoreObjects;
import com.google.common.base.Preconditions;

import java.time.Duration;

/**
 * Tuning knobs for greedy synthesis. Setters validate and return this for chaining.
 */
public class SynthesisOptions {
    private double discountRate = 0.7;
    private double depthWeight = 0.3;
    private int maxLookahead = 500;
    private int maxTqeCandidates = 500;
    private int seed = 0;
    private boolean allowZZPhase = false;
    private Duration threadTimeout = Duration.ofSeconds(100);
    private int trials = 1;
    private Duration logInterval = Duration.ofMillis(1000);

    /** Decay of the lookahead weight per layer: each layer counts 1/(1+rate) as much as the one before. */
    public SynthesisOptions setDiscountRate(double discountRate) {
        Preconditions.checkArgument(discountRate >= 0, "discount rate must be non-negative, got %s", discountRate);
        this.discountRate = discountRate;
        return this;
    }

    /** Weight of the depth coordinate relative to the gate count coordinate. */
    public SynthesisOptions setDepthWeight(double depthWeight) {
        Preconditions.checkArgument(depthWeight >= 0, "depth weight must be non-negative, got %s", depthWeight);
        this.depthWeight = depthWeight;
        return this;
    }

    public SynthesisOptions setMaxLookahead(int maxLookahead) {
        Preconditions.checkArgument(maxLookahead > 0, "max lookahead must be positive, got %s", maxLookahead);
        this.maxLookahead = maxLookahead;
        return this;
    }

    public SynthesisOptions setMaxTqeCandidates(int maxTqeCandidates) {
        Preconditions.checkArgument(maxTqeCandidates > 0, "max TQE candidates must be positive, got %s", maxTqeCandidates);
        this.maxTqeCandidates = maxTqeCandidates;
        return this;
    }

    public SynthesisOptions setSeed(int seed) {
        this.seed = seed;
        return this;
    }

    /** Lets weight-two rotations be emitted directly as ZZPhase gates. */
    public SynthesisOptions setAllowZZPhase(boolean allowZZPhase) {
        this.allowZZPhase = allowZZPhase;
        return this;
    }

    public SynthesisOptions setThreadTimeout(Duration threadTimeout) {
        Preconditions.checkArgument(!threadTimeout.isNegative() && !threadTimeout.isZero(),
                "thread timeout must be positive, got %s", threadTimeout);
        this.threadTimeout = threadTimeout;
        return this;
    }

    public SynthesisOptions setTrials(int trials) {
        Preconditions.checkArgument(trials > 0, "trials must be positive, got %s", trials);
        this.trials = trials;
        return this;
    }

    public SynthesisOptions setLogInterval(Duration logInterval) {
        this.logInterval = Preconditions.checkNotNull(logInterval);
        return this;
    }

    public double discountRate() { return discountRate; }
    public double depthWeight() { return depthWeight; }
    public int maxLookahead() { return maxLookahead; }
    public int maxTqeCandidates() { return maxTqeCandidates; }
    public int seed() { return seed; }
    public boolean allowZZPhase() { return allowZZPhase; }
    public Duration threadTimeout() { return threadTimeout; }
    public int trials() { return trials; }
    public Duration logInterval() { return logInterval; }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("discountRate", discountRate)
                .add("depthWeight", depthWeight)
                .add("maxLookahead", maxLookahead)
                .add("maxTqeCandidates", maxTqeCandidates)
                .add("seed", seed)
                .add("allowZZPhase", allowZZPhase)
                .add("threadTimeout", threadTimeout)
                .add("trials", trials)
                .toString();
    }
}
