package net.littleredcomputer.greedypauli.synth;

import org.junit.Test;

import java.time.Duration;

import static org.hamcrest.CoreMatchers.is;
import static org.junit.Assert.assertThat;

public class SynthesisOptionsTest {
    @Test
    public void defaults() {
        SynthesisOptions o = new SynthesisOptions();
        assertThat(o.discountRate(), is(0.7));
        assertThat(o.depthWeight(), is(0.3));
        assertThat(o.maxLookahead(), is(500));
        assertThat(o.maxTqeCandidates(), is(500));
        assertThat(o.seed(), is(0));
        assertThat(o.allowZZPhase(), is(false));
        assertThat(o.threadTimeout(), is(Duration.ofSeconds(100)));
        assertThat(o.trials(), is(1));
    }

    @Test
    public void chaining() {
        SynthesisOptions o = new SynthesisOptions().setTrials(3).setSeed(-4).setAllowZZPhase(true);
        assertThat(o.trials(), is(3));
        assertThat(o.seed(), is(-4));
        assertThat(o.allowZZPhase(), is(true));
    }

    @Test(expected = IllegalArgumentException.class)
    public void negativeDiscount() {
        new SynthesisOptions().setDiscountRate(-0.1);
    }

    @Test(expected = IllegalArgumentException.class)
    public void negativeDepthWeight() {
        new SynthesisOptions().setDepthWeight(-1);
    }

    @Test(expected = IllegalArgumentException.class)
    public void zeroLookahead() {
        new SynthesisOptions().setMaxLookahead(0);
    }

    @Test(expected = IllegalArgumentException.class)
    public void zeroCandidates() {
        new SynthesisOptions().setMaxTqeCandidates(0);
    }

    @Test(expected = IllegalArgumentException.class)
    public void zeroTrials() {
        new SynthesisOptions().setTrials(0);
    }

    @Test(expected = IllegalArgumentException.class)
    public void zeroTimeout() {
        new SynthesisOptions().setThreadTimeout(Duration.ZERO);
    }
}
