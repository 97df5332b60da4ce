package net.littleredcomputer.greedypauli.synth;

import org.junit.Test;

import static org.hamcrest.CoreMatchers.is;
import static org.junit.Assert.assertThat;

public class DepthTrackerTest {
    @Test
    public void depths() {
        DepthTracker d = new DepthTracker(3);
        d.add1q(0);
        d.add1q(0);
        assertThat(d.gateDepth(0, 1), is(3));
        d.add2q(0, 1);
        assertThat(d.depth(1), is(3));
        assertThat(d.depth(2), is(0));
        d.add1q(2);
        d.addOp(1, 2);
        assertThat(d.depth(2), is(4));
        assertThat(d.maxDepth(), is(4));
    }
}
