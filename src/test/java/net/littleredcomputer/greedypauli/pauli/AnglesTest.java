package net.littleredcomputer.greedypauli.pauli;

import org.junit.Test;

import static org.hamcrest.CoreMatchers.is;
import static org.junit.Assert.assertThat;

public class AnglesTest {
    @Test
    public void quarterTurns() {
        assertThat(Angles.cliffordQuarterTurns(0.5).getAsInt(), is(1));
        assertThat(Angles.cliffordQuarterTurns(1.0).getAsInt(), is(2));
        assertThat(Angles.cliffordQuarterTurns(-0.5).getAsInt(), is(3));
        assertThat(Angles.cliffordQuarterTurns(2.0 + 1e-13).getAsInt(), is(0));
        assertThat(Angles.isClifford(0.25), is(false));
    }

    @Test
    public void zero() {
        assertThat(Angles.isZero(0), is(true));
        assertThat(Angles.isZero(4.0), is(true));
        assertThat(Angles.isZero(-2.0), is(true));
        assertThat(Angles.isZero(1.0), is(false));
    }
}
