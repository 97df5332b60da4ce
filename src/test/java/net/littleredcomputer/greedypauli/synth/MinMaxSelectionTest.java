package net.littleredcomputer.greedypauli.synth;

import org.junit.Test;

import java.util.HashSet;
import java.util.Set;

import static org.hamcrest.CoreMatchers.is;
import static org.junit.Assert.assertThat;

public class MinMaxSelectionTest {
    private static final double[] WEIGHTS = {1.0, 0.3};

    @Test
    public void singleVaryingCoordinateIsMinimized() {
        double[][] costs = {{0, 5}, {0, 2}, {0, 7}};
        assertThat(MinMaxSelection.select(costs, WEIGHTS, new SGBRandom(1)), is(1));
    }

    @Test
    public void weightsTradeOffNormalizedCoordinates() {
        // Normalized: a = (0, 1) -> 0.3, b = (1, 0) -> 1.0.
        double[][] costs = {{-3, 9}, {-1, 4}};
        assertThat(MinMaxSelection.select(costs, WEIGHTS, new SGBRandom(1)), is(0));
        assertThat(MinMaxSelection.select(costs, new double[]{1.0, 2.0}, new SGBRandom(1)), is(1));
    }

    @Test
    public void tiesAreBrokenRandomly() {
        double[][] costs = {{1, 1}, {1, 1}, {1, 1}, {2, 2}};
        Set<Integer> seen = new HashSet<>();
        SGBRandom r = new SGBRandom(5);
        for (int i = 0; i < 200; ++i) seen.add(MinMaxSelection.select(costs, WEIGHTS, r));
        assertThat(seen.contains(3), is(false));
        assertThat(seen.size(), is(3));
    }

    @Test
    public void nothingVaries() {
        double[][] costs = {{4, 4}, {4, 4}};
        int i = MinMaxSelection.select(costs, WEIGHTS, new SGBRandom(2));
        assertThat(i == 0 || i == 1, is(true));
    }
}
