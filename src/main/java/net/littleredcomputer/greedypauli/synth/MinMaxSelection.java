package net.littleredcomputer.greedypauli.synth;

import com.google.common.base.Preconditions;
import gnu.trove.list.array.TIntArrayList;

/**
 * Multi-objective choice among candidates. Each coordinate is rescaled to [0, 1] by its range
 * over the candidates; coordinates with no spread are ignored. The rescaled coordinates are
 * combined with fixed weights and a minimizer is drawn uniformly from among the ties.
 */
final class MinMaxSelection {
    private static final double TIE = 1e-9;

    private MinMaxSelection() {}

    static int select(double[][] costs, double[] weights, SGBRandom random) {
        Preconditions.checkArgument(costs.length > 0, "no candidates");
        int n = costs.length, d = weights.length;
        double[] min = new double[d], max = new double[d];
        for (int j = 0; j < d; ++j) {
            min[j] = Double.POSITIVE_INFINITY;
            max[j] = Double.NEGATIVE_INFINITY;
            for (double[] c : costs) {
                min[j] = Math.min(min[j], c[j]);
                max[j] = Math.max(max[j], c[j]);
            }
        }
        TIntArrayList valid = new TIntArrayList();
        for (int j = 0; j < d; ++j) if (min[j] != max[j]) valid.add(j);

        double[] score = new double[n];
        if (valid.size() == 1) {
            int j = valid.get(0);
            for (int i = 0; i < n; ++i) score[i] = costs[i][j];
        } else {
            for (int i = 0; i < n; ++i) {
                for (int j : valid.toArray()) score[i] += weights[j] * (costs[i][j] - min[j]) / (max[j] - min[j]);
            }
        }
        double best = Double.POSITIVE_INFINITY;
        for (double s : score) best = Math.min(best, s);
        TIntArrayList ties = new TIntArrayList();
        for (int i = 0; i < n; ++i) if (score[i] <= best + TIE) ties.add(i);
        return ties.get(random.unifRand(ties.size()));
    }
}
