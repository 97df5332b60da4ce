package net.littleredcomputer.greedypauli.synth;

import com.google.common.base.Preconditions;
import com.google.common.primitives.UnsignedInts;

import java.util.ArrayList;
import java.util.List;

/**
 * The subtractive random number generator of the Stanford GraphBase (gb_flip). Every source of
 * randomness in synthesis goes through an instance of this class, seeded explicitly, so that a
 * run is reproducible from its seed alone.
 */
public class SGBRandom {
    private static final int two_to_the_31 = 0x80000000;
    private final int[] A = new int[56];
    private int fptr = 0;

    /* difference mod 2^31 */
    private static int modDiff(int x, int y) { return (x - y) & 0x7fffffff; }

    public SGBRandom(int seed) {
        A[0] = -1;
        int prev = modDiff(seed, 0), next = 1;
        seed = prev;
        A[55] = prev;
        for (int i = 21; i != 0; i = (i + 21) % 55) {
            A[i] = next;
            next = modDiff(prev, next);
            seed = (seed & 1) != 0 ? 0x40000000 + (seed >> 1) : seed >> 1;
            next = modDiff(next, seed);
            prev = A[i];
        }
        for (int i = 0; i < 5; ++i) flipCycle();
    }

    /** A uniform value in [0, 2^31). */
    public int nextRand() {
        return A[fptr] >= 0 ? A[fptr--] : flipCycle();
    }

    /** A uniform value in [0, m). */
    public int unifRand(int m) {
        Preconditions.checkArgument(m > 0, "unifRand bound must be positive, got %s", m);
        int t = two_to_the_31 - UnsignedInts.remainder(two_to_the_31, m);
        int r;
        do r = nextRand(); while (UnsignedInts.compare(t, r) <= 0);
        return r % m;
    }

    public <T> T choose(List<T> xs) {
        Preconditions.checkArgument(!xs.isEmpty(), "cannot choose from an empty list");
        return xs.get(unifRand(xs.size()));
    }

    /**
     * A uniform sample of k elements, without replacement, by a partial Fisher-Yates shuffle.
     * The result keeps the input's relative order.
     */
    public <T> List<T> sample(List<T> xs, int k) {
        if (k >= xs.size()) return new ArrayList<>(xs);
        int n = xs.size();
        int[] index = new int[n];
        for (int i = 0; i < n; ++i) index[i] = i;
        for (int i = 0; i < k; ++i) {
            int j = i + unifRand(n - i);
            int t = index[i];
            index[i] = index[j];
            index[j] = t;
        }
        boolean[] chosen = new boolean[n];
        for (int i = 0; i < k; ++i) chosen[index[i]] = true;
        List<T> out = new ArrayList<>(k);
        for (int i = 0; i < n; ++i) if (chosen[i]) out.add(xs.get(i));
        return out;
    }

    private int flipCycle() {
        int i, j;
        for (i = 1, j = 32; j <= 55; i++, j++) A[i] = modDiff(A[i], A[j]);
        for (j = 1; i <= 55; i++, j++) A[i] = modDiff(A[i], A[j]);
        fptr = 54;
        return A[55];
    }
}
