package net.littleredcomputer.greedypauli.synth;

/**
 * Per-qubit depth of the circuit being emitted.
 */
public class DepthTracker {
    private final int[] depth;
    private int maxDepth = 0;

    public DepthTracker(int nQubits) {
        depth = new int[nQubits];
    }

    /** The depth a two-qubit gate on (a, b) would end at. */
    public int gateDepth(int a, int b) {
        return Math.max(depth[a], depth[b]) + 1;
    }

    public int depth(int q) { return depth[q]; }
    public int maxDepth() { return maxDepth; }

    public void add1q(int q) {
        maxDepth = Math.max(maxDepth, ++depth[q]);
    }

    public void add2q(int a, int b) {
        int d = gateDepth(a, b);
        depth[a] = depth[b] = d;
        maxDepth = Math.max(maxDepth, d);
    }

    /** An op spanning several qubits ends one past the deepest of them. */
    public void addOp(int... qubits) {
        int d = 0;
        for (int q : qubits) d = Math.max(d, depth[q]);
        ++d;
        for (int q : qubits) depth[q] = d;
        maxDepth = Math.max(maxDepth, d);
    }
}
