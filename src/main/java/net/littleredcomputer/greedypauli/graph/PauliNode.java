package net.littleredcomputer.greedypauli.graph;

import net.littleredcomputer.greedypauli.pauli.LocalClifford;
import net.littleredcomputer.greedypauli.pauli.TQE;

import javax.annotation.CheckReturnValue;
import java.util.List;

/**
 * A vertex of the Pauli dependency graph.
 *
 * <p>A node's cost is the number of TQE applications still needed before it can be emitted;
 * cost 0 means it is ready. The commit operations (the {@code update} and {@code swap}
 * methods) conjugate every string the node holds, keeping the cached cost equal to the cost
 * of a node freshly built from the new strings.
 */
public abstract class PauliNode {
    public abstract PauliNodeType type();

    public abstract int tqeCost();

    /** The change in {@link #tqeCost()} that {@link #update(TQE)} would cause. Does not mutate. */
    @CheckReturnValue
    public abstract int tqeCostIncrease(TQE tqe);

    public abstract void update(TQE tqe);

    /** Conjugates the node's strings by a single-qubit Clifford on qubit q. */
    public abstract void update(LocalClifford g, int q);

    /** Conjugates the node's strings by a SWAP of qubits a and b. */
    public abstract void swap(int a, int b);

    /** TQEs which reduce this node's cost by one. */
    public abstract List<TQE> reductionTqes();

    public abstract CommuteInfo commuteInfo();

    public static boolean nodesCommute(PauliNode a, PauliNode b) {
        return a.commuteInfo().commutesWith(b.commuteInfo());
    }
}
