// Copyright 2018 Colin Smith. MIT License.
package net.littleredcomputer.greedypauli.graph;

import gnu.trove.list.array.TIntArrayList;
import gnu.trove.set.TIntSet;
import gnu.trove.set.hash.TIntHashSet;
import net.littleredcomputer.greedypauli.BadOpTypeException;
import net.littleredcomputer.greedypauli.circuit.*;
import net.littleredcomputer.greedypauli.pauli.*;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.message.FormattedMessage;

import javax.annotation.Nullable;
import java.util.*;

/**
 * The dependency graph of a circuit's non-Clifford content, plus the Clifford tableau of
 * everything that has been commuted to the end.
 *
 * <p>Vertices live in an arena addressed by stable index; removed vertices leave a null
 * tombstone. An edge u -> v records that u must precede v. The graph is acyclic, and any two
 * vertices that do not commute are connected by a path.
 */
public class GPGraph {
    private static final Logger log = LogManager.getFormatterLogger(GPGraph.class);

    private final int nQubits;
    private final int nBits;
    private final List<PauliNode> vertices = new ArrayList<>();
    private final List<TIntSet> succs = new ArrayList<>();
    private final List<TIntSet> preds = new ArrayList<>();
    private final TIntSet startLine = new TIntHashSet();
    private final TIntSet endLine = new TIntHashSet();
    private final CliffordTableau cliff;
    private int merges = 0;

    public GPGraph(int nQubits, int nBits) {
        this.nQubits = nQubits;
        this.nBits = nBits;
        this.cliff = new CliffordTableau(nQubits);
    }

    /** Builds the graph of a circuit in a single pass over its commands. */
    public GPGraph(Circuit circuit) {
        this(circuit.nQubits(), circuit.nBits());
        for (Command c : circuit.commands()) apply(c);
        applyPermutation(circuit.permutation());
        log.debug(() -> new FormattedMessage("%d commands -> %d vertices, %d merges",
                circuit.nGates(), nVertices(), merges));
    }

    public int nQubits() { return nQubits; }
    public int nBits() { return nBits; }
    public CliffordTableau tableau() { return new CliffordTableau(cliff); }

    public int nVertices() {
        int n = 0;
        for (PauliNode v : vertices) if (v != null) ++n;
        return n;
    }

    /** The node at an index, or null if the vertex was removed. */
    @Nullable
    public PauliNode vertex(int v) { return vertices.get(v); }

    public TIntSet successors(int v) { return new TIntHashSet(succs.get(v)); }
    public TIntSet predecessors(int v) { return new TIntHashSet(preds.get(v)); }
    public TIntSet startLine() { return new TIntHashSet(startLine); }
    public TIntSet endLine() { return new TIntHashSet(endLine); }

    private void apply(Command c) {
        Op op = c.op();
        int[] qubits = c.qubits();
        switch (op.type()) {
            case Measure:
                measure(qubits[0], c.bits()[0]);
                break;
            case Reset:
                reset(qubits[0]);
                break;
            case Classical:
                applyNodeAtEnd(new ClassicalNode(c));
                break;
            case Conditional:
                applyConditional(c);
                break;
            default:
                for (PauliExp e : GateRotations.of(op)) {
                    applyPauliAtEnd(PauliString.onQubits(nQubits, e.paulis().toArray(new Pauli[0]), qubits), e.angle());
                }
        }
    }

    private void applyConditional(Command c) {
        Conditional cond = (Conditional) c.op();
        Op inner = cond.op();
        int[] bits = c.bits();
        int[] condBits = Arrays.copyOf(bits, cond.width());
        switch (inner.type()) {
            case Classical:
                applyNodeAtEnd(new ClassicalNode(c));
                return;
            case Measure:
            case Reset:
            case Conditional:
            case CircBox:
            case Barrier:
                throw new BadOpTypeException(inner.type(), "under a classical condition");
            default:
                break;
        }
        List<PauliRotation> rotations = new ArrayList<>();
        for (PauliExp e : GateRotations.of(inner)) {
            PauliString p = PauliString.onQubits(nQubits, e.paulis().toArray(new Pauli[0]), c.qubits());
            if (p.isIdentity() || Angles.isZero(e.angle())) continue;
            PauliString r = cliff.rowProduct(p);
            rotations.add(new PauliRotation(r.letters(), r.sign(), e.angle()));
        }
        if (!rotations.isEmpty()) applyNodeAtEnd(new ConditionalBlock(rotations, condBits, cond.value()));
    }

    /**
     * Applies exp(-i angle pi/2 p) after everything so far. Clifford rotations are absorbed by the
     * tableau; others are pulled back through it and inserted as a vertex.
     */
    public void applyPauliAtEnd(PauliString p, double angle) {
        if (p.isIdentity()) return;
        OptionalInt k = Angles.cliffordQuarterTurns(angle);
        if (k.isPresent()) {
            cliff.applyPauliAtEnd(p, k.getAsInt());
            return;
        }
        PauliString r = cliff.rowProduct(p);
        applyNodeAtEnd(new PauliRotation(r.letters(), r.sign(), angle));
    }

    public void applyGateAtEnd(OpType type, int... qubits) {
        apply(Command.of(type, qubits));
    }

    public void measure(int qubit, int bit) {
        PauliString z = cliff.zRow(qubit);
        applyNodeAtEnd(new MidMeasure(z.letters(), z.sign(), bit));
    }

    public void reset(int qubit) {
        PauliString z = cliff.zRow(qubit), x = cliff.xRow(qubit);
        applyNodeAtEnd(new Reset(z.letters(), x.letters(), z.sign(), x.sign()));
    }

    // Sends gate qubit q to wire permutation[q] with SWAPs on the tableau.
    private void applyPermutation(int[] permutation) {
        int[] where = new int[nQubits];
        int[] holder = new int[nQubits];
        for (int q = 0; q < nQubits; ++q) where[q] = holder[q] = q;
        for (int q = 0; q < nQubits; ++q) {
            int w = permutation[q];
            int from = where[q];
            if (from == w) continue;
            cliff.applyGate(OpType.SWAP, from, w);
            int displaced = holder[w];
            holder[w] = q;
            where[q] = w;
            holder[from] = displaced;
            where[displaced] = from;
        }
    }

    private static boolean mergeable(PauliNode a, PauliNode b) {
        if (a.type() == PauliNodeType.ROTATION && b.type() == PauliNodeType.ROTATION) {
            return Arrays.equals(((PauliRotation) a).string, ((PauliRotation) b).string);
        }
        if (a.type() == PauliNodeType.CONDITIONAL_BLOCK && b.type() == PauliNodeType.CONDITIONAL_BLOCK) {
            return ((ConditionalBlock) a).sameCondition((ConditionalBlock) b);
        }
        return false;
    }

    private static int[] sorted(TIntSet s) {
        int[] xs = s.toArray();
        Arrays.sort(xs);
        return xs;
    }

    /**
     * Inserts a node after everything in the graph.
     *
     * <p>The search runs backward from the end line. A vertex is examined once all of its
     * successors have been passed. The first examined vertex the node can merge with (a rotation
     * on the same string, or a block with the same condition) becomes the merge target; commuting
     * vertices are passed; any other vertex blocks the node and stops the search along that
     * branch.
     *
     * @return the index of the new vertex, or -1 if the node was merged into an existing one
     */
    public int applyNodeAtEnd(PauliNode node) {
        Deque<Integer> queue = new ArrayDeque<>();
        TIntSet queued = new TIntHashSet();
        for (int e : sorted(endLine)) {
            queue.add(e);
            queued.add(e);
        }
        TIntSet commuted = new TIntHashSet();
        TIntArrayList blockers = new TIntArrayList();
        int target = -1;
        while (!queue.isEmpty()) {
            int u = queue.poll();
            queued.remove(u);
            if (!commuted.containsAll(succs.get(u))) continue;
            PauliNode other = vertices.get(u);
            if (target < 0 && mergeable(node, other)) {
                target = u;
                commuted.add(u);
            } else if (PauliNode.nodesCommute(node, other)) {
                commuted.add(u);
                for (int p : sorted(preds.get(u))) {
                    if (queued.add(p)) queue.add(p);
                }
            } else {
                blockers.add(u);
            }
        }
        if (target >= 0) {
            mergeInto(target, node, blockers);
            return -1;
        }
        int v = vertices.size();
        vertices.add(node);
        succs.add(new TIntHashSet());
        preds.add(new TIntHashSet());
        for (int w : blockers.toArray()) addEdge(w, v);
        if (preds.get(v).isEmpty()) startLine.add(v);
        endLine.add(v);
        return v;
    }

    private void mergeInto(int target, PauliNode node, TIntArrayList blockers) {
        ++merges;
        // Whatever blocked the node must now precede the vertex that absorbs it.
        for (int w : blockers.toArray()) if (w != target) addEdge(w, target);
        PauliNode existing = vertices.get(target);
        if (existing.type() == PauliNodeType.CONDITIONAL_BLOCK) {
            ((ConditionalBlock) existing).append((ConditionalBlock) node);
            return;
        }
        PauliRotation old = (PauliRotation) existing;
        PauliRotation rot = (PauliRotation) node;
        double angle = old.angle() + (old.sign() == rot.sign() ? rot.angle() : -rot.angle());
        OptionalInt k = Angles.cliffordQuarterTurns(angle);
        if (k.isPresent()) {
            removeVertex(target);
            cliff.applyPauliAtFront(old.pauliString(), k.getAsInt());
        } else {
            old.setAngle(angle);
        }
    }

    private void addEdge(int from, int to) {
        succs.get(from).add(to);
        preds.get(to).add(from);
        endLine.remove(from);
        startLine.remove(to);
    }

    // Removes a vertex, linking its predecessors to its successors so no ordering is lost.
    private void removeVertex(int u) {
        int[] ps = preds.get(u).toArray();
        int[] ss = succs.get(u).toArray();
        for (int p : ps) succs.get(p).remove(u);
        for (int s : ss) preds.get(s).remove(u);
        for (int p : ps) for (int s : ss) addEdge(p, s);
        for (int p : ps) if (succs.get(p).isEmpty()) endLine.add(p);
        for (int s : ss) if (preds.get(s).isEmpty()) startLine.add(s);
        startLine.remove(u);
        endLine.remove(u);
        succs.get(u).clear();
        preds.get(u).clear();
        vertices.set(u, null);
    }

    /**
     * Splits the graph into commuting layers: each layer is a pairwise-commuting subset,
     * chosen greedily in index order, of the vertices whose predecessors all lie in earlier
     * layers.
     */
    public List<List<PauliNode>> sequence() {
        int[] indegree = new int[vertices.size()];
        TIntArrayList available = new TIntArrayList();
        for (int v = 0; v < vertices.size(); ++v) {
            if (vertices.get(v) == null) continue;
            indegree[v] = preds.get(v).size();
            if (indegree[v] == 0) available.add(v);
        }
        List<List<PauliNode>> layers = new ArrayList<>();
        while (!available.isEmpty()) {
            available.sort();
            List<PauliNode> layer = new ArrayList<>();
            TIntArrayList rest = new TIntArrayList();
            TIntArrayList taken = new TIntArrayList();
            for (int u : available.toArray()) {
                PauliNode n = vertices.get(u);
                boolean ok = true;
                for (PauliNode m : layer) {
                    if (!PauliNode.nodesCommute(n, m)) {
                        ok = false;
                        break;
                    }
                }
                if (ok) {
                    layer.add(n);
                    taken.add(u);
                } else {
                    rest.add(u);
                }
            }
            layers.add(layer);
            for (int u : taken.toArray()) {
                for (int s : succs.get(u).toArray()) {
                    if (--indegree[s] == 0) rest.add(s);
                }
            }
            available = rest;
        }
        return layers;
    }

    /** One {@link PauliPropagation} node per qubit, describing the trailing Clifford. */
    public List<PauliPropagation> tableauRows() {
        List<PauliPropagation> rows = new ArrayList<>();
        for (int q = 0; q < nQubits; ++q) {
            PauliString z = cliff.zRow(q), x = cliff.xRow(q);
            rows.add(new PauliPropagation(z.letters(), x.letters(), z.sign(), x.sign(), q));
        }
        return rows;
    }
}
