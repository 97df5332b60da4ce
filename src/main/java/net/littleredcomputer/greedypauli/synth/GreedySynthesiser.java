// Copyright 2018 Colin Smith. MIT License.
package net.littleredcomputer.greedypauli.synth;

import com.google.common.base.Stopwatch;
import com.google.common.base.Verify;
import net.littleredcomputer.greedypauli.circuit.CircBox;
import net.littleredcomputer.greedypauli.circuit.Circuit;
import net.littleredcomputer.greedypauli.circuit.Command;
import net.littleredcomputer.greedypauli.circuit.OpType;
import net.littleredcomputer.greedypauli.graph.*;
import net.littleredcomputer.greedypauli.pauli.LocalClifford;
import net.littleredcomputer.greedypauli.pauli.Pauli;
import net.littleredcomputer.greedypauli.pauli.TQE;
import net.littleredcomputer.greedypauli.pauli.TQETables;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.message.FormattedMessage;

import java.time.Duration;
import java.time.Instant;
import java.util.*;
import java.util.function.BooleanSupplier;
import java.util.function.ToDoubleFunction;

/**
 * Greedy synthesis of a {@link GPGraph} into a circuit.
 *
 * <p>Nodes are consumed layer by layer. Whenever the first layer holds a node that can be
 * emitted directly (single-qubit support, a classical op, or a conditional block) it is emitted,
 * with the local Cliffords it needs committed to every node still waiting. Otherwise a two-qubit
 * basis change (TQE) that reduces one of the cheapest first-layer nodes is chosen, scoring the
 * candidates on a discounted lookahead over the remaining layers and on the circuit depth they
 * would reach. Once the layers are exhausted the trailing Clifford, held as one anticommuting
 * pair per qubit, is reduced the same way and finished with local gates and SWAPs.
 *
 * <p>An instance is not thread safe; each trial uses its own.
 */
public class GreedySynthesiser {
    private static final Logger log = LogManager.getFormatterLogger(GreedySynthesiser.class);
    // Steps allowed in one layer, per unit of its starting cost, before candidates are narrowed.
    private static final int STALL_FACTOR = 4;

    private final SynthesisOptions options;
    private final SGBRandom random;
    private final BooleanSupplier stop;
    private final String name;
    private long stepCount;
    private long lastStepCount;
    private Instant lastLogTime = Instant.EPOCH;
    private final Stopwatch stopwatch = Stopwatch.createUnstarted();

    /**
     * @param stop polled at the top of each top-level step; once it returns true the synthesis
     *     gives up and returns empty
     */
    public GreedySynthesiser(SynthesisOptions options, int seed, BooleanSupplier stop) {
        this.options = options;
        this.random = new SGBRandom(seed);
        this.stop = stop;
        this.name = "seed " + seed;
    }

    public GreedySynthesiser(SynthesisOptions options) {
        this(options, options.seed(), () -> false);
    }

    public long stepCount() { return stepCount; }

    /**
     * Synthesises the graph. The graph's nodes are modified in the process.
     * @return the circuit, or empty if the stop flag was raised first
     */
    public Optional<Circuit> synthesise(GPGraph graph) {
        if (!stopwatch.isRunning()) stopwatch.start();
        lastLogTime = Instant.now();
        lastStepCount = stepCount;
        Run run = new Run(new Circuit(graph.nQubits(), graph.nBits()), graph.sequence(), graph.tableauRows(), true);
        if (!run.synthesise()) {
            log.info("%s: stopped after %d steps", name, stepCount);
            return Optional.empty();
        }
        run.circ.replaceTrailingSwaps();
        log.debug(() -> new FormattedMessage("%s: %d steps %s, %d gates, %d two-qubit",
                name, stepCount, stopwatch, run.circ.nGates(), run.circ.n2qGates()));
        return Optional.of(run.circ);
    }

    private void maybeReportProgress(Run run) {
        Instant now = Instant.now();
        Duration tween = Duration.between(lastLogTime, now);
        if (tween.compareTo(options.logInterval()) < 0) return;
        final double perSec = 1e3 * (stepCount - lastStepCount) / Math.max(1, tween.toMillis());
        log.info(() -> new FormattedMessage("%s %d steps %s %.0f/sec %d layers left, %d gates",
                name, stepCount, stopwatch, perSec, run.layers.size(), run.circ.nGates()));
        lastLogTime = now;
        lastStepCount = stepCount;
    }

    /** The state of one synthesis: the top level, or the body of a conditional block. */
    private final class Run {
        final Circuit circ;
        final DepthTracker depth;
        final List<List<PauliNode>> layers;
        final List<PauliPropagation> rows;
        // Only the top level polls the stop flag; a block body always runs to the end.
        final boolean topLevel;
        // Stall detection for the nodes currently being reduced.
        Object tracked = null;
        long layerSteps;
        long layerBudget;

        Run(Circuit circ, List<List<PauliNode>> layers, List<PauliPropagation> rows, boolean topLevel) {
            this.circ = circ;
            this.depth = new DepthTracker(circ.nQubits());
            this.layers = new ArrayList<>();
            for (List<PauliNode> layer : layers) this.layers.add(new ArrayList<>(layer));
            this.rows = rows;
            this.topLevel = topLevel;
        }

        private boolean stopped() {
            return topLevel && stop.getAsBoolean();
        }

        boolean synthesise() {
            return reduceLayers() && reduceRows();
        }

        boolean reduceLayers() {
            while (true) {
                if (stopped()) return false;
                consumeFirstLayer();
                if (layers.isEmpty()) return true;
                List<PauliNode> first = layers.get(0);
                List<PauliNode> cheapest = cheapest(first, withinBudget(first));
                TQE tqe = select(candidates(cheapest), this::lookaheadCost);
                commit(tqe);
            }
        }

        boolean reduceRows() {
            List<PauliPropagation> pending = new ArrayList<>();
            for (PauliPropagation r : rows) if (r.tqeCost() > 0) pending.add(r);
            while (!pending.isEmpty()) {
                if (stopped()) return false;
                List<PauliNode> cheapest = cheapest(pending, withinBudget(pending));
                TQE tqe = select(candidates(cheapest), t -> rowsCost(pending, t));
                commit(tqe);
                pending.removeIf(r -> r.tqeCost() == 0);
            }
            finishRows();
            return true;
        }

        // Returns true while the layer is within its step budget.
        private boolean withinBudget(List<? extends PauliNode> layer) {
            if (layer != tracked) {
                tracked = layer;
                layerSteps = 0;
                long cost = 0;
                for (PauliNode n : layer) cost += n.tqeCost();
                layerBudget = STALL_FACTOR * (cost + circ.nQubits());
            }
            return ++layerSteps <= layerBudget;
        }

        // The cheapest nodes; only the first of them once the layer has overrun its budget, so
        // that every step strictly lowers the minimum cost.
        private List<PauliNode> cheapest(List<? extends PauliNode> nodes, boolean withinBudget) {
            int min = Integer.MAX_VALUE;
            for (PauliNode n : nodes) min = Math.min(min, n.tqeCost());
            List<PauliNode> out = new ArrayList<>();
            for (PauliNode n : nodes) {
                if (n.tqeCost() != min) continue;
                out.add(n);
                if (!withinBudget) break;
            }
            return out;
        }

        private List<TQE> candidates(List<PauliNode> nodes) {
            Set<TQE> tqes = new TreeSet<>();
            for (PauliNode n : nodes) tqes.addAll(n.reductionTqes());
            Verify.verify(!tqes.isEmpty(), "no reducing TQE for %s", nodes);
            List<TQE> out = new ArrayList<>(tqes);
            if (out.size() > options.maxTqeCandidates()) out = random.sample(out, options.maxTqeCandidates());
            return out;
        }

        private TQE select(List<TQE> candidates, ToDoubleFunction<TQE> cost) {
            if (candidates.size() == 1) return candidates.get(0);
            double[][] costs = new double[candidates.size()][];
            for (int i = 0; i < costs.length; ++i) {
                TQE t = candidates.get(i);
                costs[i] = new double[]{cost.applyAsDouble(t), depth.gateDepth(t.a(), t.b())};
            }
            return candidates.get(MinMaxSelection.select(costs, new double[]{1.0, options.depthWeight()}, random));
        }

        double lookaheadCost(TQE tqe) {
            double discount = 1.0 / (1.0 + options.discountRate());
            double weight = 1.0;
            double cost = 0;
            int count = 0;
            for (List<PauliNode> layer : layers) {
                for (PauliNode n : layer) {
                    cost += weight * n.tqeCostIncrease(tqe);
                    if (++count >= options.maxLookahead()) return cost;
                }
                weight *= discount;
            }
            for (PauliPropagation r : rows) {
                cost += weight * r.tqeCostIncrease(tqe);
                if (++count >= options.maxLookahead()) break;
            }
            return cost;
        }

        double rowsCost(List<PauliPropagation> pending, TQE tqe) {
            double cost = 0;
            int count = 0;
            for (PauliPropagation r : pending) {
                cost += r.tqeCostIncrease(tqe);
                if (++count >= options.maxLookahead()) break;
            }
            return cost;
        }

        private void commit(TQE tqe) {
            for (List<PauliNode> layer : layers) for (PauliNode n : layer) n.update(tqe);
            for (PauliPropagation r : rows) r.update(tqe);
            for (Command c : TQETables.fragment(tqe)) circ.add(c);
            depth.add2q(tqe.a(), tqe.b());
            ++stepCount;
            maybeReportProgress(this);
        }

        // Emits a local Clifford and commits it to every waiting node, and to the node being
        // emitted (already out of its layer) if there is one.
        private void commit(LocalClifford g, int q, PauliNode emitting) {
            for (List<PauliNode> layer : layers) for (PauliNode n : layer) n.update(g, q);
            for (PauliPropagation r : rows) r.update(g, q);
            if (emitting != null) emitting.update(g, q);
            circ.add(g.opType(), q);
            depth.add1q(q);
        }

        private boolean emittable(PauliNode n) {
            switch (n.type()) {
                case CLASSICAL:
                case CONDITIONAL_BLOCK:
                    return true;
                case ROTATION:
                    return n.tqeCost() == 0 || (options.allowZZPhase() && n.tqeCost() == 1);
                default:
                    return n.tqeCost() == 0;
            }
        }

        void consumeFirstLayer() {
            while (!layers.isEmpty()) {
                List<PauliNode> first = layers.get(0);
                List<PauliNode> ready = new ArrayList<>();
                for (PauliNode n : first) if (emittable(n)) ready.add(n);
                for (PauliNode n : ready) {
                    first.remove(n);
                    emit(n);
                }
                if (!first.isEmpty()) return;
                layers.remove(0);
            }
        }

        private void emit(PauliNode node) {
            switch (node.type()) {
                case ROTATION:
                    emitRotation((PauliRotation) node);
                    break;
                case MID_MEASURE:
                    emitMeasure((MidMeasure) node);
                    break;
                case RESET:
                    emitReset((Reset) node);
                    break;
                case CLASSICAL:
                    circ.add(((ClassicalNode) node).command());
                    break;
                case CONDITIONAL_BLOCK:
                    emitBlock((ConditionalBlock) node);
                    break;
                default:
                    throw new IllegalStateException("cannot emit " + node.type() + " from a layer");
            }
        }

        private void emitRotation(PauliRotation r) {
            if (r.tqeCost() == 0) {
                int q = r.firstSupport();
                circ.addRotation(rotationType(r.string()[q]), r.signedAngle(), q);
                depth.add1q(q);
                return;
            }
            int[] support = r.support();
            int a = support[0], b = support[1];
            for (LocalClifford g : LocalClifford.toZ(r.string()[a])) commit(g, a, r);
            for (LocalClifford g : LocalClifford.toZ(r.string()[b])) commit(g, b, r);
            circ.addRotation(OpType.ZZPhase, r.signedAngle(), a, b);
            depth.add2q(a, b);
        }

        private OpType rotationType(Pauli p) {
            switch (p) {
                case X: return OpType.Rx;
                case Y: return OpType.Ry;
                case Z: return OpType.Rz;
                default: throw new IllegalStateException("rotation about the identity");
            }
        }

        private void emitMeasure(MidMeasure m) {
            int q = m.firstSupport();
            for (LocalClifford g : LocalClifford.toZ(m.string()[q])) commit(g, q, m);
            if (!m.sign()) commit(LocalClifford.X, q, m);
            circ.addMeasure(q, m.bit());
            depth.add1q(q);
        }

        private void emitReset(Reset r) {
            int q = r.firstSupport();
            for (LocalClifford g : LocalClifford.toZX(r.zString()[q], r.xString()[q])) commit(g, q, r);
            if (!r.zSign()) commit(LocalClifford.X, q, r);
            if (!r.xSign()) commit(LocalClifford.Z, q, r);
            circ.addReset(q);
            depth.add1q(q);
        }

        private void emitBlock(ConditionalBlock block) {
            int n = circ.nQubits();
            List<List<PauliNode>> blockLayers = new ArrayList<>();
            List<PauliNode> current = new ArrayList<>();
            for (PauliRotation r : block.rotations()) {
                PauliRotation copy = new PauliRotation(r.string(), r.sign(), r.angle());
                boolean commutes = true;
                for (PauliNode m : current) {
                    if (!PauliNode.nodesCommute(copy, m)) {
                        commutes = false;
                        break;
                    }
                }
                if (!commutes) {
                    blockLayers.add(current);
                    current = new ArrayList<>();
                }
                current.add(copy);
            }
            blockLayers.add(current);
            Run inner = new Run(new Circuit(n), blockLayers, new GPGraph(n, 0).tableauRows(), false);
            boolean done = inner.synthesise();
            Verify.verify(done, "block body stopped");
            int[] qubits = new int[n];
            for (int q = 0; q < n; ++q) qubits[q] = q;
            circ.addConditional(new CircBox(inner.circ), qubits, block.condBits(), block.condValue());
            depth.addOp(qubits);
        }

        // Each row has weight one; turn it into +Z_q/+X_q and move it home with SWAPs.
        private void finishRows() {
            for (PauliPropagation r : rows) {
                int q = r.firstSupport();
                for (LocalClifford g : LocalClifford.toZX(r.zString()[q], r.xString()[q])) commit(g, q, null);
                if (!r.zSign()) commit(LocalClifford.X, q, null);
                if (!r.xSign()) commit(LocalClifford.Z, q, null);
            }
            for (PauliPropagation r : rows) {
                int i = r.qubit();
                int q = r.firstSupport();
                if (q == i) continue;
                circ.add(OpType.SWAP, q, i);
                depth.add2q(q, i);
                for (PauliPropagation s : rows) s.swap(q, i);
            }
        }
    }
}
