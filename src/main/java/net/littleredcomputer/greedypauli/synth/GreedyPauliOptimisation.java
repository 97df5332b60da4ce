package net.littleredcomputer.greedypauli.synth;

import com.google.common.base.Throwables;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import com.google.common.util.concurrent.Uninterruptibles;
import net.littleredcomputer.greedypauli.SynthesisTimeoutException;
import net.littleredcomputer.greedypauli.circuit.Circuit;
import net.littleredcomputer.greedypauli.graph.GPGraph;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Entry points for greedy Pauli graph synthesis of whole circuits.
 */
public final class GreedyPauliOptimisation {
    private static final Logger log = LogManager.getFormatterLogger(GreedyPauliOptimisation.class);

    private GreedyPauliOptimisation() {}

    /** One synthesis with the options' seed, on the calling thread and without a time limit. */
    public static Circuit synthesise(Circuit circuit, SynthesisOptions options) {
        Optional<Circuit> result = new GreedySynthesiser(options).synthesise(new GPGraph(circuit));
        return result.orElseThrow(() -> new IllegalStateException("synthesis stopped without a stop request"));
    }

    public static Circuit optimise(Circuit circuit) {
        return optimise(circuit, new SynthesisOptions());
    }

    /**
     * Runs {@code options.trials()} independently seeded syntheses in parallel and returns the
     * best result: fewest two-qubit gates, then fewest gates, then least depth, ties going to the
     * earlier trial. Trials still running when the thread timeout expires are asked to stop.
     * The input circuit is not modified.
     *
     * @throws SynthesisTimeoutException if no trial finished in time
     */
    public static Circuit optimise(Circuit circuit, SynthesisOptions options) {
        int trials = options.trials();
        int[] seeds = new int[trials];
        SGBRandom seeder = new SGBRandom(options.seed());
        seeds[0] = options.seed();
        for (int i = 1; i < trials; ++i) seeds[i] = seeder.nextRand();

        AtomicBoolean stop = new AtomicBoolean(false);
        ExecutorService pool = Executors.newFixedThreadPool(trials,
                new ThreadFactoryBuilder().setNameFormat("greedy-pauli-trial-%d").setDaemon(true).build());
        try {
            List<Future<Optional<Circuit>>> futures = new ArrayList<>();
            for (int i = 0; i < trials; ++i) {
                final int seed = seeds[i];
                futures.add(pool.submit(() -> new GreedySynthesiser(options, seed, stop::get).synthesise(new GPGraph(circuit))));
            }
            long deadline = System.nanoTime() + options.threadTimeout().toNanos();
            List<Optional<Circuit>> results = new ArrayList<>();
            for (Future<Optional<Circuit>> f : futures) results.add(await(f, deadline, stop));

            Circuit best = null;
            int bestTrial = -1;
            for (int i = 0; i < trials; ++i) {
                if (!results.get(i).isPresent()) continue;
                Circuit c = results.get(i).get();
                log.debug("trial %d (seed %d): %d two-qubit, %d gates, depth %d",
                        i, seeds[i], c.n2qGates(), c.nGates(), c.depth());
                if (best == null || better(c, best)) {
                    best = c;
                    bestTrial = i;
                }
            }
            if (best == null) throw new SynthesisTimeoutException(trials, options.threadTimeout());
            log.info("best of %d trials is trial %d: %d two-qubit gates, %d gates",
                    trials, bestTrial, best.n2qGates(), best.nGates());
            return best;
        } finally {
            pool.shutdownNow();
        }
    }

    private static Optional<Circuit> await(Future<Optional<Circuit>> f, long deadline, AtomicBoolean stop) {
        try {
            try {
                return Uninterruptibles.getUninterruptibly(f, Math.max(0, deadline - System.nanoTime()), TimeUnit.NANOSECONDS);
            } catch (TimeoutException e) {
                if (!stop.getAndSet(true)) log.info("thread timeout reached, stopping trials");
                return Uninterruptibles.getUninterruptibly(f);
            }
        } catch (ExecutionException e) {
            stop.set(true);
            Throwables.throwIfUnchecked(e.getCause());
            throw new IllegalStateException("synthesis trial failed", e.getCause());
        }
    }

    private static boolean better(Circuit a, Circuit b) {
        if (a.n2qGates() != b.n2qGates()) return a.n2qGates() < b.n2qGates();
        if (a.nGates() != b.nGates()) return a.nGates() < b.nGates();
        return a.depth() < b.depth();
    }
}
