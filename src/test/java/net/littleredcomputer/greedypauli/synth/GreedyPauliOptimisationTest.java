package net.littleredcomputer.greedypauli.synth;

import net.littleredcomputer.greedypauli.BadOpTypeException;
import net.littleredcomputer.greedypauli.CircuitSimulator;
import net.littleredcomputer.greedypauli.SynthesisTimeoutException;
import net.littleredcomputer.greedypauli.circuit.Circuit;
import net.littleredcomputer.greedypauli.circuit.Op;
import net.littleredcomputer.greedypauli.circuit.OpType;
import net.littleredcomputer.greedypauli.circuit.RandomCircuits;
import org.junit.Test;

import java.time.Duration;

import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.Matchers.lessThanOrEqualTo;
import static org.junit.Assert.assertThat;

public class GreedyPauliOptimisationTest {
    @Test
    public void singleTrialMatchesDirectSynthesis() {
        Circuit in = RandomCircuits.unitary(4, 50, 31);
        SynthesisOptions o = new SynthesisOptions().setSeed(9);
        assertThat(GreedyPauliOptimisation.optimise(in, o), is(GreedyPauliOptimisation.synthesise(in, o)));
    }

    @Test
    public void trialsAreDeterministicAndNoWorse() {
        Circuit in = RandomCircuits.unitary(5, 80, 32);
        SynthesisOptions o = new SynthesisOptions().setSeed(3).setTrials(4);
        Circuit a = GreedyPauliOptimisation.optimise(in, o);
        Circuit b = GreedyPauliOptimisation.optimise(in, o);
        assertThat(a, is(b));
        assertThat(a.n2qGates(), lessThanOrEqualTo(GreedyPauliOptimisation.synthesise(in, o).n2qGates()));
        assertThat(CircuitSimulator.equalUpToPhase(in, a, 1e-8), is(true));
    }

    @Test
    public void inputIsNotModified() {
        Circuit in = RandomCircuits.unitary(3, 20, 33);
        Circuit copy = new Circuit(in);
        GreedyPauliOptimisation.optimise(in, new SynthesisOptions().setTrials(2));
        assertThat(in, is(copy));
    }

    @Test(expected = SynthesisTimeoutException.class)
    public void timeoutBeforeAnyTrialFinishes() {
        Circuit in = RandomCircuits.unitary(20, 3000, 34);
        GreedyPauliOptimisation.optimise(in, new SynthesisOptions().setTrials(2).setThreadTimeout(Duration.ofNanos(1)));
    }

    @Test(expected = BadOpTypeException.class)
    public void workerErrorsPropagateUnwrapped() {
        Circuit in = new Circuit(2);
        in.add(OpType.H, 0);
        in.add(Op.barrier(2), 0, 1);
        GreedyPauliOptimisation.optimise(in, new SynthesisOptions().setTrials(3));
    }
}
