package net.littleredcomputer.greedypauli.graph;

import com.google.common.base.Preconditions;
import net.littleredcomputer.greedypauli.GreedyPauliSimpException;
import net.littleredcomputer.greedypauli.pauli.LocalClifford;
import net.littleredcomputer.greedypauli.pauli.Pauli;
import net.littleredcomputer.greedypauli.pauli.TQE;

import java.util.*;

/**
 * A sequence of rotations applied only when the condition bits hold a given value.
 */
public class ConditionalBlock extends PauliNode {
    private final List<PauliRotation> rotations;
    private final int[] condBits;
    private final int condValue;

    public ConditionalBlock(List<PauliRotation> rotations, int[] condBits, int condValue) {
        if (rotations.isEmpty()) throw new GreedyPauliSimpException("conditional block cannot be empty");
        if (condBits.length == 0) throw new GreedyPauliSimpException("conditional block needs condition bits");
        int n = rotations.get(0).string.length;
        for (PauliRotation r : rotations) {
            if (r.string.length != n) throw new GreedyPauliSimpException("rotations in a block must share a width");
        }
        this.rotations = new ArrayList<>(rotations);
        this.condBits = condBits.clone();
        this.condValue = condValue;
    }

    public List<PauliRotation> rotations() { return Collections.unmodifiableList(rotations); }
    public int[] condBits() { return condBits.clone(); }
    public int condValue() { return condValue; }

    public boolean sameCondition(ConditionalBlock other) {
        return condValue == other.condValue && Arrays.equals(condBits, other.condBits);
    }

    /** Appends the rotations of a block with the same condition, to be applied after this block's. */
    public void append(ConditionalBlock other) {
        Preconditions.checkArgument(sameCondition(other), "cannot merge blocks with different conditions");
        rotations.addAll(other.rotations);
    }

    @Override
    public PauliNodeType type() { return PauliNodeType.CONDITIONAL_BLOCK; }

    @Override
    public int tqeCost() {
        int w = 0;
        for (PauliRotation r : rotations) w += r.weight();
        return w - 1;
    }

    @Override
    public int tqeCostIncrease(TQE tqe) {
        int d = 0;
        for (PauliRotation r : rotations) d += r.tqeCostIncrease(tqe);
        return d;
    }

    @Override
    public void update(TQE tqe) {
        for (PauliRotation r : rotations) r.update(tqe);
    }

    @Override
    public void update(LocalClifford g, int q) {
        for (PauliRotation r : rotations) r.update(g, q);
    }

    @Override
    public void swap(int a, int b) {
        for (PauliRotation r : rotations) r.swap(a, b);
    }

    @Override
    public List<TQE> reductionTqes() {
        Set<TQE> tqes = new TreeSet<>();
        for (PauliRotation r : rotations) tqes.addAll(r.reductionTqes());
        return new ArrayList<>(tqes);
    }

    @Override
    public CommuteInfo commuteInfo() {
        List<Pauli[]> strings = new ArrayList<>();
        for (PauliRotation r : rotations) strings.add(r.string);
        return new CommuteInfo(strings, condBits, new int[0]);
    }

    @Override
    public String toString() {
        return "if " + Arrays.toString(condBits) + "==" + condValue + " " + rotations;
    }
}
