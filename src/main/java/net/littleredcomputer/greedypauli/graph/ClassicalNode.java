package net.littleredcomputer.greedypauli.graph;

import com.google.common.collect.ImmutableList;
import net.littleredcomputer.greedypauli.circuit.Command;
import net.littleredcomputer.greedypauli.pauli.LocalClifford;
import net.littleredcomputer.greedypauli.pauli.Pauli;
import net.littleredcomputer.greedypauli.pauli.TQE;

import java.util.List;

/**
 * A classical command passed through synthesis untouched. Every bit it touches is treated as
 * written.
 */
public class ClassicalNode extends PauliNode {
    private final Command command;

    public ClassicalNode(Command command) {
        this.command = command;
    }

    public Command command() { return command; }

    @Override
    public PauliNodeType type() { return PauliNodeType.CLASSICAL; }

    @Override
    public int tqeCost() { return 0; }

    @Override
    public int tqeCostIncrease(TQE tqe) { return 0; }

    @Override
    public void update(TQE tqe) {}

    @Override
    public void update(LocalClifford g, int q) {}

    @Override
    public void swap(int a, int b) {}

    @Override
    public List<TQE> reductionTqes() { return ImmutableList.of(); }

    @Override
    public CommuteInfo commuteInfo() {
        return new CommuteInfo(ImmutableList.<Pauli[]>of(), new int[0], command.bits());
    }

    @Override
    public String toString() { return "Classical " + command; }
}
