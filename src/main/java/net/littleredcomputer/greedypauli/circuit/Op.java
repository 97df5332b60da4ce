package net.littleredcomputer.greedypauli.circuit;

import com.google.common.base.Joiner;
import com.google.common.base.Preconditions;
import com.google.common.primitives.Doubles;

import java.util.Arrays;

/**
 * An immutable operation. Plain gates are instances of this class; boxes and classical
 * operations are subclasses carrying their extra payload. Angles are in half-turns.
 */
public class Op {
    private final OpType type;
    private final double[] params;

    protected Op(OpType type, double... params) {
        this.type = Preconditions.checkNotNull(type);
        this.params = params.clone();
    }

    public static Op gate(OpType type, double... params) {
        Preconditions.checkArgument(type.nQubits() >= 0 && type != OpType.Classical,
                "%s is not a plain gate", type);
        Preconditions.checkArgument(params.length == type.nParams(),
                "%s takes %s parameters, got %s", type, type.nParams(), params.length);
        return new Op(type, params);
    }

    public static Op barrier(int nQubits) {
        Preconditions.checkArgument(nQubits > 0, "barrier needs qubits");
        return new Op(OpType.Barrier) {
            @Override
            public int nQubits() { return nQubits; }
        };
    }

    public static Op phaseGadget(int nQubits, double angle) {
        Preconditions.checkArgument(nQubits > 0, "phase gadget needs qubits");
        return new Op(OpType.PhaseGadget, angle) {
            @Override
            public int nQubits() { return nQubits; }
        };
    }

    public OpType type() { return type; }
    public double param(int i) { return params[i]; }
    public double[] params() { return params.clone(); }

    public int nQubits() { return type.nQubits(); }

    public int nBits() { return type == OpType.Measure ? 1 : 0; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Op that = (Op) o;
        return type == that.type && Arrays.equals(params, that.params);
    }

    @Override
    public int hashCode() {
        return 31 * type.hashCode() + Arrays.hashCode(params);
    }

    @Override
    public String toString() {
        if (params.length == 0) return type.name();
        return type.name() + "(" + Joiner.on(",").join(Doubles.asList(params)) + ")";
    }
}
