package net.littleredcomputer.greedypauli.circuit;

import com.google.common.collect.ImmutableList;
import net.littleredcomputer.greedypauli.pauli.Pauli;
import net.littleredcomputer.greedypauli.synth.SGBRandom;

import java.util.ArrayList;
import java.util.List;

/**
 * Seeded random circuits for exercising synthesis.
 */
public final class RandomCircuits {
    private static final List<OpType> FIXED_1Q = ImmutableList.of(
            OpType.Z, OpType.X, OpType.Y, OpType.S, OpType.Sdg, OpType.V, OpType.Vdg,
            OpType.SX, OpType.SXdg, OpType.H, OpType.T, OpType.Tdg);
    private static final List<OpType> ROTATION_1Q = ImmutableList.of(OpType.Rz, OpType.Rx, OpType.Ry);
    private static final List<OpType> FIXED_2Q = ImmutableList.of(
            OpType.CX, OpType.CY, OpType.CZ, OpType.SWAP, OpType.ZZMax);
    private static final List<OpType> ROTATION_2Q = ImmutableList.of(
            OpType.ZZPhase, OpType.XXPhase, OpType.YYPhase);
    private static final Pauli[] LETTERS = Pauli.values();

    private RandomCircuits() {}

    /** A random angle in half-turns: a multiple of 1/8 half of the time, otherwise generic. */
    private static double angle(SGBRandom r) {
        if (r.unifRand(2) == 0) return r.unifRand(16) / 8.0;
        return r.unifRand(1 << 20) / (double) (1 << 19);
    }

    private static int[] distinctQubits(SGBRandom r, int nQubits, int k) {
        List<Integer> all = new ArrayList<>();
        for (int q = 0; q < nQubits; ++q) all.add(q);
        int[] out = new int[k];
        for (int i = 0; i < k; ++i) out[i] = all.remove(r.unifRand(all.size()));
        return out;
    }

    private static List<Pauli> letters(SGBRandom r, int n) {
        List<Pauli> ps = new ArrayList<>();
        for (int i = 0; i < n; ++i) ps.add(LETTERS[r.unifRand(4)]);
        return ps;
    }

    private static void addGate(Circuit c, SGBRandom r) {
        int n = c.nQubits();
        int kind = r.unifRand(n >= 2 ? 6 : 2);
        switch (kind) {
            case 0:
                c.add(r.choose(FIXED_1Q), r.unifRand(n));
                break;
            case 1:
                if (r.unifRand(4) == 0) {
                    c.add(Op.gate(OpType.PhasedX, angle(r), angle(r)), r.unifRand(n));
                } else {
                    c.addRotation(r.choose(ROTATION_1Q), angle(r), r.unifRand(n));
                }
                break;
            case 2:
            case 3:
                c.add(r.choose(FIXED_2Q), distinctQubits(r, n, 2));
                break;
            case 4:
                c.addRotation(r.choose(ROTATION_2Q), angle(r), distinctQubits(r, n, 2));
                break;
            default: {
                int k = 2 + r.unifRand(n - 1);
                int[] qs = distinctQubits(r, n, k);
                switch (r.unifRand(3)) {
                    case 0:
                        c.addBox(new PauliExpBox(letters(r, k), angle(r)), qs);
                        break;
                    case 1:
                        c.addBox(Op.phaseGadget(k, angle(r)), qs);
                        break;
                    default:
                        c.addBox(new PauliExpPairBox(letters(r, k), angle(r), letters(r, k), angle(r)), qs);
                        break;
                }
            }
        }
    }

    /** A unitary circuit of {@code nGates} gates drawn from the supported gate set. */
    public static Circuit unitary(int nQubits, int nGates, int seed) {
        SGBRandom r = new SGBRandom(seed);
        Circuit c = new Circuit(nQubits);
        for (int i = 0; i < nGates; ++i) addGate(c, r);
        return c;
    }

    /**
     * A circuit that also measures, resets, sets and copies bits, and conditions gates on bits.
     * It has as many bits as qubits.
     */
    public static Circuit mixed(int nQubits, int nGates, int seed) {
        SGBRandom r = new SGBRandom(seed);
        Circuit c = new Circuit(nQubits, nQubits);
        for (int i = 0; i < nGates; ++i) {
            switch (r.unifRand(10)) {
                case 0:
                    c.addMeasure(r.unifRand(nQubits), r.unifRand(nQubits));
                    break;
                case 1:
                    c.addReset(r.unifRand(nQubits));
                    break;
                case 2: {
                    int b = r.unifRand(nQubits);
                    int q = r.unifRand(nQubits);
                    if (r.unifRand(2) == 0) {
                        c.addConditional(Op.gate(r.choose(ROTATION_1Q), angle(r)), new int[]{q}, new int[]{b}, r.unifRand(2));
                    } else {
                        c.addConditional(Op.gate(r.choose(FIXED_1Q)), new int[]{q}, new int[]{b}, r.unifRand(2));
                    }
                    break;
                }
                case 3:
                    if (nQubits >= 2 && r.unifRand(2) == 0) {
                        int[] bits = distinctQubits(r, nQubits, 2);
                        c.addClassical(new CopyBitsOp(1), bits);
                    } else {
                        c.addClassical(new SetBitsOp(r.unifRand(2) == 1), r.unifRand(nQubits));
                    }
                    break;
                default:
                    addGate(c, r);
            }
        }
        return c;
    }
}
