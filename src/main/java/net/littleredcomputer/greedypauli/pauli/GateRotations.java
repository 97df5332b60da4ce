package net.littleredcomputer.greedypauli.pauli;

import com.google.common.collect.ImmutableList;
import net.littleredcomputer.greedypauli.BadOpTypeException;
import net.littleredcomputer.greedypauli.circuit.*;

import java.util.Collections;
import java.util.List;

import static net.littleredcomputer.greedypauli.pauli.Pauli.*;

/**
 * Decomposition of unitary gates into sequences of Pauli rotations, equal to the gate up to
 * global phase. Rotations are listed in the order they are applied.
 */
public final class GateRotations {
    private GateRotations() {}

    public static List<PauliExp> of(Op op) {
        switch (op.type()) {
            case Z: return ImmutableList.of(PauliExp.of(1, Z));
            case X: return ImmutableList.of(PauliExp.of(1, X));
            case Y: return ImmutableList.of(PauliExp.of(1, Y));
            case S: return ImmutableList.of(PauliExp.of(0.5, Z));
            case Sdg: return ImmutableList.of(PauliExp.of(1.5, Z));
            case V:
            case SX:
                return ImmutableList.of(PauliExp.of(0.5, X));
            case Vdg:
            case SXdg:
                return ImmutableList.of(PauliExp.of(1.5, X));
            case H: return ImmutableList.of(PauliExp.of(0.5, Y), PauliExp.of(1, X));
            case T: return ImmutableList.of(PauliExp.of(0.25, Z));
            case Tdg: return ImmutableList.of(PauliExp.of(-0.25, Z));
            case Rz: return ImmutableList.of(PauliExp.of(op.param(0), Z));
            case Rx: return ImmutableList.of(PauliExp.of(op.param(0), X));
            case Ry: return ImmutableList.of(PauliExp.of(op.param(0), Y));
            case PhasedX: {
                double alpha = op.param(0), beta = op.param(1);
                return ImmutableList.of(PauliExp.of(-beta, Z), PauliExp.of(alpha, X), PauliExp.of(beta, Z));
            }
            case CX: return controlled(X);
            case CY: return controlled(Y);
            case CZ: return controlled(Z);
            case SWAP: return ImmutableList.of(PauliExp.of(0.5, Z, Z), PauliExp.of(0.5, X, X), PauliExp.of(0.5, Y, Y));
            case ZZMax: return ImmutableList.of(PauliExp.of(0.5, Z, Z));
            case ZZPhase: return ImmutableList.of(PauliExp.of(op.param(0), Z, Z));
            case XXPhase: return ImmutableList.of(PauliExp.of(op.param(0), X, X));
            case YYPhase: return ImmutableList.of(PauliExp.of(op.param(0), Y, Y));
            case PhaseGadget:
                return ImmutableList.of(new PauliExp(Collections.nCopies(op.nQubits(), Z), op.param(0)));
            case PauliExpBox: {
                PauliExpBox box = (PauliExpBox) op;
                return ImmutableList.of(new PauliExp(box.paulis(), box.angle()));
            }
            case PauliExpPairBox: {
                PauliExpPairBox box = (PauliExpPairBox) op;
                return ImmutableList.of(new PauliExp(box.paulis0(), box.angle0()), new PauliExp(box.paulis1(), box.angle1()));
            }
            case PauliExpCommutingSetBox: {
                PauliExpCommutingSetBox box = (PauliExpCommutingSetBox) op;
                ImmutableList.Builder<PauliExp> b = ImmutableList.builder();
                for (int i = 0; i < box.strings().size(); ++i) b.add(new PauliExp(box.strings().get(i), box.angle(i)));
                return b.build();
            }
            case Noop:
            case Phase:
                return ImmutableList.of();
            default:
                throw new BadOpTypeException(op.type(), "as a sequence of Pauli rotations");
        }
    }

    private static List<PauliExp> controlled(Pauli target) {
        return ImmutableList.of(PauliExp.of(1.5, Z, I), PauliExp.of(1.5, I, target), PauliExp.of(0.5, Z, target));
    }
}
