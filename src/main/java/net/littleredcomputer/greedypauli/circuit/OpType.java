package net.littleredcomputer.greedypauli.circuit;

/**
 * Operation types understood by the circuit container. Arity -1 means the qubit count is
 * determined by the op instance.
 */
public enum OpType {
    Z(1, 0, true),
    X(1, 0, true),
    Y(1, 0, true),
    S(1, 0, true),
    Sdg(1, 0, true),
    V(1, 0, true),
    Vdg(1, 0, true),
    SX(1, 0, true),
    SXdg(1, 0, true),
    H(1, 0, true),
    T(1, 0, false),
    Tdg(1, 0, false),
    Rz(1, 1, false),
    Rx(1, 1, false),
    Ry(1, 1, false),
    PhasedX(1, 2, false),
    CX(2, 0, true),
    CY(2, 0, true),
    CZ(2, 0, true),
    SWAP(2, 0, true),
    ZZMax(2, 0, true),
    ZZPhase(2, 1, false),
    XXPhase(2, 1, false),
    YYPhase(2, 1, false),
    PhaseGadget(-1, 1, false),
    PauliExpBox(-1, 0, false),
    PauliExpPairBox(-1, 0, false),
    PauliExpCommutingSetBox(-1, 0, false),
    Measure(1, 0, false),
    Reset(1, 0, false),
    Classical(0, 0, false),
    Conditional(-1, 0, false),
    CircBox(-1, 0, false),
    Barrier(-1, 0, false),
    Noop(1, 0, false),
    Phase(0, 1, false);

    private final int nQubits;
    private final int nParams;
    private final boolean clifford;

    OpType(int nQubits, int nParams, boolean clifford) {
        this.nQubits = nQubits;
        this.nParams = nParams;
        this.clifford = clifford;
    }

    public int nQubits() { return nQubits; }
    public int nParams() { return nParams; }

    /** True for gates that are Clifford whatever their parameters. */
    public boolean isClifford() { return clifford; }
}
