package net.littleredcomputer.greedypauli.graph;

import net.littleredcomputer.greedypauli.pauli.Pauli;

/**
 * exp(-i * angle * pi/2 * (&plusmn;P)), angle in half-turns.
 */
public class PauliRotation extends SingleNode {
    private double angle;

    public PauliRotation(Pauli[] string, boolean sign, double angle) {
        super(string, sign);
        this.angle = angle;
    }

    public double angle() { return angle; }

    void setAngle(double angle) { this.angle = angle; }

    /** The angle of this rotation expressed with a positive sign. */
    public double signedAngle() { return sign ? angle : -angle; }

    @Override
    public PauliNodeType type() { return PauliNodeType.ROTATION; }

    @Override
    public CommuteInfo commuteInfo() { return CommuteInfo.ofStrings(string); }

    @Override
    public String toString() { return pauliString() + "^" + angle; }
}
