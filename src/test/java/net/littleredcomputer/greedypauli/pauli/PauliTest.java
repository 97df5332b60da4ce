package net.littleredcomputer.greedypauli.pauli;

import org.junit.Test;

import static net.littleredcomputer.greedypauli.pauli.Pauli.*;
import static org.hamcrest.CoreMatchers.is;
import static org.junit.Assert.assertThat;

public class PauliTest {
    @Test
    public void products() {
        assertThat(X.times(Y), is(Z));
        assertThat(X.productPhase(Y), is(1));
        assertThat(Y.productPhase(X), is(3));
        assertThat(Y.productPhase(Z), is(1));
        assertThat(Z.productPhase(X), is(1));
        assertThat(X.productPhase(Z), is(3));
        assertThat(Z.times(Z), is(I));
        assertThat(Z.productPhase(Z), is(0));
        assertThat(I.times(Y), is(Y));
    }

    @Test
    public void commutation() {
        for (Pauli p : values()) {
            for (Pauli q : values()) {
                boolean expected = p == I || q == I || p == q;
                assertThat(p + "" + q, p.commutesWith(q), is(expected));
                assertThat(p.commutesWith(q), is(q.commutesWith(p)));
            }
        }
    }

    @Test
    public void symplecticBits() {
        for (Pauli p : values()) assertThat(Pauli.of(p.x(), p.z()), is(p));
    }

    @Test(expected = IllegalArgumentException.class)
    public void badLetter() {
        Pauli.parse('Q');
    }
}
