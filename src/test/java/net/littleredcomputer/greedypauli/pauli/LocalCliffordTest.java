package net.littleredcomputer.greedypauli.pauli;

import com.google.common.base.VerifyException;
import org.junit.Test;

import java.util.List;

import static net.littleredcomputer.greedypauli.pauli.Pauli.*;
import static org.hamcrest.CoreMatchers.is;
import static org.junit.Assert.assertThat;

public class LocalCliffordTest {
    // The tableau of g-dagger pulls p back to g p g-dagger.
    @Test
    public void imagesMatchTableau() {
        for (LocalClifford g : LocalClifford.values()) {
            CliffordTableau t = new CliffordTableau(1);
            t.applyGate(g.dagger().opType(), 0);
            for (Pauli p : new Pauli[]{X, Y, Z}) {
                assertThat(g + " on " + p, t.rowProduct(PauliString.of(p)), is(PauliString.of(g.sign(p), g.image(p))));
            }
        }
    }

    @Test
    public void daggerInverts() {
        for (LocalClifford g : LocalClifford.values()) {
            for (Pauli p : new Pauli[]{X, Y, Z}) {
                LocalClifford d = g.dagger();
                assertThat(d.image(g.image(p)), is(p));
                assertThat(d.sign(g.image(p)) == g.sign(p), is(true));
            }
        }
    }

    @Test
    public void toZXReachesZX() {
        for (Pauli z : new Pauli[]{X, Y, Z}) {
            for (Pauli x : new Pauli[]{X, Y, Z}) {
                if (z == x) continue;
                Pauli zz = z, xx = x;
                for (LocalClifford g : LocalClifford.toZX(z, x)) {
                    zz = g.image(zz);
                    xx = g.image(xx);
                }
                assertThat(z + "/" + x, zz, is(Z));
                assertThat(z + "/" + x, xx, is(X));
            }
        }
    }

    @Test
    public void toZReachesZ() {
        for (Pauli p : new Pauli[]{X, Y, Z}) {
            List<LocalClifford> gs = LocalClifford.toZ(p);
            Pauli q = p;
            for (LocalClifford g : gs) q = g.image(q);
            assertThat(q, is(Z));
        }
    }

    @Test(expected = VerifyException.class)
    public void commutingLettersHaveNoZXBasis() {
        LocalClifford.toZX(X, X);
    }
}
