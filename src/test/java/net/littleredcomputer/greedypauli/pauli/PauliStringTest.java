package net.littleredcomputer.greedypauli.pauli;

import net.littleredcomputer.greedypauli.synth.SGBRandom;
import org.junit.Test;

import java.util.ArrayList;
import java.util.List;

import static org.hamcrest.CoreMatchers.is;
import static org.junit.Assert.assertThat;

public class PauliStringTest {
    private static List<PauliString> allStrings(int n) {
        List<PauliString> out = new ArrayList<>();
        Pauli[] ps = Pauli.values();
        for (int code = 0; code < 1 << (2 * n); ++code) {
            Pauli[] letters = new Pauli[n];
            for (int i = 0; i < n; ++i) letters[i] = ps[(code >> (2 * i)) & 3];
            out.add(PauliString.of(letters));
        }
        return out;
    }

    @Test
    public void parseAndPrint() {
        assertThat(PauliString.parse("XYZ").toString(), is("+XYZ"));
        assertThat(PauliString.parse("-iZI").toString(), is("-iZI"));
        assertThat(PauliString.parse("-XX").sign(), is(false));
        assertThat(PauliString.parse("+IZIX").weight(), is(2));
        assertThat(PauliString.parse("III").isIdentity(), is(true));
    }

    @Test
    public void multiplication() {
        assertThat(PauliString.parse("XZ").multiply(PauliString.parse("ZX")), is(PauliString.parse("YY")));
        assertThat(PauliString.parse("XI").multiply(PauliString.parse("YI")), is(PauliString.parse("iZI")));
        assertThat(PauliString.parse("YI").multiply(PauliString.parse("XI")), is(PauliString.parse("-iZI")));
        assertThat(PauliString.parse("-XY").multiply(PauliString.parse("-XY")), is(PauliString.parse("II")));
    }

    // Two strings commute exactly when their product is the same in either order.
    @Test
    public void commutationIsSymmetricAndMatchesProducts() {
        for (int n = 1; n <= 3; ++n) {
            List<PauliString> all = allStrings(n);
            for (PauliString a : all) {
                for (PauliString b : all) {
                    boolean c = a.commutes(b);
                    assertThat(c, is(b.commutes(a)));
                    assertThat(a + " " + b, c, is(a.multiply(b).equals(b.multiply(a))));
                }
            }
        }
    }

    @Test
    public void commutationSampledOnFourQubits() {
        List<PauliString> all = allStrings(4);
        SGBRandom r = new SGBRandom(4);
        for (int i = 0; i < 2000; ++i) {
            PauliString a = r.choose(all), b = r.choose(all);
            assertThat(a.commutes(b), is(b.commutes(a)));
            assertThat(a.commutes(b), is(a.multiply(b).equals(b.multiply(a))));
        }
    }

    @Test
    public void onQubits() {
        PauliString p = PauliString.onQubits(4, new Pauli[]{Pauli.X, Pauli.Z}, new int[]{3, 1});
        assertThat(p, is(PauliString.parse("IZIX")));
    }

    @Test(expected = IllegalStateException.class)
    public void imaginaryStringHasNoSign() {
        PauliString.parse("iX").sign();
    }

    @Test(expected = IllegalArgumentException.class)
    public void lengthMismatch() {
        PauliString.parse("X").commutes(PauliString.parse("XX"));
    }
}
