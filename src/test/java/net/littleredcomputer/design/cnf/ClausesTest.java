// Copyright 2018 Colin Smith. MIT License.
package net.littleredcomputer.design.cnf;

import com.google.common.collect.ImmutableList;
import org.junit.Test;

import java.util.List;

import static org.hamcrest.Matchers.*;
import static org.junit.Assert.assertThat;

public class ClausesTest {

    private static boolean holds(List<List<Integer>> cnf, int n, int mask) {
        boolean[] p = new boolean[n];
        for (int i = 0; i < n; ++i) p[i] = (mask & (1 << i)) != 0;
        return new CnfFormula(n, cnf, 0).evaluate(p);
    }

    @Test
    public void shapes() {
        assertThat(Clauses.doubleImplies(1, 2), contains(contains(1, -2), contains(-1, 2)));
        assertThat(Clauses.xor(1, 2), contains(contains(1, 2), contains(-1, -2)));
        assertThat(Clauses.xnor(1, 2), contains(contains(1, -2), contains(-1, 2)));
        assertThat(Clauses.nand(1, 2), contains(contains(-1, -2)));
        assertThat(Clauses.distribute(3, Clauses.xor(1, 2)), contains(contains(3, 1, 2), contains(3, -1, -2)));
        assertThat(Clauses.iffAnd(4, ImmutableList.of(1, 2, 3)), contains(
                contains(-1, -2, -3, 4), contains(-4, 1), contains(-4, 2), contains(-4, 3)));
    }

    @Test
    public void truthTables() {
        for (int m = 0; m < 4; ++m) {
            boolean a = (m & 1) != 0, b = (m & 2) != 0;
            assertThat(holds(Clauses.doubleImplies(1, 2), 2, m), is(a == b));
            assertThat(holds(Clauses.xor(1, 2), 2, m), is(a != b));
            assertThat(holds(Clauses.xnor(1, 2), 2, m), is(a == b));
            assertThat(holds(Clauses.nand(1, 2), 2, m), is(!(a && b)));
        }
    }

    @Test
    public void iffAndTruthTable() {
        List<List<Integer>> cnf = Clauses.iffAnd(4, ImmutableList.of(1, 2, 3));
        for (int m = 0; m < 16; ++m) {
            boolean and = (m & 7) == 7;
            boolean a = (m & 8) != 0;
            assertThat("mask " + m, holds(cnf, 4, m), is(a == and));
        }
    }

    @Test
    public void iffAndOfNothingIsTrue() {
        assertThat(Clauses.iffAnd(1, ImmutableList.of()), contains(contains(1)));
    }
}
