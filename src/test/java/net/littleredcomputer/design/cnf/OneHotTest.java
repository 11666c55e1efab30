// Copyright 2018 Colin Smith. MIT License.
package net.littleredcomputer.design.cnf;

import com.google.common.collect.ImmutableList;
import org.junit.Test;

import java.util.ArrayList;
import java.util.List;

import static org.hamcrest.Matchers.*;
import static org.junit.Assert.assertThat;

public class OneHotTest {

    @Test
    public void emptyIsUnsatisfiable() {
        EncodingState s = EncodingState.empty();
        OneHot.enforce(ImmutableList.of(), s);
        assertThat(s.lastVar(), is(0));
        assertThat(s.clauses(), contains(empty()));
        assertThat(s.toString(), is("(0,[[]])"));
    }

    @Test
    public void two() {
        EncodingState s = EncodingState.startingAt(2);
        OneHot.enforce(ImmutableList.of(1, 2), s);
        assertThat(s.lastVar(), is(2));
        assertThat(s.clauses(), contains(contains(-1, -2), contains(1, 2)));
    }

    @Test
    public void three() {
        EncodingState s = EncodingState.startingAt(3);
        OneHot.enforce(ImmutableList.of(1, 2, 3), s);
        assertThat(s.clauses(), contains(
                contains(-1, -2), contains(-1, -3), contains(-2, -3), contains(1, 2, 3)));
    }

    @Test
    public void four() {
        EncodingState s = EncodingState.startingAt(6);
        OneHot.enforce(ImmutableList.of(1, 2, 3, 4), s);
        assertThat(s.lastVar(), is(6));
        assertThat(s.clauses(), contains(
                contains(-1, -2), contains(-1, -3), contains(-1, -4),
                contains(-2, -3), contains(-2, -4), contains(-3, -4),
                contains(1, 2, 3, 4)));
    }

    @Test
    public void clauseCount() {
        for (int n = 0; n <= 12; ++n) {
            List<Integer> vars = new ArrayList<>();
            for (int i = 1; i <= n; ++i) vars.add(i);
            assertThat(OneHot.clauses(vars), hasSize(n * (n - 1) / 2 + 1));
        }
    }

    @Test
    public void exactlyOneIsSatisfying() {
        final int n = 5;
        List<Integer> vars = ImmutableList.of(1, 2, 3, 4, 5);
        CnfFormula f = new CnfFormula(n, OneHot.clauses(vars), n);
        for (int m = 0; m < 1 << n; ++m) {
            boolean[] p = new boolean[n];
            for (int i = 0; i < n; ++i) p[i] = (m & (1 << i)) != 0;
            assertThat("mask " + m, f.evaluate(p), is(Integer.bitCount(m) == 1));
        }
    }
}
