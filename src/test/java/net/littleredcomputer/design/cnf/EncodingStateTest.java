// Copyright 2018 Colin Smith. MIT License.
package net.littleredcomputer.design.cnf;

import com.google.common.collect.ImmutableList;
import org.junit.Test;

import java.util.List;

import static org.hamcrest.Matchers.*;
import static org.junit.Assert.assertThat;

public class EncodingStateTest {

    @Test
    public void freshVarFromEmpty() {
        EncodingState s = EncodingState.empty();
        assertThat(s.freshVar(), is(1));
        assertThat(s.lastVar(), is(1));
    }

    @Test
    public void freshVarsAreConsecutive() {
        EncodingState s = EncodingState.empty();
        assertThat(s.freshVars(3), contains(1, 2, 3));
        assertThat(s.freshVars(3), contains(4, 5, 6));
        assertThat(s.freshVars(0), is(empty()));
        assertThat(s.lastVar(), is(6));
    }

    @Test
    public void startingAtContinuesAfterGivenVariable() {
        EncodingState s = EncodingState.startingAt(4);
        assertThat(s.freshVar(), is(5));
        s.setFresh(10);
        assertThat(s.freshVar(), is(11));
    }

    @Test
    public void appendIsLastInFirstOut() {
        EncodingState s = EncodingState.empty();
        s.appendClauses(ImmutableList.<List<Integer>>of(ImmutableList.of(1, 2, -3)));
        s.appendClauses(ImmutableList.<List<Integer>>of(ImmutableList.of(-4, 5), ImmutableList.of(4)));
        assertThat(s.clauses(), contains(
                contains(-4, 5),
                contains(4),
                contains(1, 2, -3)));
        assertThat(s.nClauses(), is(3));
        assertThat(s.lastVar(), is(0));
    }

    @Test
    public void callOrderKeepsBatchesIntact() {
        EncodingState s = EncodingState.empty();
        s.appendClauses(ImmutableList.<List<Integer>>of(ImmutableList.of(1, 2, -3)));
        s.appendClauses(ImmutableList.<List<Integer>>of(ImmutableList.of(-4, 5), ImmutableList.of(4)));
        assertThat(s.clausesInCallOrder(), contains(
                contains(1, 2, -3),
                contains(-4, 5),
                contains(4)));
    }

    @Test
    public void unitClauses() {
        EncodingState s = EncodingState.empty();
        s.forceFalse(ImmutableList.of(1, 2, 3));
        assertThat(s.clauses(), contains(contains(-1), contains(-2), contains(-3)));

        EncodingState t = EncodingState.empty();
        t.forceTrue(1);
        assertThat(t.clauses(), contains(contains(1)));

        EncodingState u = EncodingState.empty();
        u.forceFalse(1);
        assertThat(u.clauses(), contains(contains(-1)));
    }

    @Test
    public void laterUnitsComeFirst() {
        EncodingState s = EncodingState.empty();
        s.forceTrue(4);
        s.forceFalse(ImmutableList.of(1, 2, 3));
        assertThat(s.clauses(), contains(contains(-1), contains(-2), contains(-3), contains(4)));
    }

    @Test
    public void toStringShowsCounterAndClauses() {
        EncodingState s = EncodingState.startingAt(2);
        s.forceTrue(1);
        assertThat(s.toString(), is("(2,[[1]])"));
    }

    @Test(expected = IllegalArgumentException.class)
    public void negativeCountThrows() {
        EncodingState.empty().freshVars(-1);
    }

    @Test(expected = IllegalArgumentException.class)
    public void negativeStartThrows() {
        EncodingState.startingAt(-1);
    }
}
