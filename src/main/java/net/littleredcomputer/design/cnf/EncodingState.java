// Copyright 2018 Colin Smith. MIT License.
package net.littleredcomputer.design.cnf;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;

import java.util.ArrayList;
import java.util.List;

/**
 * The fresh-variable counter and clause accumulator threaded through every
 * encoding step. One instance belongs to one lowering pass; it is never shared.
 * <p>
 * The counter holds the most recently issued variable, so a state created at 0
 * hands out 1 first. Clauses are accumulated LIFO by call: the batch given to the
 * most recent {@link #appendClauses} comes first in {@link #clauses()}, with its
 * own clauses in the order given.
 */
public class EncodingState {
    private int lastVar;
    // Batches in call order; clauses() reads them back to front.
    private final List<List<List<Integer>>> batches = new ArrayList<>();
    private int nClauses = 0;

    private EncodingState(int lastVar) {
        Preconditions.checkArgument(lastVar >= 0, "variable counter must be non-negative: %s", lastVar);
        this.lastVar = lastVar;
    }

    public static EncodingState empty() {
        return new EncodingState(0);
    }

    /**
     * @param lastVar the last variable already consumed by an earlier stage
     * @return a state whose first fresh variable is {@code lastVar + 1}
     */
    public static EncodingState startingAt(int lastVar) {
        return new EncodingState(lastVar);
    }

    public int lastVar() {
        return lastVar;
    }

    public int freshVar() {
        return ++lastVar;
    }

    /**
     * @param n number of variables wanted
     * @return {@code n} consecutive fresh variables in ascending order
     */
    public List<Integer> freshVars(int n) {
        Preconditions.checkArgument(n >= 0, "cannot allocate %s variables", n);
        List<Integer> vars = new ArrayList<>(n);
        for (int i = 0; i < n; ++i) vars.add(freshVar());
        return vars;
    }

    public void setFresh(int lastVar) {
        Preconditions.checkArgument(lastVar >= 0, "variable counter must be non-negative: %s", lastVar);
        this.lastVar = lastVar;
    }

    public void appendClauses(List<List<Integer>> clauses) {
        ImmutableList.Builder<List<Integer>> batch = ImmutableList.builder();
        for (List<Integer> c : clauses) batch.add(ImmutableList.copyOf(c));
        batches.add(batch.build());
        nClauses += clauses.size();
    }

    public void forceFalse(List<Integer> vars) {
        List<List<Integer>> units = new ArrayList<>(vars.size());
        for (int v : vars) units.add(ImmutableList.of(-v));
        appendClauses(units);
    }

    public void forceFalse(int v) {
        appendClauses(ImmutableList.<List<Integer>>of(ImmutableList.of(-v)));
    }

    public void forceTrue(int v) {
        appendClauses(ImmutableList.<List<Integer>>of(ImmutableList.of(v)));
    }

    public int nClauses() {
        return nClauses;
    }

    /**
     * @return the accumulated clauses, most recently appended batch first
     */
    public List<List<Integer>> clauses() {
        return concat(Lists.reverse(batches));
    }

    /**
     * @return the accumulated clauses, first appended batch first
     */
    public List<List<Integer>> clausesInCallOrder() {
        return concat(batches);
    }

    private static List<List<Integer>> concat(List<List<List<Integer>>> bs) {
        ImmutableList.Builder<List<Integer>> b = ImmutableList.builder();
        for (List<List<Integer>> batch : bs) b.addAll(batch);
        return b.build();
    }

    @Override
    public String toString() {
        return "(" + lastVar + "," + clauses() + ")";
    }
}
