// Copyright 2018 Colin Smith. MIT License.
package net.littleredcomputer.design.cnf;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

import java.util.List;
import java.util.Objects;

/**
 * A request that the number of true variables among {@link #vars()} compare to
 * {@link #k()} as given.
 */
public final class CardinalityRequest {
    public enum Comparison {
        EQ,
        LT,
        GT,
    }

    private final Comparison comparison;
    private final int k;
    private final List<Integer> vars;

    public CardinalityRequest(Comparison comparison, int k, List<Integer> vars) {
        this.comparison = Preconditions.checkNotNull(comparison);
        this.k = k;
        this.vars = ImmutableList.copyOf(vars);
    }

    public static CardinalityRequest exactly(int k, List<Integer> vars) {
        return new CardinalityRequest(Comparison.EQ, k, vars);
    }

    public static CardinalityRequest lessThan(int k, List<Integer> vars) {
        return new CardinalityRequest(Comparison.LT, k, vars);
    }

    public static CardinalityRequest greaterThan(int k, List<Integer> vars) {
        return new CardinalityRequest(Comparison.GT, k, vars);
    }

    public Comparison comparison() { return comparison; }
    public int k() { return k; }
    public List<Integer> vars() { return vars; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        CardinalityRequest that = (CardinalityRequest) o;
        return k == that.k && comparison == that.comparison && vars.equals(that.vars);
    }

    @Override
    public int hashCode() {
        return Objects.hash(comparison, k, vars);
    }

    @Override
    public String toString() {
        return comparison + " " + k + " " + vars;
    }
}
