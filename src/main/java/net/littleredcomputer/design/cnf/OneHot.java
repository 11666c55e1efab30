// Copyright 2018 Colin Smith. MIT License.
package net.littleredcomputer.design.cnf;

import com.google.common.collect.ImmutableList;

import java.util.ArrayList;
import java.util.List;

/**
 * Exactly-one constraints, in the pairwise form of TAOCP 7.2.2.2 (13).
 */
public final class OneHot {
    private OneHot() {}

    /**
     * The clauses requiring exactly one of {@code vars}: one binary clause
     * forbidding each pair (i, j), i before j, in lexicographic pair order,
     * followed by the clause requiring at least one. For n variables that is
     * C(n, 2) + 1 clauses. With no variables the result is the single empty
     * clause, which no assignment satisfies.
     */
    public static List<List<Integer>> clauses(List<Integer> vars) {
        final int n = vars.size();
        List<List<Integer>> out = new ArrayList<>(n * (n - 1) / 2 + 1);
        for (int i = 0; i < n; ++i) {
            for (int j = i + 1; j < n; ++j) {
                out.add(ImmutableList.of(-vars.get(i), -vars.get(j)));
            }
        }
        out.add(ImmutableList.copyOf(vars));
        return out;
    }

    /**
     * Append {@link #clauses} for {@code vars} to {@code state} as one batch.
     * No fresh variables are consumed.
     */
    public static void enforce(List<Integer> vars, EncodingState state) {
        state.appendClauses(clauses(vars));
    }
}
