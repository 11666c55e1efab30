// Copyright 2018 Colin Smith. MIT License.
package net.littleredcomputer.design;

import net.littleredcomputer.design.cnf.Clauses;
import net.littleredcomputer.design.cnf.EncodingState;
import net.littleredcomputer.design.cnf.OneHot;

import java.util.List;

/**
 * Compiles low-level constraints to clauses.
 * <ul>
 *     <li>{@code OneHot vs}: the pairwise exactly-one clauses of {@link OneHot}.</li>
 *     <li>{@code Entangle s ls}: s &harr; (l<sub>1</sub> &and; ... &and; l<sub>n</sub>),
 *     so every selection variable is determined by the level variables.</li>
 * </ul>
 */
public final class Clausifier implements LLConstraint.Visitor<List<List<Integer>>> {
    private static final Clausifier INSTANCE = new Clausifier();

    private Clausifier() {}

    @Override
    public List<List<Integer>> visitOneHot(LLConstraint.OneHot c) {
        return OneHot.clauses(c.vars());
    }

    @Override
    public List<List<Integer>> visitEntangle(LLConstraint.Entangle c) {
        return Clauses.iffAnd(c.stateVar(), c.impliedVars());
    }

    public static List<List<Integer>> clauses(LLConstraint c) {
        return c.accept(INSTANCE);
    }

    /**
     * Append the clauses of each constraint, in order, one batch per constraint.
     */
    public static void clausify(List<? extends LLConstraint> constraints, EncodingState state) {
        for (LLConstraint c : constraints) state.appendClauses(clauses(c));
    }
}
