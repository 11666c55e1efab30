// Copyright 2018 Colin Smith. MIT License.
package net.littleredcomputer.design.cnf;

import com.google.common.collect.ImmutableList;

import java.util.ArrayList;
import java.util.List;

/**
 * Small clause-set builders. None of these touch an {@link EncodingState}; callers
 * append the result themselves.
 */
public final class Clauses {
    private Clauses() {}

    /** a &harr; b */
    public static List<List<Integer>> doubleImplies(int a, int b) {
        return ImmutableList.of(ImmutableList.of(a, -b), ImmutableList.of(-a, b));
    }

    /** a &oplus; b */
    public static List<List<Integer>> xor(int a, int b) {
        return ImmutableList.of(ImmutableList.of(a, b), ImmutableList.of(-a, -b));
    }

    /** &not;(a &oplus; b) */
    public static List<List<Integer>> xnor(int a, int b) {
        return ImmutableList.of(ImmutableList.of(a, -b), ImmutableList.of(-a, b));
    }

    /** &not;(a &and; b) */
    public static List<List<Integer>> nand(int a, int b) {
        return ImmutableList.of(ImmutableList.of(-a, -b));
    }

    /**
     * Replace each clause C of {@code cnf} with (x &or; C).
     */
    public static List<List<Integer>> distribute(int x, List<List<Integer>> cnf) {
        List<List<Integer>> out = new ArrayList<>(cnf.size());
        for (List<Integer> clause : cnf) {
            out.add(ImmutableList.<Integer>builder().add(x).addAll(clause).build());
        }
        return out;
    }

    /**
     * a &harr; (b<sub>1</sub> &and; ... &and; b<sub>n</sub>), as the clause
     * (&not;b<sub>1</sub> &or; ... &or; &not;b<sub>n</sub> &or; a) followed by one
     * clause (&not;a &or; b<sub>i</sub>) per conjunct.
     */
    public static List<List<Integer>> iffAnd(int a, List<Integer> bs) {
        List<List<Integer>> out = new ArrayList<>(bs.size() + 1);
        ImmutableList.Builder<Integer> head = ImmutableList.builder();
        for (int b : bs) head.add(-b);
        out.add(head.add(a).build());
        for (int b : bs) out.add(ImmutableList.of(-a, b));
        return out;
    }
}
