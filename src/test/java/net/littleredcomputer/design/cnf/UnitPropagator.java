// Copyright 2018 Colin Smith. MIT License.
package net.littleredcomputer.design.cnf;

import gnu.trove.list.TIntList;
import gnu.trove.list.array.TIntArrayList;
import gnu.trove.stack.array.TIntArrayStack;

import java.util.List;
import java.util.Optional;

/**
 * Decides formulas whose variables are all functions of a set of assumed
 * literals, such as adder circuits once their inputs are fixed. Unit
 * propagation runs to a fixed point; a conflict means the assumptions admit no
 * solution.
 */
public class UnitPropagator {
    private final CnfFormula f;

    public UnitPropagator(CnfFormula f) {
        this.f = f;
    }

    /**
     * @return the assignment forced by {@code assumptions}, or empty on conflict
     * @throws IllegalStateException if propagation leaves a variable unassigned
     */
    public Optional<boolean[]> propagate(TIntList assumptions) {
        // 0: unknown, 1: true, -1: false
        final int[] value = new int[f.nVariables() + 1];
        final TIntArrayStack pending = new TIntArrayStack();
        for (int i = 0; i < assumptions.size(); ++i) pending.push(assumptions.get(i));
        boolean changed = true;
        while (changed) {
            while (pending.size() > 0) {
                int l = pending.pop();
                int v = Math.abs(l), s = l > 0 ? 1 : -1;
                if (value[v] == -s) return Optional.empty();
                value[v] = s;
            }
            changed = false;
            CLAUSE:
            for (List<Integer> clause : f.clauses()) {
                int unknown = 0;
                int last = 0;
                for (int l : clause) {
                    int x = value[Math.abs(l)];
                    if (x == 0) {
                        ++unknown;
                        last = l;
                    } else if (x == (l > 0 ? 1 : -1)) {
                        continue CLAUSE;
                    }
                }
                if (unknown == 0) return Optional.empty();
                if (unknown == 1) {
                    pending.push(last);
                    changed = true;
                }
            }
        }
        boolean[] p = new boolean[f.nVariables()];
        for (int v = 1; v <= f.nVariables(); ++v) {
            if (value[v] == 0) throw new IllegalStateException("variable " + v + " is not determined");
            p[v - 1] = value[v] > 0;
        }
        return Optional.of(p);
    }

    /** Literals setting variables 1..n to the bits of {@code mask}, bit 0 first. */
    public static TIntList inputs(int n, int mask) {
        TIntArrayList ls = new TIntArrayList(n);
        for (int v = 1; v <= n; ++v) ls.add((mask & (1 << (v - 1))) != 0 ? v : -v);
        return ls;
    }
}
