// Copyright 2018 Colin Smith. MIT License.
package net.littleredcomputer.design.cnf;

import com.google.common.base.Joiner;
import com.google.common.collect.ContiguousSet;
import com.google.common.collect.DiscreteDomain;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;
import com.google.common.collect.Range;

import java.io.PrintStream;
import java.util.List;

/**
 * A finished clause set, ready to hand to a SAT solver or sampler. Clauses are
 * kept in emission order (the order they are written out), which for a formula
 * taken from an {@link EncodingState} is the order the clauses were generated.
 */
public class CnfFormula {
    private static final Joiner spaceJoiner = Joiner.on(' ');
    private static final int supportPerLine = 10;
    private final int nVariables;
    private final List<List<Integer>> clauses;
    private final int support;
    private int nLiterals = 0;
    private int width = 0;

    public CnfFormula(int nVariables, List<List<Integer>> clauses, int support) {
        if (nVariables < 0) throw new IllegalArgumentException("Negative variable count " + nVariables);
        if (support < 0 || support > nVariables) {
            throw new IllegalArgumentException("Support " + support + " outside [0, " + nVariables + "]");
        }
        this.nVariables = nVariables;
        this.support = support;
        ImmutableList.Builder<List<Integer>> b = ImmutableList.builder();
        for (List<Integer> c : clauses) {
            for (int l : c) {
                if (l == 0 || l > nVariables || l < -nVariables) {
                    throw new IllegalArgumentException("literal " + l + " out of declared bounds");
                }
            }
            b.add(ImmutableList.copyOf(c));
            nLiterals += c.size();
            if (c.size() > width) width = c.size();
        }
        this.clauses = b.build();
    }

    /**
     * @param state   a finished encoding
     * @param support number of independent variables (1..support)
     * @return the state's clauses with batches in the order they were appended,
     *         over the state's variables
     */
    public static CnfFormula fromState(EncodingState state, int support) {
        return new CnfFormula(state.lastVar(), state.clausesInCallOrder(), support);
    }

    public int nVariables() { return nVariables; }
    public int nClauses() { return clauses.size(); }
    public int nLiterals() { return nLiterals; }
    public int support() { return support; }

    /** Length of the longest clause. */
    public int width() { return width; }

    public List<Integer> getClause(int i) { return clauses.get(i); }
    public List<List<Integer>> clauses() { return clauses; }

    /**
     * Evaluate the conjunction of the clauses at the specified point.
     *
     * @param p truth values; p[v-1] is the value of variable v
     * @return the truth value of this formula at p
     */
    public boolean evaluate(boolean[] p) {
        if (p.length < nVariables) {
            throw new IllegalArgumentException("Need " + nVariables + " values, got " + p.length);
        }
        CLAUSE:
        for (List<Integer> clause : clauses) {
            for (int literal : clause) {
                // One true literal in the clause is enough to make the whole clause true.
                if (p[Math.abs(literal) - 1] == literal > 0) continue CLAUSE;
            }
            return false;  // Any false clause is enough to spoil satisfaction.
        }
        return true;
    }

    /**
     * DIMACS text: the {@code p cnf} header, the support as {@code c ind} lines,
     * then one line per clause.
     */
    public String toDimacs() {
        StringBuilder sb = new StringBuilder();
        sb.append("p cnf ").append(nVariables).append(' ').append(clauses.size()).append('\n');
        if (support > 0) {
            List<Integer> ind = ContiguousSet.create(Range.closed(1, support), DiscreteDomain.integers()).asList();
            for (List<Integer> chunk : Lists.partition(ind, supportPerLine)) {
                sb.append("c ind ");
                spaceJoiner.appendTo(sb, chunk);
                sb.append(" 0\n");
            }
        }
        for (List<Integer> clause : clauses) {
            spaceJoiner.appendTo(sb, clause);
            sb.append(clause.isEmpty() ? "0\n" : " 0\n");
        }
        return sb.toString();
    }

    public void printDimacs(PrintStream p) {
        p.print(toDimacs());
    }

    @Override
    public String toString() {
        return clauses.toString();
    }
}
