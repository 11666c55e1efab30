// Copyright 2018 Colin Smith. MIT License.
package net.littleredcomputer.design.cnf;

import com.google.common.base.Splitter;

import java.io.BufferedReader;
import java.io.Reader;
import java.io.StringReader;
import java.util.Iterator;
import java.util.Optional;

/**
 * Reads the result a SAT solver prints in the competition format:
 * an {@code s SATISFIABLE} or {@code s UNSATISFIABLE} line and, when satisfiable,
 * {@code v} lines of literals ending in 0. Comment lines are skipped.
 */
public final class SolverOutput {
    private static final Splitter splitter = Splitter.on(' ').trimResults().omitEmptyStrings();

    private SolverOutput() {}

    public static Optional<boolean[]> parse(String s, int nVariables) {
        return parse(new StringReader(s), nVariables);
    }

    /**
     * @param nVariables size of the returned assignment; variables the solver
     *                   does not mention are false
     * @return the assignment, with variable v at index v-1, or empty if the
     *         solver reported the formula unsatisfiable
     */
    public static Optional<boolean[]> parse(Reader r, int nVariables) {
        boolean[] assignment = new boolean[nVariables];
        Boolean satisfiable = null;
        boolean terminated = false;
        Iterator<String> lines = new BufferedReader(r).lines().iterator();
        while (lines.hasNext()) {
            String line = lines.next().trim();
            if (line.startsWith("s ")) {
                String status = line.substring(2).trim();
                if (status.equals("SATISFIABLE")) satisfiable = true;
                else if (status.equals("UNSATISFIABLE")) satisfiable = false;
                else throw new IllegalArgumentException("unknown solver status: " + status);
            } else if (line.startsWith("v ")) {
                for (String tok : splitter.split(line.substring(2))) {
                    int l = Integer.parseInt(tok);
                    if (l == 0) {
                        terminated = true;
                    } else if (Math.abs(l) <= nVariables) {
                        assignment[Math.abs(l) - 1] = l > 0;
                    }
                }
            }
        }
        if (satisfiable == null) throw new IllegalArgumentException("Missing solver status line");
        if (!satisfiable) return Optional.empty();
        if (!terminated) throw new IllegalArgumentException("Unterminated assignment");
        return Optional.of(assignment);
    }
}
