// Copyright 2018 Colin Smith. MIT License.
package net.littleredcomputer.design;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

import java.util.List;
import java.util.Objects;

/**
 * A low-level boolean constraint, not yet in clause form. The variants are
 * {@link OneHot} and {@link Entangle}; consumers go through {@link Visitor},
 * so a new variant must be handled everywhere.
 */
public abstract class LLConstraint {
    private LLConstraint() {}

    public interface Visitor<R> {
        R visitOneHot(OneHot c);
        R visitEntangle(Entangle c);
    }

    public abstract <R> R accept(Visitor<R> v);

    public static OneHot oneHot(List<Integer> vars) {
        return new OneHot(vars);
    }

    public static OneHot oneHot(Integer... vars) {
        return new OneHot(ImmutableList.copyOf(vars));
    }

    public static Entangle entangle(int stateVar, List<Integer> impliedVars) {
        return new Entangle(stateVar, impliedVars);
    }

    public static Entangle entangle(int stateVar, Integer... impliedVars) {
        return new Entangle(stateVar, ImmutableList.copyOf(impliedVars));
    }

    /** Exactly one of {@link #vars()} holds. */
    public static final class OneHot extends LLConstraint {
        private final List<Integer> vars;

        private OneHot(List<Integer> vars) {
            this.vars = ImmutableList.copyOf(vars);
        }

        public List<Integer> vars() { return vars; }

        @Override
        public <R> R accept(Visitor<R> v) { return v.visitOneHot(this); }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (o == null || getClass() != o.getClass()) return false;
            return vars.equals(((OneHot) o).vars);
        }

        @Override
        public int hashCode() { return vars.hashCode(); }

        @Override
        public String toString() { return "OneHot " + vars; }
    }

    /**
     * The selection variable {@link #stateVar()} stands for the combination of
     * level variables {@link #impliedVars()}, one per crossed factor.
     */
    public static final class Entangle extends LLConstraint {
        private final int stateVar;
        private final List<Integer> impliedVars;

        private Entangle(int stateVar, List<Integer> impliedVars) {
            Preconditions.checkArgument(stateVar > 0, "bad selection variable %s", stateVar);
            this.stateVar = stateVar;
            this.impliedVars = ImmutableList.copyOf(impliedVars);
        }

        public int stateVar() { return stateVar; }
        public List<Integer> impliedVars() { return impliedVars; }

        @Override
        public <R> R accept(Visitor<R> v) { return v.visitEntangle(this); }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (o == null || getClass() != o.getClass()) return false;
            Entangle e = (Entangle) o;
            return stateVar == e.stateVar && impliedVars.equals(e.impliedVars);
        }

        @Override
        public int hashCode() { return Objects.hash(stateVar, impliedVars); }

        @Override
        public String toString() { return "Entangle " + stateVar + " " + impliedVars; }
    }
}
