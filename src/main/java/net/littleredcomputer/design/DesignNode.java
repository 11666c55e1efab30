// Copyright 2018 Colin Smith. MIT License.
package net.littleredcomputer.design;

import com.google.common.base.Joiner;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * A node of the high-level design tree: either a {@link Leaf} (a level) or a
 * {@link Group} of ordered children (a factor, or a grouping of levels inside
 * one). Nodes are immutable, so every tree is finite and acyclic.
 */
public abstract class DesignNode {
    private static final Joiner commaJoiner = Joiner.on(", ");
    private final String name;

    // Leaf and Group are the only variants.
    private DesignNode(String name) {
        this.name = Preconditions.checkNotNull(name);
    }

    public static Leaf leaf(String name) {
        return new Leaf(name);
    }

    public static Group group(String name, DesignNode... children) {
        return new Group(name, Arrays.asList(children));
    }

    public static Group group(String name, List<? extends DesignNode> children) {
        return new Group(name, children);
    }

    /** A factor whose levels are the given leaves. */
    public static Group factor(String name, String... levels) {
        ImmutableList.Builder<DesignNode> b = ImmutableList.builder();
        for (String l : levels) b.add(new Leaf(l));
        return new Group(name, b.build());
    }

    public String name() {
        return name;
    }

    /** Number of leaves under this node; 1 for a leaf. */
    public abstract int leafCount();

    /** Leaf names under this node, left to right. */
    public abstract List<String> leaves();

    public static final class Leaf extends DesignNode {
        private Leaf(String name) {
            super(name);
        }

        @Override
        public int leafCount() { return 1; }

        @Override
        public List<String> leaves() { return ImmutableList.of(name()); }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (o == null || getClass() != o.getClass()) return false;
            return name().equals(((Leaf) o).name());
        }

        @Override
        public int hashCode() { return name().hashCode(); }

        @Override
        public String toString() { return name(); }
    }

    public static final class Group extends DesignNode {
        private final List<DesignNode> children;

        private Group(String name, List<? extends DesignNode> children) {
            super(name);
            this.children = ImmutableList.copyOf(children);
        }

        public List<DesignNode> children() { return children; }

        @Override
        public int leafCount() {
            int n = 0;
            for (DesignNode c : children) n += c.leafCount();
            return n;
        }

        @Override
        public List<String> leaves() {
            ImmutableList.Builder<String> b = ImmutableList.builder();
            for (DesignNode c : children) b.addAll(c.leaves());
            return b.build();
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (o == null || getClass() != o.getClass()) return false;
            Group group = (Group) o;
            return name().equals(group.name()) && children.equals(group.children);
        }

        @Override
        public int hashCode() { return Objects.hash(name(), children); }

        @Override
        public String toString() { return name() + "[" + commaJoiner.join(children) + "]"; }
    }
}
