// Copyright 2018 Colin Smith. MIT License.
package net.littleredcomputer.design;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;

import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * A high-level block: the top-level factors of a design, the subset of them to
 * cross, and the requested constraint kinds.
 */
public final class HLBlock {
    private final int numTrials;
    private final List<DesignNode> design;
    private final List<DesignNode> crossing;
    private final Set<ConstraintKind> constraints;

    private HLBlock(int numTrials, List<DesignNode> design, List<DesignNode> crossing, Set<ConstraintKind> constraints) {
        this.numTrials = numTrials;
        this.design = design;
        this.crossing = crossing;
        this.constraints = constraints;
    }

    /**
     * @return the number of trials needed to realize every combination of levels
     *         of {@code factors} once: the product of their leaf counts
     */
    public static int fullyCrossSize(Collection<? extends DesignNode> factors) {
        int n = 1;
        for (DesignNode f : factors) n = Math.multiplyExact(n, f.leafCount());
        return n;
    }

    /** A block crossing every factor of the design. */
    public static HLBlock makeBlock(int numTrials, List<? extends DesignNode> design, Collection<ConstraintKind> constraints) {
        return makeBlock(numTrials, design, design, constraints);
    }

    /**
     * Only the structure is checked: the trial count must be positive and every
     * crossed factor must be a factor of the design, crossed once.
     */
    public static HLBlock makeBlock(int numTrials, List<? extends DesignNode> design,
                                   List<? extends DesignNode> crossing, Collection<ConstraintKind> constraints) {
        Preconditions.checkArgument(numTrials > 0, "a block needs at least one trial, not %s", numTrials);
        for (DesignNode f : crossing) {
            Preconditions.checkArgument(design.contains(f), "crossed factor %s is not in the design", f.name());
        }
        Preconditions.checkArgument(ImmutableSet.copyOf(crossing).size() == crossing.size(),
                "a factor is crossed more than once in %s", crossing);
        return new HLBlock(numTrials, ImmutableList.copyOf(design), ImmutableList.copyOf(crossing),
                ImmutableSet.copyOf(constraints));
    }

    /** A fully crossed block with exactly as many trials as the crossing requires. */
    public static HLBlock fullyCrossed(List<? extends DesignNode> design, List<? extends DesignNode> crossing) {
        return makeBlock(fullyCrossSize(crossing), design, crossing, ImmutableSet.of(ConstraintKind.FULLY_CROSS));
    }

    public int numTrials() { return numTrials; }
    public List<DesignNode> design() { return design; }
    public List<DesignNode> crossing() { return crossing; }
    public Set<ConstraintKind> constraints() { return constraints; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        HLBlock b = (HLBlock) o;
        return numTrials == b.numTrials && design.equals(b.design) && crossing.equals(b.crossing)
                && constraints.equals(b.constraints);
    }

    @Override
    public int hashCode() {
        return Objects.hash(numTrials, design, crossing, constraints);
    }

    @Override
    public String toString() {
        return "HLBlock{numTrials=" + numTrials + ", design=" + design + ", crossing=" + crossing
                + ", constraints=" + constraints + "}";
    }
}
