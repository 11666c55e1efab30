// Copyright 2018 Colin Smith. MIT License.
package net.littleredcomputer.design;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;

import javax.annotation.CheckReturnValue;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * An intermediate-level block: a design whose trials have been assigned variable
 * addresses. Trial t, factor f occupies a contiguous run of
 * {@code leafCount(f)} variables; runs are laid out trial by trial, factor by
 * factor within a trial, starting at {@link #startAddr()}. The addresses are
 * not stored per node but recomputed by {@link #shapedLevels()}.
 */
public final class ILBlock {
    private final int numTrials;
    private final int startAddr;
    private final int endAddr;
    private final List<DesignNode> design;
    private final List<DesignNode> crossing;
    private final List<ConstraintKind> constraints;

    public ILBlock(int numTrials, int startAddr, int endAddr, List<? extends DesignNode> design,
                   List<? extends DesignNode> crossing, List<ConstraintKind> constraints) {
        Preconditions.checkArgument(numTrials > 0, "a block needs at least one trial, not %s", numTrials);
        Preconditions.checkArgument(startAddr > 0, "addresses start at 1, not %s", startAddr);
        for (DesignNode f : crossing) {
            Preconditions.checkArgument(design.contains(f), "crossed factor %s is not in the design", f.name());
        }
        Preconditions.checkArgument(ImmutableSet.copyOf(crossing).size() == crossing.size(),
                "a factor is crossed more than once in %s", crossing);
        int perTrial = 0;
        for (DesignNode f : design) perTrial = Math.addExact(perTrial, f.leafCount());
        Preconditions.checkArgument((long) endAddr - startAddr + 1 == Math.multiplyExact(numTrials, perTrial),
                "address range [%s, %s] does not hold %s trials of %s variables", startAddr, endAddr, numTrials, perTrial);
        this.numTrials = numTrials;
        this.startAddr = startAddr;
        this.endAddr = endAddr;
        this.design = ImmutableList.copyOf(design);
        this.crossing = ImmutableList.copyOf(crossing);
        this.constraints = ImmutableList.copyOf(constraints);
    }

    public int numTrials() { return numTrials; }
    public int startAddr() { return startAddr; }
    public int endAddr() { return endAddr; }
    public List<DesignNode> design() { return design; }
    public List<DesignNode> crossing() { return crossing; }
    public List<ConstraintKind> constraints() { return constraints; }

    /**
     * Partition start, start+1, ... into consecutive runs of the given sizes.
     * For example {@code trialVars(5, [2, 2])} is {@code [[5, 6], [7, 8]]}.
     */
    @CheckReturnValue
    public static List<List<Integer>> trialVars(int start, List<Integer> sizes) {
        ImmutableList.Builder<List<Integer>> runs = ImmutableList.builder();
        int next = start;
        for (int size : sizes) {
            Preconditions.checkArgument(size >= 0, "negative group size %s", size);
            List<Integer> run = new ArrayList<>(size);
            for (int i = 0; i < size; ++i) run.add(next++);
            runs.add(ImmutableList.copyOf(run));
        }
        return runs.build();
    }

    /**
     * The level variables of every trial: element [t][f] is the run of variables
     * of top-level factor f (in design order) in trial t.
     */
    @CheckReturnValue
    public List<List<List<Integer>>> shapedLevels() {
        List<Integer> sizes = new ArrayList<>(numTrials * design.size());
        for (int t = 0; t < numTrials; ++t) {
            for (DesignNode f : design) sizes.add(f.leafCount());
        }
        List<List<Integer>> runs = trialVars(startAddr, sizes);
        ImmutableList.Builder<List<List<Integer>>> trials = ImmutableList.builder();
        for (int t = 0; t < numTrials; ++t) {
            trials.add(runs.subList(t * design.size(), (t + 1) * design.size()));
        }
        return trials.build();
    }

    /**
     * As {@link #shapedLevels()}, keeping only the crossed factors, in crossing
     * order.
     */
    @CheckReturnValue
    public List<List<List<Integer>>> crossedLevels() {
        ImmutableList.Builder<List<List<Integer>>> trials = ImmutableList.builder();
        for (List<List<Integer>> trial : shapedLevels()) {
            ImmutableList.Builder<List<Integer>> factors = ImmutableList.builder();
            for (DesignNode f : crossing) factors.add(trial.get(design.indexOf(f)));
            trials.add(factors.build());
        }
        return trials.build();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ILBlock b = (ILBlock) o;
        return numTrials == b.numTrials && startAddr == b.startAddr && endAddr == b.endAddr
                && design.equals(b.design) && crossing.equals(b.crossing) && constraints.equals(b.constraints);
    }

    @Override
    public int hashCode() {
        return Objects.hash(numTrials, startAddr, endAddr, design, crossing, constraints);
    }

    @Override
    public String toString() {
        return "ILBlock{numTrials=" + numTrials + ", startAddr=" + startAddr + ", endAddr=" + endAddr
                + ", design=" + design + ", crossing=" + crossing + ", constraints=" + constraints + "}";
    }
}
