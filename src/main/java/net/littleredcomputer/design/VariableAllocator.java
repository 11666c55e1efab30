// Copyright 2018 Colin Smith. MIT License.
package net.littleredcomputer.design;

import com.google.common.collect.ImmutableList;
import net.littleredcomputer.design.cnf.EncodingState;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.List;

/**
 * Lowers a high-level block to an intermediate one by giving every (trial,
 * factor, level) its own variable.
 */
public final class VariableAllocator {
    private static final Logger log = LogManager.getFormatterLogger(VariableAllocator.class);

    private VariableAllocator() {}

    /**
     * Allocate level variables trial by trial and, within a trial, factor by
     * factor in design order, one run of {@code leafCount} fresh variables per
     * factor. Only fresh variables are consumed; no clauses are added.
     * <p>
     * The result always lists {@link ConstraintKind#CONSISTENCY} first, followed
     * by the block's own constraints.
     */
    public static ILBlock allocate(HLBlock block, EncodingState state) {
        final int startAddr = state.lastVar() + 1;
        for (int t = 0; t < block.numTrials(); ++t) {
            for (DesignNode f : block.design()) {
                state.freshVars(f.leafCount());
            }
        }
        final int endAddr = state.lastVar();
        ImmutableList.Builder<ConstraintKind> constraints = ImmutableList.builder();
        constraints.add(ConstraintKind.CONSISTENCY);
        for (ConstraintKind k : block.constraints()) {
            if (k != ConstraintKind.CONSISTENCY) constraints.add(k);
        }
        List<ConstraintKind> kinds = constraints.build();
        log.debug("allocated variables [%d, %d] for %d trials of %d factors",
                startAddr, endAddr, block.numTrials(), block.design().size());
        return new ILBlock(block.numTrials(), startAddr, endAddr, block.design(), block.crossing(), kinds);
    }

    /** {@link #allocate(HLBlock, EncodingState)} from an empty state. */
    public static ILBlock allocate(HLBlock block) {
        return allocate(block, EncodingState.empty());
    }
}
