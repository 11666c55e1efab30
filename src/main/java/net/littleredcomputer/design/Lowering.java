// Copyright 2018 Colin Smith. MIT License.
package net.littleredcomputer.design;

import net.littleredcomputer.design.cnf.EncodingState;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.List;

/**
 * Lowers an intermediate block to low-level constraints.
 */
public final class Lowering {
    private static final Logger log = LogManager.getFormatterLogger(Lowering.class);

    private Lowering() {}

    /**
     * One {@link LLConstraint.OneHot} per trial per factor (trial outermost),
     * then, if the block asks for it, the full-crossing constraints. Selection
     * variables are drawn from {@code state}.
     */
    public static List<LLConstraint> lower(ILBlock block, EncodingState state) {
        List<LLConstraint> out = new ArrayList<>();
        for (List<List<Integer>> trial : block.shapedLevels()) {
            for (List<Integer> factor : trial) out.add(LLConstraint.oneHot(factor));
        }
        final int consistency = out.size();
        if (block.constraints().contains(ConstraintKind.FULLY_CROSS)) {
            out.addAll(FullCrossing.constraints(block, state));
        }
        log.debug("%d consistency and %d crossing constraints; last variable %d",
                consistency, out.size() - consistency, state.lastVar());
        return out;
    }

    /** {@link #lower(ILBlock, EncodingState)}, drawing fresh variables from just past the block's addresses. */
    public static List<LLConstraint> lower(ILBlock block) {
        return lower(block, EncodingState.startingAt(block.endAddr()));
    }
}
