// Copyright 2018 Colin Smith. MIT License.
package net.littleredcomputer.design;

import com.google.common.collect.ImmutableList;

import java.util.List;

/**
 * Reads trials back out of a satisfying assignment.
 */
public final class TrialDecoder {
    private TrialDecoder() {}

    /**
     * @param block      the addressed block the assignment was found for
     * @param assignment truth values; assignment[v-1] is the value of variable v
     * @return for each trial, the name of the level each top-level factor takes
     */
    public static List<List<String>> decode(ILBlock block, boolean[] assignment) {
        if (assignment.length < block.endAddr()) {
            throw new IllegalArgumentException("Assignment covers " + assignment.length
                    + " variables; the block needs " + block.endAddr());
        }
        List<List<List<Integer>>> shaped = block.shapedLevels();
        ImmutableList.Builder<List<String>> trials = ImmutableList.builder();
        for (int t = 0; t < shaped.size(); ++t) {
            ImmutableList.Builder<String> levels = ImmutableList.builder();
            for (int f = 0; f < block.design().size(); ++f) {
                DesignNode factor = block.design().get(f);
                List<Integer> vars = shaped.get(t).get(f);
                int chosen = -1;
                for (int i = 0; i < vars.size(); ++i) {
                    if (!assignment[vars.get(i) - 1]) continue;
                    if (chosen >= 0) {
                        throw new IllegalArgumentException("Trial " + t + " has more than one level of " + factor.name());
                    }
                    chosen = i;
                }
                if (chosen < 0) throw new IllegalArgumentException("Trial " + t + " has no level of " + factor.name());
                levels.add(factor.leaves().get(chosen));
            }
            trials.add(levels.build());
        }
        return trials.build();
    }
}
