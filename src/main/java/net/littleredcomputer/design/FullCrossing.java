// Copyright 2018 Colin Smith. MIT License.
package net.littleredcomputer.design;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;
import net.littleredcomputer.design.cnf.EncodingState;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Constraints making a trial sequence realize every combination of levels of the
 * crossed factors exactly once.
 * <p>
 * Each trial gets one fresh selection variable per combination, combinations
 * numbered in row-major order over the crossed factors (last factor fastest).
 * For each combination, a one-hot over its selection variables across all trials
 * places it in exactly one trial; an {@link LLConstraint.Entangle} per selection
 * variable ties it to the level variables of that combination in its trial.
 */
public final class FullCrossing {
    private static final Logger log = LogManager.getFormatterLogger(FullCrossing.class);

    private FullCrossing() {}

    /**
     * @param block an allocated block whose trial count equals the size of its crossing
     * @param state fresh variables for the selection variables come from here; it
     *              must already be past the block's level variables
     * @return the one-hot constraints, one per combination, followed by the
     *         entanglements, trial by trial
     */
    public static List<LLConstraint> constraints(ILBlock block, EncodingState state) {
        Preconditions.checkArgument(state.lastVar() >= block.endAddr(),
                "selection variables from %s would overlap level variables [%s, %s]",
                state.lastVar() + 1, block.startAddr(), block.endAddr());
        final int nTrials = block.numTrials();
        final int nCombinations = HLBlock.fullyCrossSize(block.crossing());
        if (nTrials != nCombinations) {
            throw new IllegalArgumentException("A full crossing of " + nCombinations
                    + " combinations needs exactly that many trials, not " + nTrials);
        }
        final int start = state.lastVar() + 1;
        state.freshVars(nTrials * nCombinations);
        List<List<Integer>> selections = ILBlock.trialVars(start, Collections.nCopies(nTrials, nCombinations));
        log.debug("%d selection variables from %d for %d combinations", nTrials * nCombinations, start, nCombinations);

        List<LLConstraint> out = new ArrayList<>();
        for (int c = 0; c < nCombinations; ++c) {
            List<Integer> sameCombination = new ArrayList<>(nTrials);
            for (List<Integer> trial : selections) sameCombination.add(trial.get(c));
            out.add(LLConstraint.oneHot(sameCombination));
        }
        List<List<List<Integer>>> levels = block.crossedLevels();
        for (int t = 0; t < nTrials; ++t) {
            out.addAll(entangle(selections.get(t), levels.get(t)));
        }
        return out;
    }

    /**
     * Pair selection variables, in order, with the combinations of one level
     * variable per factor, enumerated row-major (last factor varies fastest).
     * For example {@code entangle([5, 6, 7, 8], [[1, 2], [3, 4]])} is
     * {@code [5 -> [1, 3], 6 -> [1, 4], 7 -> [2, 3], 8 -> [2, 4]]}.
     */
    public static List<LLConstraint.Entangle> entangle(List<Integer> stateVars, List<List<Integer>> levelsByFactor) {
        List<List<Integer>> combinations = Lists.cartesianProduct(levelsByFactor);
        Preconditions.checkArgument(stateVars.size() == combinations.size(),
                "%s selection variables for %s combinations", stateVars.size(), combinations.size());
        ImmutableList.Builder<LLConstraint.Entangle> b = ImmutableList.builder();
        for (int i = 0; i < stateVars.size(); ++i) {
            b.add(LLConstraint.entangle(stateVars.get(i), combinations.get(i)));
        }
        return b.build();
    }
}
