// Copyright 2018 Colin Smith. MIT License.
package net.littleredcomputer.design;

import com.google.common.base.Stopwatch;
import com.google.common.collect.ImmutableList;
import net.littleredcomputer.design.cnf.CnfFormula;
import net.littleredcomputer.design.cnf.EncodingState;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.List;

/**
 * The whole lowering: high-level block, to addressed block, to low-level
 * constraints, to CNF. Each stage gets its own {@link EncodingState}, seeded with
 * the last variable of the stage before it.
 */
public final class DesignEncoder {
    private static final Logger log = LogManager.getFormatterLogger(DesignEncoder.class);

    private DesignEncoder() {}

    /** The outputs of every stage of an encoding. */
    public static final class EncodedDesign {
        private final ILBlock block;
        private final List<LLConstraint> constraints;
        private final CnfFormula formula;

        EncodedDesign(ILBlock block, List<LLConstraint> constraints, CnfFormula formula) {
            this.block = block;
            this.constraints = ImmutableList.copyOf(constraints);
            this.formula = formula;
        }

        /** The addressed block; its address range maps solutions back to levels. */
        public ILBlock block() { return block; }
        public List<LLConstraint> constraints() { return constraints; }
        public CnfFormula formula() { return formula; }
    }

    public static EncodedDesign encode(HLBlock design) {
        Stopwatch sw = Stopwatch.createStarted();
        ILBlock block = VariableAllocator.allocate(design, EncodingState.empty());
        EncodingState lowering = EncodingState.startingAt(block.endAddr());
        List<LLConstraint> constraints = Lowering.lower(block, lowering);
        EncodingState clauses = EncodingState.startingAt(lowering.lastVar());
        Clausifier.clausify(constraints, clauses);
        // Level variables 1..endAddr are the independent support; selection variables follow from them.
        CnfFormula formula = CnfFormula.fromState(clauses, block.endAddr());
        log.debug("%d trials -> %d constraints -> %d clauses over %d variables in %s",
                block.numTrials(), constraints.size(), formula.nClauses(), formula.nVariables(), sw);
        return new EncodedDesign(block, constraints, formula);
    }
}
