// Copyright 2018 Colin Smith. MIT License.
package net.littleredcomputer.design;

import com.google.common.collect.ImmutableList;
import org.junit.Test;

import static net.littleredcomputer.design.HLBlockTest.color;
import static net.littleredcomputer.design.HLBlockTest.motion;
import static org.hamcrest.Matchers.*;
import static org.junit.Assert.assertThat;

public class TrialDecoderTest {
    // Trial t: color at 5t+1..5t+2, motion at 5t+3..5t+5.
    private static final ILBlock block = new ILBlock(2, 1, 10, ImmutableList.of(color, motion),
            ImmutableList.of(color), ImmutableList.of(ConstraintKind.CONSISTENCY));

    private static boolean[] assignment(int n, int... trueVars) {
        boolean[] p = new boolean[n];
        for (int v : trueVars) p[v - 1] = true;
        return p;
    }

    @Test
    public void decode() {
        assertThat(TrialDecoder.decode(block, assignment(10, 2, 3, 6, 10)), contains(
                contains("blue", "up"), contains("red", "left")));
    }

    @Test
    public void variablesPastTheBlockAreIgnored() {
        assertThat(TrialDecoder.decode(block, assignment(14, 1, 4, 7, 8, 11, 12, 13, 14)), contains(
                contains("red", "down"), contains("blue", "up")));
    }

    @Test
    public void groupedLevelsDecodeToLeaves() {
        DesignNode shape = DesignNode.group("shape", DesignNode.leaf("circle"),
                DesignNode.group("polygon", DesignNode.leaf("triangle"), DesignNode.leaf("square")));
        ILBlock b = new ILBlock(1, 1, 3, ImmutableList.of(shape), ImmutableList.of(shape),
                ImmutableList.of(ConstraintKind.CONSISTENCY));
        assertThat(TrialDecoder.decode(b, assignment(3, 3)), contains(contains("square")));
    }

    @Test(expected = IllegalArgumentException.class)
    public void tooShort() {
        TrialDecoder.decode(block, assignment(9, 1, 3, 6, 8));
    }

    @Test(expected = IllegalArgumentException.class)
    public void noLevel() {
        TrialDecoder.decode(block, assignment(10, 1, 3, 8));
    }

    @Test(expected = IllegalArgumentException.class)
    public void twoLevels() {
        TrialDecoder.decode(block, assignment(10, 1, 2, 3, 6, 8));
    }
}
