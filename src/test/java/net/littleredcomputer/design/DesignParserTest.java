// Copyright 2018 Colin Smith. MIT License.
package net.littleredcomputer.design;

import org.junit.Test;

import java.util.List;

import static org.hamcrest.Matchers.*;
import static org.junit.Assert.assertThat;

public class DesignParserTest {

    @Test
    public void parse() {
        List<DesignNode> design = DesignParser.parse("color=red,blue; text = red, blue ;");
        assertThat(design, contains(
                DesignNode.factor("color", "red", "blue"),
                DesignNode.factor("text", "red", "blue")));
    }

    @Test
    public void crossing() {
        List<DesignNode> design = DesignParser.parse("color=red,blue;text=red,blue;motion=up,down");
        assertThat(DesignParser.crossing(design, "motion,color"), contains(design.get(2), design.get(0)));
    }

    @Test(expected = IllegalArgumentException.class)
    public void unknownCrossedFactor() {
        DesignParser.crossing(DesignParser.parse("color=red,blue"), "text");
    }

    @Test(expected = IllegalArgumentException.class)
    public void missingLevels() {
        DesignParser.parse("color=");
    }

    @Test(expected = IllegalArgumentException.class)
    public void missingEquals() {
        DesignParser.parse("color");
    }

    @Test(expected = IllegalArgumentException.class)
    public void duplicateFactor() {
        DesignParser.parse("color=red;color=blue");
    }

    @Test(expected = IllegalArgumentException.class)
    public void duplicateLevel() {
        DesignParser.parse("color=red,red");
    }

    @Test(expected = IllegalArgumentException.class)
    public void empty() {
        DesignParser.parse(" ; ");
    }
}
