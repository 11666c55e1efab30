// Copyright 2018 Colin Smith. MIT License.
package net.littleredcomputer.design;

import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Parses flat designs written as {@code factor=level,level;factor=level,...},
 * e.g. {@code color=red,blue;text=red,blue}.
 */
public final class DesignParser {
    private static final Splitter semicolonSplitter = Splitter.on(';').trimResults().omitEmptyStrings();
    private static final Splitter equalsSplitter = Splitter.on('=').trimResults();
    private static final Splitter commaSplitter = Splitter.on(',').trimResults().omitEmptyStrings();

    private DesignParser() {}

    public static List<DesignNode> parse(String s) {
        ImmutableList.Builder<DesignNode> design = ImmutableList.builder();
        Set<String> names = new HashSet<>();
        for (String factor : semicolonSplitter.split(s)) {
            List<String> nl = equalsSplitter.splitToList(factor);
            if (nl.size() != 2 || nl.get(0).isEmpty()) throw new IllegalArgumentException("malformed factor: " + factor);
            String name = nl.get(0);
            if (!names.add(name)) throw new IllegalArgumentException("duplicate factor: " + name);
            List<String> levels = commaSplitter.splitToList(nl.get(1));
            if (levels.isEmpty()) throw new IllegalArgumentException("factor " + name + " has no levels");
            if (new HashSet<>(levels).size() != levels.size()) {
                throw new IllegalArgumentException("repeated level in factor " + name);
            }
            design.add(DesignNode.factor(name, levels.toArray(new String[0])));
        }
        List<DesignNode> result = design.build();
        if (result.isEmpty()) throw new IllegalArgumentException("empty design");
        return result;
    }

    /**
     * @param names comma-separated factor names
     * @return the named factors of {@code design}, in the order named
     */
    public static List<DesignNode> crossing(List<DesignNode> design, String names) {
        ImmutableList.Builder<DesignNode> crossing = ImmutableList.builder();
        NAME:
        for (String name : commaSplitter.split(names)) {
            for (DesignNode f : design) {
                if (f.name().equals(name)) {
                    crossing.add(f);
                    continue NAME;
                }
            }
            throw new IllegalArgumentException("unknown factor: " + name);
        }
        return crossing.build();
    }
}
