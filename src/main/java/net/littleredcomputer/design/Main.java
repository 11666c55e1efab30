// Copyright 2018 Colin Smith. MIT License.
package net.littleredcomputer.design;

import com.google.common.base.Joiner;
import com.google.common.base.Stopwatch;
import net.littleredcomputer.design.cnf.SolverOutput;
import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.*;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Optional;

public class Main {
    private static final Logger log = LogManager.getFormatterLogger(Main.class);
    private static final Joiner spaceJoiner = Joiner.on(' ');

    private static Options options() {
        return new Options()
                .addOption("task", true, "one of encode, constraints, decode")
                .addOption("design", true, "factors, e.g. color=red,blue;text=red,blue")
                .addOption("crossing", true, "comma-separated names of the factors to cross (default: all)")
                .addOption("solution", true, "filename of solver output to decode, or - for stdin");
    }

    private static HLBlock block(CommandLine cmd) {
        if (!cmd.hasOption("design")) throw new IllegalArgumentException("Must specify -design");
        List<DesignNode> design = DesignParser.parse(cmd.getOptionValue("design"));
        List<DesignNode> crossing = cmd.hasOption("crossing")
                ? DesignParser.crossing(design, cmd.getOptionValue("crossing"))
                : design;
        return HLBlock.fullyCrossed(design, crossing);
    }

    private static Reader solution(CommandLine cmd) throws FileNotFoundException {
        if (!cmd.hasOption("solution")) throw new IllegalArgumentException("Must specify -solution");
        String s = cmd.getOptionValue("solution");
        return new BufferedReader(s.equals("-")
                ? new InputStreamReader(System.in, StandardCharsets.UTF_8)
                : new InputStreamReader(new FileInputStream(s), StandardCharsets.UTF_8));
    }

    public static void main(String[] args) throws ParseException, IOException {
        CommandLine cmd = new DefaultParser().parse(options(), args);
        if (!cmd.hasOption("task")) throw new IllegalArgumentException("Must specify -task");
        String task = cmd.getOptionValue("task");
        Stopwatch sw = Stopwatch.createStarted();
        switch (task) {
            case "encode": {
                DesignEncoder.EncodedDesign e = DesignEncoder.encode(block(cmd));
                System.out.println("c " + spaceJoiner.join(args));
                e.formula().printDimacs(System.out);
                break;
            }
            case "constraints": {
                DesignEncoder.EncodedDesign e = DesignEncoder.encode(block(cmd));
                System.out.println("c variables " + e.block().startAddr() + ".." + e.block().endAddr()
                        + " for " + e.block().numTrials() + " trials");
                e.constraints().forEach(System.out::println);
                break;
            }
            case "decode": {
                DesignEncoder.EncodedDesign e = DesignEncoder.encode(block(cmd));
                try (Reader r = solution(cmd)) {
                    Optional<boolean[]> outcome = SolverOutput.parse(r, e.formula().nVariables());
                    if (outcome.isPresent()) {
                        TrialDecoder.decode(e.block(), outcome.get()).forEach(t -> System.out.println(spaceJoiner.join(t)));
                    } else {
                        System.out.println("s UNSATISFIABLE");
                    }
                }
                break;
            }
            default:
                throw new IllegalArgumentException("unknown task: " + task);
        }
        sw.stop();
        log.info("%s finished in %s", task, sw);
    }
}
