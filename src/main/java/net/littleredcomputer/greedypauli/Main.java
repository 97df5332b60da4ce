package net.littleredcomputer.greedypauli;

import com.google.common.base.Stopwatch;
import net.littleredcomputer.greedypauli.circuit.Circuit;
import net.littleredcomputer.greedypauli.circuit.RandomCircuits;
import net.littleredcomputer.greedypauli.synth.GreedyPauliOptimisation;
import net.littleredcomputer.greedypauli.synth.SynthesisOptions;
import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;

import java.time.Duration;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

public class Main {
    private static Pattern randomRe = Pattern.compile("random(\\d+),(\\d+)(?:,(-?\\d+))?");
    private static Pattern mixedRe = Pattern.compile("mixed(\\d+),(\\d+)(?:,(-?\\d+))?");

    private static Options options() {
        return new Options()
                .addOption("problem", true, "circuit generator: random<qubits>,<gates>[,<seed>] or mixed<qubits>,<gates>[,<seed>]")
                .addOption("trials", true, "number of independently seeded trials")
                .addOption("timeout", true, "thread timeout in ISO-8601 format")
                .addOption("seed", true, "seed of the first trial")
                .addOption("discount", true, "lookahead discount rate")
                .addOption("depthweight", true, "weight of depth against gate count")
                .addOption("lookahead", true, "maximum number of nodes scored per candidate")
                .addOption("candidates", true, "maximum number of TQE candidates per step")
                .addOption("zzphase", false, "emit ZZPhase gates for weight-two rotations")
                .addOption("quiet", false, "print statistics only")
                .addOption("loginterval", true, "interval between progress log entries in ISO-8601 format");
    }

    private static Circuit problem(CommandLine cmd) {
        if (!cmd.hasOption("problem")) throw new IllegalArgumentException("Must specify -problem");
        String p = cmd.getOptionValue("problem");
        Matcher rm = randomRe.matcher(p);
        if (rm.matches()) {
            return RandomCircuits.unitary(Integer.parseInt(rm.group(1)), Integer.parseInt(rm.group(2)),
                    rm.group(3) == null ? 0 : Integer.parseInt(rm.group(3)));
        }
        Matcher mm = mixedRe.matcher(p);
        if (mm.matches()) {
            return RandomCircuits.mixed(Integer.parseInt(mm.group(1)), Integer.parseInt(mm.group(2)),
                    mm.group(3) == null ? 0 : Integer.parseInt(mm.group(3)));
        }
        throw new IllegalArgumentException("unknown problem: " + p);
    }

    private static SynthesisOptions synthesisOptions(CommandLine cmd) {
        SynthesisOptions o = new SynthesisOptions()
                .setLogInterval(Duration.parse(cmd.getOptionValue("loginterval", "PT1S")))
                .setAllowZZPhase(cmd.hasOption("zzphase"));
        if (cmd.hasOption("trials")) o.setTrials(Integer.parseInt(cmd.getOptionValue("trials")));
        if (cmd.hasOption("timeout")) o.setThreadTimeout(Duration.parse(cmd.getOptionValue("timeout")));
        if (cmd.hasOption("seed")) o.setSeed(Integer.parseInt(cmd.getOptionValue("seed")));
        if (cmd.hasOption("discount")) o.setDiscountRate(Double.parseDouble(cmd.getOptionValue("discount")));
        if (cmd.hasOption("depthweight")) o.setDepthWeight(Double.parseDouble(cmd.getOptionValue("depthweight")));
        if (cmd.hasOption("lookahead")) o.setMaxLookahead(Integer.parseInt(cmd.getOptionValue("lookahead")));
        if (cmd.hasOption("candidates")) o.setMaxTqeCandidates(Integer.parseInt(cmd.getOptionValue("candidates")));
        return o;
    }

    private static void printStats(String label, Circuit c) {
        System.out.printf("%s: %d gates, %d two-qubit, depth %d%n", label, c.nGates(), c.n2qGates(), c.depth());
    }

    public static void main(String[] args) throws ParseException {
        CommandLine cmd = new DefaultParser().parse(options(), args);
        Circuit input = problem(cmd);
        SynthesisOptions options = synthesisOptions(cmd);
        Stopwatch sw = Stopwatch.createStarted();
        Circuit output = GreedyPauliOptimisation.optimise(input, options);
        sw.stop();
        System.out.println("c " + sw);
        printStats("input", input);
        printStats("output", output);
        if (!cmd.hasOption("quiet")) System.out.print(output);
    }
}
