package com.borrowfacts.loader;

import com.borrowfacts.core.AllFacts;
import com.borrowfacts.core.CfgGraphAnalyzer;
import com.borrowfacts.core.SimplificationReport;
import com.borrowfacts.loader.config.ConfigReader;
import com.borrowfacts.loader.config.SimplifyConfig;
import com.borrowfacts.loader.intern.InternerTables;
import com.borrowfacts.loader.report.FactsReport;
import com.borrowfacts.loader.report.ReportSerializer;
import com.borrowfacts.loader.tabdelim.TabDelimitedLoader;
import com.borrowfacts.loader.tabdelim.TabDelimitedWriter;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Instant;
import java.util.Map;

/**
 * Command-line driver for the facts loader.
 *
 * Usage:
 *   java -jar facts-loader-java.jar simplify \
 *     --facts  <facts-dir> \
 *     --output <output-dir> \
 *     [--config <borrowfacts.json>]
 *
 *   java -jar facts-loader-java.jar stats --facts <facts-dir>
 */
public class LoaderMain {

    private static final String USAGE =
            "Usage: java -jar facts-loader-java.jar simplify --facts <dir> --output <dir> [--config <file>]\n"
          + "       java -jar facts-loader-java.jar stats --facts <dir>";

    public static void main(String[] args) {
        try {
            run(args);
            System.exit(0);
        } catch (UsageException e) {
            System.err.println("[borrowfacts] ERROR: " + e.getMessage());
            System.err.println(USAGE);
            System.exit(2);
        } catch (Exception e) {
            System.err.println("[borrowfacts] FATAL: " + e.getMessage());
            System.exit(1);
        }
    }

    static void run(String[] args) {
        if (args.length == 0) {
            throw new UsageException("No subcommand specified");
        }
        String command = args[0];
        if (!command.equals("simplify") && !command.equals("stats")) {
            throw new UsageException("Unknown subcommand: " + command);
        }

        String factsDir = null;
        String outputDir = null;
        String configFile = null;

        for (int i = 1; i < args.length; i++) {
            switch (args[i]) {
                case "--facts"  -> factsDir   = requireNext(args, i++, "--facts");
                case "--output" -> outputDir  = requireNext(args, i++, "--output");
                case "--config" -> configFile = requireNext(args, i++, "--config");
                default -> throw new UsageException("Unknown flag: " + args[i]);
            }
        }

        if (factsDir == null) throw new UsageException("--facts is required");
        if (command.equals("simplify") && outputDir == null) throw new UsageException("--output is required");

        Path facts = Paths.get(factsDir);
        if (command.equals("stats")) {
            stats(facts);
            return;
        }

        ConfigReader configReader = new ConfigReader();
        SimplifyConfig config = configFile != null
                ? configReader.read(Paths.get(configFile))
                : configReader.readOrDefaults(facts);
        simplify(facts, Paths.get(outputDir), config);
    }

    /**
     * Loads, simplifies and writes one facts directory.
     *
     * @return the report that was (or would have been) written
     */
    static FactsReport simplify(Path factsDir, Path outputDir, SimplifyConfig config) {
        // 1. Load
        System.err.println("[borrowfacts] Loading facts from: " + factsDir);
        InternerTables tables = new InternerTables();
        AllFacts facts = new TabDelimitedLoader(tables).load(factsDir);
        Map<String, Integer> before = facts.relationSizes();
        System.err.println("[borrowfacts] Loaded " + tables.points.size() + " points, "
                + tables.regions.size() + " regions, " + tables.loans.size() + " loans");

        // 2. Simplify
        SimplificationReport simplification = null;
        if (config.isSimplifyCfg()) {
            simplification = facts.simplifyCfg();
            System.err.println("[borrowfacts] Simplified cfg_edge: "
                    + simplification.edgesBefore + " -> " + simplification.edgesAfter + " edges ("
                    + simplification.chainCount + " chains, "
                    + simplification.collapsedEdges + " collapsed, "
                    + simplification.breakPoints + " break points)");
        } else {
            System.err.println("[borrowfacts] CFG simplification disabled by config");
        }

        // 3. Write facts
        if (config.isWriteFacts()) {
            new TabDelimitedWriter(tables).write(facts, outputDir);
            System.err.println("[borrowfacts] Facts written to: " + outputDir);
        }

        // 4. Write report
        FactsReport report = new FactsReport();
        report.factsDir = factsDir.toString();
        report.timestamp = Instant.now().toString();
        report.relationsBefore = before;
        report.relationsAfter = facts.relationSizes();
        report.simplification = simplification;
        if (config.isWriteReport()) {
            Path written = new ReportSerializer().write(report, outputDir, config.getReportFile());
            System.err.println("[borrowfacts] Report written: " + written);
        }

        System.err.println("[borrowfacts] Done.");
        return report;
    }

    /** Prints relation sizes and the chain count without changing anything. */
    static Map<String, Integer> stats(Path factsDir) {
        AllFacts facts = new TabDelimitedLoader(new InternerTables()).load(factsDir);
        Map<String, Integer> sizes = facts.relationSizes();
        sizes.forEach((name, size) -> System.err.println("[borrowfacts] " + name + ": " + size));
        int chains = new CfgGraphAnalyzer().isolatedChains(facts.cfgEdges()).size();
        System.err.println("[borrowfacts] isolated chains: " + chains);
        return sizes;
    }

    private static String requireNext(String[] args, int i, String flag) {
        if (i + 1 >= args.length) {
            throw new UsageException(flag + " requires an argument");
        }
        return args[i + 1];
    }

    static class UsageException extends RuntimeException {
        UsageException(String msg) { super(msg); }
    }
}
