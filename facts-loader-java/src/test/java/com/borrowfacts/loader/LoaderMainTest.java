package com.borrowfacts.loader;

import com.borrowfacts.loader.config.SimplifyConfig;
import com.borrowfacts.loader.report.FactsReport;
import com.google.gson.Gson;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class LoaderMainTest {

    private Path loopFixture() throws Exception {
        return Path.of(getClass().getResource("/fixtures/loop").toURI());
    }

    @Test
    void noArgsThrowsUsageException() {
        assertThrows(LoaderMain.UsageException.class, () -> LoaderMain.run(new String[]{}));
    }

    @Test
    void unknownSubcommandThrowsUsageException() {
        assertThrows(LoaderMain.UsageException.class, () -> LoaderMain.run(new String[]{"solve"}));
    }

    @Test
    void missingFactsFlagThrowsUsageException() {
        assertThrows(LoaderMain.UsageException.class,
                () -> LoaderMain.run(new String[]{"simplify", "--output", "/tmp/out"}));
    }

    @Test
    void missingOutputFlagThrowsUsageException() {
        assertThrows(LoaderMain.UsageException.class,
                () -> LoaderMain.run(new String[]{"simplify", "--facts", "/tmp/facts"}));
    }

    @Test
    void flagWithoutValueThrowsUsageException() {
        assertThrows(LoaderMain.UsageException.class,
                () -> LoaderMain.run(new String[]{"stats", "--facts"}));
    }

    @Test
    void unknownFlagThrowsUsageException() {
        assertThrows(LoaderMain.UsageException.class,
                () -> LoaderMain.run(new String[]{"simplify", "--foo", "bar"}));
    }

    @Test
    void simplifyWritesReducedFactsAndReport(@TempDir Path tmp) throws Exception {
        LoaderMain.run(new String[]{"simplify", "--facts", loopFixture().toString(), "--output", tmp.toString()});

        List<String> edges = Files.readAllLines(tmp.resolve("cfg_edge.facts"));
        assertEquals(List.of(
                "Mid(bb0)\tMid(bb4)",
                "Mid(bb4)\tMid(bb9)",
                "Mid(bb0)\tMid(bb10)",
                "Mid(bb10)\tMid(bb9)"), edges);

        // bb1 was merged away together with its borrow
        assertEquals(List.of("r1\tL0\tMid(bb0)"), Files.readAllLines(tmp.resolve("borrow_region.facts")));
        assertEquals(List.of("r0"), Files.readAllLines(tmp.resolve("universal_region.facts")));
        assertEquals(4, Files.readAllLines(tmp.resolve("region_live_at.facts")).size());

        FactsReport report = new Gson().fromJson(
                Files.readString(tmp.resolve("simplify_report.json")), FactsReport.class);
        assertEquals(12, report.simplification.edgesBefore);
        assertEquals(4, report.simplification.edgesAfter);
        assertEquals(4, report.simplification.chainCount);
        assertEquals(8, report.simplification.collapsedEdges);
        assertEquals(12, report.relationsBefore.get("cfg_edge"));
        assertEquals(4, report.relationsAfter.get("cfg_edge"));
    }

    @Test
    void disabledSimplificationCopiesFacts(@TempDir Path tmp) throws Exception {
        Path config = tmp.resolve("cfg.json");
        Files.writeString(config, """
            { "simplify_cfg": false, "report_file": "report.json" }
            """);
        Path out = tmp.resolve("out");

        LoaderMain.run(new String[]{"simplify", "--facts", loopFixture().toString(),
                "--output", out.toString(), "--config", config.toString()});

        assertEquals(12, Files.readAllLines(out.resolve("cfg_edge.facts")).size());
        FactsReport report = new Gson().fromJson(Files.readString(out.resolve("report.json")), FactsReport.class);
        assertNull(report.simplification);
    }

    @Test
    void reportOnlyRunWritesNoFacts(@TempDir Path tmp) throws Exception {
        SimplifyConfig config = new Gson().fromJson("{\"write_facts\": false}", SimplifyConfig.class);

        FactsReport report = LoaderMain.simplify(loopFixture(), tmp, config);

        assertFalse(Files.exists(tmp.resolve("cfg_edge.facts")));
        assertTrue(Files.exists(tmp.resolve("simplify_report.json")));
        assertEquals(4, report.relationsAfter.get("cfg_edge"));
    }

    @Test
    void statsDoesNotWriteAnything() throws Exception {
        Map<String, Integer> sizes = LoaderMain.stats(loopFixture());
        assertEquals(12, sizes.get("cfg_edge"));
        assertEquals(12, sizes.get("region_live_at"));
        assertEquals(2, sizes.get("borrow_region"));
    }
}
