package com.borrowfacts.loader.tabdelim;

import com.borrowfacts.core.AllFacts;
import com.borrowfacts.core.FactModel;
import com.borrowfacts.core.Relation;
import com.borrowfacts.loader.intern.InternerTables;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Writes a fact store back out in the layout {@link TabDelimitedLoader} reads, using the
 * tokens the atoms were interned from.
 */
public class TabDelimitedWriter {

    private final InternerTables tables;

    public TabDelimitedWriter(InternerTables tables) {
        this.tables = tables;
    }

    /**
     * Writes one {@code <relation>.facts} file per relation into {@code outputDir}
     * (created if absent), tuples in store order.
     */
    public void write(AllFacts facts, Path outputDir) {
        try {
            Files.createDirectories(outputDir);
        } catch (IOException e) {
            throw new FactsWriteException("Could not create output directory: " + outputDir, e);
        }
        for (Relation relation : Relation.values()) {
            writeRows(outputDir.resolve(relation.factsFileName()), rows(facts, relation));
        }
    }

    List<String[]> rows(AllFacts facts, Relation relation) {
        List<String[]> rows = new ArrayList<>();
        switch (relation) {
            case BORROW_REGION -> {
                for (FactModel.BorrowRegion f : facts.borrowRegions()) {
                    rows.add(new String[]{
                            tables.regions.untern(f.region()), tables.loans.untern(f.loan()), tables.points.untern(f.point())});
                }
            }
            case UNIVERSAL_REGION -> facts.universalRegions()
                    .forEach(r -> rows.add(new String[]{tables.regions.untern(r)}));
            case CFG_EDGE -> facts.cfgEdges()
                    .forEach(e -> rows.add(new String[]{tables.points.untern(e.from()), tables.points.untern(e.to())}));
            case KILLED -> facts.killed()
                    .forEach(k -> rows.add(new String[]{tables.loans.untern(k.loan()), tables.points.untern(k.point())}));
            case OUTLIVES -> {
                for (FactModel.Outlives o : facts.outlives()) {
                    rows.add(new String[]{
                            tables.regions.untern(o.longer()), tables.regions.untern(o.shorter()), tables.points.untern(o.point())});
                }
            }
            case REGION_LIVE_AT -> facts.regionLiveAt()
                    .forEach(r -> rows.add(new String[]{tables.regions.untern(r.region()), tables.points.untern(r.point())}));
            case INVALIDATES -> facts.invalidates()
                    .forEach(i -> rows.add(new String[]{tables.points.untern(i.point()), tables.loans.untern(i.loan())}));
        }
        return rows;
    }

    private void writeRows(Path file, List<String[]> rows) {
        try (BufferedWriter w = Files.newBufferedWriter(file, StandardCharsets.UTF_8)) {
            for (String[] row : rows) {
                w.write(String.join("\t", row));
                w.write('\n');
            }
        } catch (IOException e) {
            throw new FactsWriteException("Failed to write " + file + ": " + e.getMessage(), e);
        }
    }

    public static class FactsWriteException extends RuntimeException {
        public FactsWriteException(String msg, Throwable cause) { super(msg, cause); }
    }
}
