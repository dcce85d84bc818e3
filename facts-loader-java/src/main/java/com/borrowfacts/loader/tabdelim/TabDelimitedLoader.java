package com.borrowfacts.loader.tabdelim;

import com.borrowfacts.core.AllFacts;
import com.borrowfacts.core.Relation;
import com.borrowfacts.loader.intern.InternerTables;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads a facts directory: one {@code <relation>.facts} file per relation, one tuple per line,
 * columns separated by a single TAB.
 *
 * Any malformed line aborts the whole load. A fact that is silently dropped changes the
 * analysis result, so there is no per-line recovery.
 */
public class TabDelimitedLoader {

    private final InternerTables tables;

    public TabDelimitedLoader(InternerTables tables) {
        this.tables = tables;
    }

    /**
     * Loads all seven relations from {@code factsDir}.
     *
     * @throws FactsLoadException if a relation file is missing, unreadable or malformed
     */
    public AllFacts load(Path factsDir) {
        AllFacts facts = new AllFacts();
        for (Relation relation : Relation.values()) {
            Path file = factsDir.resolve(relation.factsFileName());
            for (String[] row : readRows(file, relation.arity())) {
                add(facts, relation, row);
            }
        }
        return facts;
    }

    private void add(AllFacts facts, Relation relation, String[] row) {
        switch (relation) {
            case BORROW_REGION -> facts.addBorrowRegion(
                    tables.regions.intern(row[0]), tables.loans.intern(row[1]), tables.points.intern(row[2]));
            case UNIVERSAL_REGION -> facts.addUniversalRegion(tables.regions.intern(row[0]));
            case CFG_EDGE -> facts.addCfgEdge(tables.points.intern(row[0]), tables.points.intern(row[1]));
            case KILLED -> facts.addKilled(tables.loans.intern(row[0]), tables.points.intern(row[1]));
            case OUTLIVES -> facts.addOutlives(
                    tables.regions.intern(row[0]), tables.regions.intern(row[1]), tables.points.intern(row[2]));
            case REGION_LIVE_AT -> facts.addRegionLiveAt(tables.regions.intern(row[0]), tables.points.intern(row[1]));
            case INVALIDATES -> facts.addInvalidates(tables.points.intern(row[0]), tables.loans.intern(row[1]));
        }
    }

    /**
     * Splits every line of {@code file} into exactly {@code arity} non-empty columns.
     */
    static List<String[]> readRows(Path file, int arity) {
        List<String[]> rows = new ArrayList<>();
        try (BufferedReader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            String line;
            int lineNumber = 0;
            while ((line = reader.readLine()) != null) {
                lineNumber++;
                String[] columns = line.split("\t", -1);
                if (columns.length < arity || hasEmptyColumn(columns, arity)) {
                    throw new FactsLoadException("error parsing line " + lineNumber + " of `" + file + "`");
                }
                if (columns.length > arity) {
                    throw new FactsLoadException("extra data on line " + lineNumber + " of `" + file + "`");
                }
                rows.add(columns);
            }
        } catch (NoSuchFileException e) {
            throw new FactsLoadException("Facts file not found: " + file, e);
        } catch (IOException e) {
            throw new FactsLoadException("Failed to read facts file: " + file + ": " + e.getMessage(), e);
        }
        return rows;
    }

    private static boolean hasEmptyColumn(String[] columns, int arity) {
        for (int i = 0; i < arity; i++) {
            if (columns[i].isEmpty()) return true;
        }
        return false;
    }

    public static class FactsLoadException extends RuntimeException {
        public FactsLoadException(String message) { super(message); }
        public FactsLoadException(String message, Throwable cause) { super(message, cause); }
    }
}
