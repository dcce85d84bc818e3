package com.borrowfacts.loader.report;

import com.google.gson.GsonBuilder;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Serializes a {@link FactsReport} as pretty-printed JSON.
 */
public class ReportSerializer {

    public static class SerializerException extends RuntimeException {
        public SerializerException(String msg, Throwable cause) { super(msg, cause); }
    }

    /**
     * Writes {@code report} to {@code outputDir/fileName}.
     *
     * @param report    report to write
     * @param outputDir directory to write into (created if absent)
     * @param fileName  report file name
     * @return path of the written file
     */
    public Path write(FactsReport report, Path outputDir, String fileName) {
        try {
            Files.createDirectories(outputDir);
        } catch (IOException e) {
            throw new SerializerException("Could not create output directory: " + outputDir, e);
        }

        var gson = new GsonBuilder().setPrettyPrinting().create();

        Path reportPath = outputDir.resolve(fileName);
        try (Writer w = Files.newBufferedWriter(reportPath, StandardCharsets.UTF_8)) {
            gson.toJson(report, w);
        } catch (IOException e) {
            throw new SerializerException("Failed to write " + fileName + ": " + e.getMessage(), e);
        }
        return reportPath;
    }
}
