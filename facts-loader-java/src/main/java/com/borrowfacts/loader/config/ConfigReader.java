package com.borrowfacts.loader.config;

import com.google.gson.Gson;
import com.google.gson.JsonParseException;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

public class ConfigReader {

    /** Looked up in the facts directory when no --config flag is given. */
    public static final String DEFAULT_FILE_NAME = "borrowfacts.json";

    private static final Gson GSON = new Gson();

    /**
     * Reads and deserializes a config file.
     *
     * @throws ConfigReadException if the file is missing, empty or malformed
     */
    public SimplifyConfig read(Path configPath) {
        if (!Files.exists(configPath)) {
            throw new ConfigReadException("Config file not found: " + configPath);
        }
        try (Reader reader = Files.newBufferedReader(configPath, StandardCharsets.UTF_8)) {
            SimplifyConfig config = GSON.fromJson(reader, SimplifyConfig.class);
            if (config == null) {
                throw new ConfigReadException("Config file is empty or invalid JSON: " + configPath);
            }
            return config;
        } catch (JsonParseException e) {
            throw new ConfigReadException("Malformed config " + configPath + ": " + e.getMessage(), e);
        } catch (IOException e) {
            throw new ConfigReadException("Failed to read config: " + configPath + ": " + e.getMessage(), e);
        }
    }

    /**
     * Reads {@code borrowfacts.json} from {@code factsDir} if present, defaults otherwise.
     */
    public SimplifyConfig readOrDefaults(Path factsDir) {
        Path candidate = factsDir.resolve(DEFAULT_FILE_NAME);
        return Files.exists(candidate) ? read(candidate) : SimplifyConfig.defaults();
    }

    public static class ConfigReadException extends RuntimeException {
        public ConfigReadException(String message) { super(message); }
        public ConfigReadException(String message, Throwable cause) { super(message, cause); }
    }
}
