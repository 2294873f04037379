package com.cfgsketch.engine.config;

import com.google.gson.Gson;
import com.google.gson.JsonParseException;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Loads the optional extractor config.json.
 *
 * Every key is optional: label_max_length (50), detail_max_length (30), indent_width (2),
 * resolve_calls (true), default_language ("javascript") and a layout block with
 * node_width, node_height, horizontal_gap, vertical_gap and disconnected_x
 * (200, 80, 100, 120, 600). Absent keys keep those defaults, so "{}" is a valid config.
 */
public class ConfigReader {

    private static final Gson GSON = new Gson();

    /**
     * @throws ConfigReadException if the file does not exist, holds no JSON object,
     *                             or a key has a value of the wrong type
     */
    public ExtractorConfig read(Path configPath) {
        if (!Files.isRegularFile(configPath)) {
            throw new ConfigReadException("Extractor config not found: " + configPath);
        }
        ExtractorConfig config;
        try (Reader reader = Files.newBufferedReader(configPath, StandardCharsets.UTF_8)) {
            config = GSON.fromJson(reader, ExtractorConfig.class);
        } catch (JsonParseException e) {
            throw new ConfigReadException("Extractor config " + configPath + " is not valid JSON: " + e.getMessage(), e);
        } catch (IOException e) {
            throw new ConfigReadException("Could not read extractor config " + configPath + ": " + e.getMessage(), e);
        }
        if (config == null) {
            throw new ConfigReadException("Extractor config " + configPath + " is empty; use {} for all defaults");
        }
        return config;
    }

    public static class ConfigReadException extends RuntimeException {
        public ConfigReadException(String message) { super(message); }
        public ConfigReadException(String message, Throwable cause) { super(message, cause); }
    }
}
