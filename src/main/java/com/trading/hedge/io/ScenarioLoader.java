package com.trading.hedge.io;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reads {@link ScenarioDefinition}s from JSON with Jackson.
 */
public final class ScenarioLoader {
    static final ObjectMapper MAPPER = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);

    private ScenarioLoader() {
        // Utility class
    }

    /** Parses a JSON file into a ScenarioDefinition. */
    public static ScenarioDefinition parseFile(Path path) throws IOException {
        return parse(Files.readString(path));
    }

    /** Parses a classpath resource, e.g. {@code scenarios/covid_short_straddle.json}. */
    public static ScenarioDefinition parseResource(String resource) throws IOException {
        try (InputStream in = ScenarioLoader.class.getClassLoader().getResourceAsStream(resource)) {
            if (in == null)
                throw new IOException("Scenario resource not found on classpath: " + resource);
            return validate(MAPPER.readValue(in, ScenarioDefinition.class));
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Malformed scenario JSON in " + resource + ": " + e.getOriginalMessage(), e);
        }
    }

    /** Parses a JSON string into a ScenarioDefinition. */
    public static ScenarioDefinition parse(String json) {
        try {
            return validate(MAPPER.readValue(json, ScenarioDefinition.class));
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Malformed scenario JSON: " + e.getOriginalMessage(), e);
        }
    }

    private static ScenarioDefinition validate(ScenarioDefinition def) {
        if (def == null || def.getScenario() == null)
            throw new IllegalArgumentException("Missing 'scenario' key");
        return def;
    }
}
