package com.causal.cfpg.io;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import lombok.extern.log4j.Log4j2;

/**
 * Reads {@link PathOptions} from JSON and checks their ranges.
 *
 * <p>
 * Unknown properties are ignored; missing ones keep their defaults.
 */
@Log4j2
public final class PathOptionsLoader {
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private PathOptionsLoader() {
        // Utility class
    }

    /** Parses a JSON string into validated PathOptions. */
    public static PathOptions fromJson(String json) {
        try {
            return validate(MAPPER.readValue(json, PathOptions.class));
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Invalid path options: " + e.getOriginalMessage(), e);
        }
    }

    /** Parses a JSON file into validated PathOptions. */
    public static PathOptions fromFile(Path path) throws IOException {
        log.debug("Loading path options from {}", path);
        return fromJson(Files.readString(path));
    }

    /** Parses a classpath resource into validated PathOptions. */
    public static PathOptions fromResource(String resource) throws IOException {
        try (InputStream in = PathOptionsLoader.class.getClassLoader().getResourceAsStream(resource)) {
            if (in == null)
                throw new IllegalArgumentException("Resource not found: " + resource);
            log.debug("Loading path options from classpath:{}", resource);
            return fromJson(new String(in.readAllBytes(), java.nio.charset.StandardCharsets.UTF_8));
        }
    }

    /** Serializes options back to JSON. */
    public static String toJson(PathOptions options) {
        try {
            return MAPPER.writeValueAsString(options);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize path options", e);
        }
    }

    /**
     * Checks option ranges.
     *
     * @return the same options, for chaining.
     * @throws IllegalArgumentException on an out-of-range value.
     */
    public static PathOptions validate(PathOptions options) {
        if (options.getMaxDepth() != null && options.getMaxDepth() < 1)
            throw new IllegalArgumentException("maxDepth must be at least 1, got " + options.getMaxDepth());
        if (options.getNumSamples() < 0)
            throw new IllegalArgumentException("numSamples must be >= 0, got " + options.getNumSamples());
        Integer tp = options.getTargetPolarity();
        if (tp != null && tp != 0 && tp != 1)
            throw new IllegalArgumentException("targetPolarity must be 0 or 1, got " + tp);
        return options;
    }
}
