package com.gridcalc.io;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reads {@link SheetConfig} files with Jackson.
 */
public final class SheetConfigLoader {
    private static final Logger log = LogManager.getLogger(SheetConfigLoader.class);

    public static final String DEFAULT_RESOURCE = "gridcalc.json";

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .enable(DeserializationFeature.FAIL_ON_NULL_FOR_PRIMITIVES);

    private SheetConfigLoader() {
        // Utility class
    }

    /** Parses and validates a JSON file. */
    public static SheetConfig load(Path path) throws IOException {
        try (InputStream in = Files.newInputStream(path)) {
            SheetConfig config = MAPPER.readValue(in, SheetConfig.class).validate();
            log.info("Loaded sheet config from {}: {}x{} storage={} sleep={}", path, config.getRows(),
                    config.getCols(), config.getStorage(), config.getSleep());
            return config;
        }
    }

    /** Parses and validates a JSON string. */
    public static SheetConfig parse(String json) {
        try {
            return MAPPER.readValue(json, SheetConfig.class).validate();
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Malformed sheet config: " + e.getOriginalMessage(), e);
        }
    }

    /**
     * Loads a classpath resource.
     *
     * @throws UncheckedIOException if the resource is missing or unreadable.
     */
    public static SheetConfig loadResource(String name) {
        ClassLoader cl = SheetConfigLoader.class.getClassLoader();
        try (InputStream in = cl.getResourceAsStream(name)) {
            if (in == null)
                throw new UncheckedIOException(new IOException("Config resource not found: " + name));
            return MAPPER.readValue(in, SheetConfig.class).validate();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to load sheet config resource " + name, e);
        }
    }

    public static SheetConfig loadDefault() {
        return loadResource(DEFAULT_RESOURCE);
    }
}
