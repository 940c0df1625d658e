package com.parametric.formula.io;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Reads parameter set documents.
 *
 * <p>
 * Expects a top-level {@code "parameterSet"} object:
 *
 * <pre>
 * { "parameterSet": {
 *     "name": "Door",
 *     "dialect": { "reservedFunctions": ["clamp"], "extendDefaults": true },
 *     "parameters": [
 *       { "id": 1, "name": "Width", "dataType": "length", "formula": "Height * 2" }
 *     ] } }
 * </pre>
 */
public final class JsonParameterParser {
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private JsonParameterParser() {
        // Utility class
    }

    /** Parses a JSON file into a ParameterSetDefinition. */
    public static ParameterSetDefinition parseFile(Path path) throws IOException {
        return parse(Files.readString(path));
    }

    /** Parses a classpath resource into a ParameterSetDefinition. */
    public static ParameterSetDefinition parseResource(String resource) {
        try (InputStream in = JsonParameterParser.class.getClassLoader().getResourceAsStream(resource)) {
            if (in == null)
                throw new IllegalArgumentException("Resource not found: " + resource);
            return validate(MAPPER.readValue(in, ParameterSetDefinition.class));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + resource, e);
        }
    }

    /** Parses a JSON string into a ParameterSetDefinition. */
    public static ParameterSetDefinition parse(String json) {
        try {
            return validate(MAPPER.readValue(json, ParameterSetDefinition.class));
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Malformed parameter set JSON: " + e.getOriginalMessage(), e);
        }
    }

    private static ParameterSetDefinition validate(ParameterSetDefinition def) {
        if (def == null || def.getParameterSet() == null)
            throw new IllegalArgumentException("Missing 'parameterSet' key");
        return def;
    }
}
