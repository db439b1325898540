package com.spectral.rtm.io;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Reads forward model and LUT configuration from JSON.
 */
public final class ForwardModelParser {
    private static final ObjectMapper MAPPER = new ObjectMapper()
            .configure(DeserializationFeature.ACCEPT_SINGLE_VALUE_AS_ARRAY, true);

    private ForwardModelParser() {
        // Utility class
    }

    /** Parses a JSON file into a ForwardModelDefinition. */
    public static ForwardModelDefinition parseFile(Path path) throws IOException {
        return parse(Files.readString(path));
    }

    /** Parses a JSON string into a ForwardModelDefinition. */
    public static ForwardModelDefinition parse(String json) {
        ForwardModelDefinition def = read(json, ForwardModelDefinition.class);
        if (def.getRadiativeTransfer() == null)
            throw new IllegalArgumentException("Missing 'radiative_transfer' key");
        return def;
    }

    /** Binds a JSON document to the given configuration type. */
    public static <T> T read(String json, Class<T> type) {
        try {
            return MAPPER.readValue(json, type);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Malformed " + type.getSimpleName() + " JSON: "
                    + e.getOriginalMessage(), e);
        }
    }
}
