package com.raditha.metaast.report;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Pretty-printed JSON rendering for reporters.
 */
final class JsonWriter {

    private static final ObjectMapper mapper = new ObjectMapper();

    private JsonWriter() {
    }

    static String write(Object value) {
        try {
            return mapper.writerWithDefaultPrettyPrinter().writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Could not render report as JSON", e);
        }
    }
}
