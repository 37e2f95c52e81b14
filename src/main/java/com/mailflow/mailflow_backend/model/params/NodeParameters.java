package com.mailflow.mailflow_backend.model.params;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.List;
import java.util.Map;

/**
 * Typed view of a node's parameter map. Each node kind has one implementation.
 */
public interface NodeParameters {

    ObjectMapper MAPPER = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    /** Shape problems, empty when the parameters are usable. */
    default List<String> validate() {
        return List.of();
    }

    /**
     * Reads a raw parameter map into its typed record.
     *
     * @throws IllegalArgumentException when a value has the wrong JSON type
     */
    static <T extends NodeParameters> T read(Class<T> type, Map<String, Object> raw) {
        return MAPPER.convertValue(raw != null ? raw : Map.of(), type);
    }

    static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
