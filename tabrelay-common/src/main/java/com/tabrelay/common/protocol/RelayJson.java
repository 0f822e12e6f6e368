package com.tabrelay.common.protocol;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Shared Jackson mapper for wire frames.
 */
public final class RelayJson {

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
            .setSerializationInclusion(JsonInclude.Include.NON_NULL);

    private RelayJson() {
    }

    public static ObjectMapper mapper() {
        return MAPPER;
    }

    public static ObjectNode object() {
        return MAPPER.createObjectNode();
    }

    /**
     * Serialize a frame. Frames are built from Jackson trees and Lombok DTOs, so a
     * failure here is a programming error.
     */
    public static String write(Object frame) {
        try {
            return MAPPER.writeValueAsString(frame);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Unserializable frame: " + e.getOriginalMessage(), e);
        }
    }

    /** Quote a string as a JSON (and therefore JavaScript) string literal. */
    public static String quote(String value) {
        return write(value == null ? "" : value);
    }
}
