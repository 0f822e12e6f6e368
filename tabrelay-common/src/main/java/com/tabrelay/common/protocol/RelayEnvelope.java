package com.tabrelay.common.protocol;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.tabrelay.common.error.ProtocolException;

import java.util.Optional;

/**
 * A single parsed wire frame: one JSON object discriminated by {@code type}.
 *
 * <p>{@code id} is present on correlated request/response pairs and absent on
 * fire-and-forget commands and broadcast events. The original object is kept
 * as-is so the relay can forward it verbatim.</p>
 */
public final class RelayEnvelope {

    private final ObjectNode payload;
    private final String raw;

    private RelayEnvelope(ObjectNode payload, String raw) {
        this.payload = payload;
        this.raw = raw;
    }

    /**
     * Parse a text frame.
     *
     * @throws ProtocolException if the frame is not a JSON object with a string {@code type}
     */
    public static RelayEnvelope parse(String text) throws ProtocolException {
        if (text == null || text.isBlank()) {
            throw new ProtocolException("Empty frame");
        }
        JsonNode node;
        try {
            node = RelayJson.mapper().readTree(text);
        } catch (Exception e) {
            throw new ProtocolException("Invalid JSON: " + e.getMessage(), e);
        }
        if (node == null || !node.isObject()) {
            throw new ProtocolException("Frame is not a JSON object");
        }
        JsonNode type = node.get("type");
        if (type == null || !type.isTextual() || type.asText().isEmpty()) {
            throw new ProtocolException("Frame has no type");
        }
        return new RelayEnvelope((ObjectNode) node, text);
    }

    public String type() {
        return payload.get("type").asText();
    }

    /** Correlation id, if this frame is part of a request/response pair. */
    public Optional<String> id() {
        JsonNode id = payload.get("id");
        if (id == null || id.isNull()) return Optional.empty();
        String value = id.asText("");
        return value.isEmpty() ? Optional.empty() : Optional.of(value);
    }

    public boolean isCorrelated() {
        return id().isPresent();
    }

    /** Tab id carried by the frame; numeric ids are normalized to their text form. */
    public Optional<String> tabId() {
        JsonNode tab = payload.get("tabId");
        if (tab == null || tab.isNull()) return Optional.empty();
        String value = tab.asText("");
        return value.isEmpty() ? Optional.empty() : Optional.of(value);
    }

    public boolean is(String type) {
        return type().equals(type);
    }

    public JsonNode get(String field) {
        return payload.get(field);
    }

    public String text(String field, String fallback) {
        JsonNode node = payload.get(field);
        return node != null && !node.isNull() ? node.asText(fallback) : fallback;
    }

    public boolean flag(String field) {
        JsonNode node = payload.get(field);
        return node != null && node.asBoolean(false);
    }

    public ObjectNode payload() {
        return payload;
    }

    /** The frame exactly as received. */
    public String raw() {
        return raw;
    }

    @Override
    public String toString() {
        return id().map(id -> type() + "#" + id).orElse(type());
    }
}
