package com.tabrelay.client.facade.direct;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import com.microsoft.playwright.PlaywrightException;
import com.tabrelay.common.error.RelayException;
import com.tabrelay.common.protocol.RelayJson;

import java.util.Locale;
import java.util.function.Supplier;

/**
 * Playwright call helpers: failure translation and Gson/Jackson conversion.
 */
final class PlaywrightCalls {

    private PlaywrightCalls() {
    }

    static <T> T call(String what, Supplier<T> action) throws RelayException {
        try {
            return action.get();
        } catch (PlaywrightException e) {
            throw new RelayException(what + " failed: " + e.getMessage(), e);
        }
    }

    static void run(String what, Runnable action) throws RelayException {
        call(what, () -> {
            action.run();
            return null;
        });
    }

    /**
     * Parse a lower-case option name ({@code "domcontentloaded"}) into a Playwright enum.
     */
    static <E extends Enum<E>> E option(Class<E> type, String value) throws RelayException {
        if (value == null) {
            throw new RelayException("Missing " + type.getSimpleName());
        }
        try {
            return Enum.valueOf(type, value.toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new RelayException("Unknown " + type.getSimpleName() + ": " + value, e);
        }
    }

    static JsonNode fromGson(JsonElement element) {
        if (element == null || element.isJsonNull()) return RelayJson.object();
        try {
            return RelayJson.mapper().readTree(element.toString());
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Gson produced invalid JSON", e);
        }
    }

    static JsonObject toGson(JsonNode node) {
        if (node == null || node.isNull()) return new JsonObject();
        return JsonParser.parseString(node.toString()).getAsJsonObject();
    }

    static JsonNode toTree(Object value) {
        return RelayJson.mapper().valueToTree(value);
    }
}
