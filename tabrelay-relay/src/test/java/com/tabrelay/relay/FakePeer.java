package com.tabrelay.relay;

import com.fasterxml.jackson.databind.JsonNode;
import com.tabrelay.common.protocol.RelayJson;
import com.tabrelay.relay.session.RelayPeer;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Predicate;

/**
 * In-memory peer that records every frame sent to it.
 */
class FakePeer implements RelayPeer {

    private final String name;
    private final List<String> sent = new CopyOnWriteArrayList<>();
    private volatile boolean open = true;

    FakePeer(String name) {
        this.name = name;
    }

    @Override
    public String describe() {
        return name;
    }

    @Override
    public boolean isOpen() {
        return open;
    }

    @Override
    public boolean send(String text) {
        if (!open) return false;
        sent.add(text);
        return true;
    }

    @Override
    public void close() {
        open = false;
    }

    List<String> sent() {
        return sent;
    }

    List<JsonNode> frames() {
        return sent.stream().map(FakePeer::parse).toList();
    }

    List<JsonNode> framesOfType(String type) {
        return frames().stream().filter(f -> type.equals(f.path("type").asText())).toList();
    }

    /** Wait up to {@code timeoutMs} for a frame matching {@code predicate}. */
    JsonNode await(Predicate<JsonNode> predicate, long timeoutMs) throws InterruptedException {
        long deadline = System.currentTimeMillis() + timeoutMs;
        while (System.currentTimeMillis() < deadline) {
            for (JsonNode frame : frames()) {
                if (predicate.test(frame)) return frame;
            }
            Thread.sleep(10);
        }
        throw new AssertionError("No matching frame on " + name + " within " + timeoutMs + "ms; got " + sent);
    }

    JsonNode awaitResponse(String id, long timeoutMs) throws InterruptedException {
        return await(f -> "RESPONSE".equals(f.path("type").asText()) && id.equals(f.path("id").asText()), timeoutMs);
    }

    private static JsonNode parse(String text) {
        try {
            return RelayJson.mapper().readTree(text);
        } catch (Exception e) {
            throw new IllegalStateException(e);
        }
    }
}
