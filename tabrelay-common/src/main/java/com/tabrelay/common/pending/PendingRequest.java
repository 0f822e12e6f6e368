package com.tabrelay.common.pending;

import com.fasterxml.jackson.databind.JsonNode;
import com.tabrelay.common.error.RelayException;
import lombok.Getter;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ScheduledFuture;

/**
 * One in-flight correlated command. Resolves exactly once: with a value, an
 * error, or a timeout; whichever comes first wins and the others are no-ops.
 */
public final class PendingRequest {

    @Getter private final String correlationId;
    @Getter private final String description;
    private final CompletableFuture<JsonNode> result = new CompletableFuture<>();
    private volatile ScheduledFuture<?> cancelHandle;

    PendingRequest(String correlationId, String description) {
        this.correlationId = correlationId;
        this.description = description;
    }

    public CompletableFuture<JsonNode> future() {
        return result;
    }

    public boolean isDone() {
        return result.isDone();
    }

    void armTimeout(ScheduledFuture<?> handle) {
        this.cancelHandle = handle;
        // resolved while the timer was being scheduled
        if (result.isDone()) {
            handle.cancel(false);
        }
    }

    boolean succeed(JsonNode value) {
        disarm();
        return result.complete(value);
    }

    boolean fail(RelayException error) {
        disarm();
        return result.completeExceptionally(error);
    }

    private void disarm() {
        ScheduledFuture<?> handle = cancelHandle;
        if (handle != null) {
            handle.cancel(false);
        }
    }
}
