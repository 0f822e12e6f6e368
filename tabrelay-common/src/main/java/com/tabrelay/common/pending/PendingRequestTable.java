package com.tabrelay.common.pending;

import com.fasterxml.jackson.databind.JsonNode;
import com.tabrelay.common.error.CommandTimeoutException;
import com.tabrelay.common.error.RelayException;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * Correlation-id → {@link PendingRequest} map with per-entry deadlines.
 *
 * <p>Every entry leaves the map exactly once, through {@link #resolve}, {@link #reject},
 * its timeout, or {@link #failAll}. Removal is the atomic map removal, so a response
 * racing its own timeout is resolved by whichever removes the entry first and the
 * loser sees an absent id.</p>
 */
@Slf4j
public class PendingRequestTable {

    private final String owner;
    private final ScheduledExecutorService scheduler;
    private final ConcurrentMap<String, PendingRequest> pending = new ConcurrentHashMap<>();

    public PendingRequestTable(String owner, ScheduledExecutorService scheduler) {
        this.owner = owner;
        this.scheduler = scheduler;
    }

    /**
     * Register a new pending entry.
     *
     * @param correlationId id unique within this table
     * @param description   what is being waited for, used in the timeout message
     * @param timeoutMs     deadline relative to now
     * @throws RelayException if the id is already pending
     */
    public CompletableFuture<JsonNode> register(String correlationId, String description, long timeoutMs)
            throws RelayException {
        PendingRequest entry = new PendingRequest(correlationId, description);
        if (pending.putIfAbsent(correlationId, entry) != null) {
            throw new RelayException("Duplicate correlation id: " + correlationId);
        }
        try {
            entry.armTimeout(scheduler.schedule(() -> expire(entry, timeoutMs), timeoutMs, TimeUnit.MILLISECONDS));
        } catch (RejectedExecutionException e) {
            pending.remove(correlationId, entry);
            throw new RelayException(owner + " no longer accepts requests", e);
        }
        return entry.future();
    }

    /** @return false if no entry holds this id (already resolved, timed out, or never issued) */
    public boolean resolve(String correlationId, JsonNode value) {
        PendingRequest entry = pending.remove(correlationId);
        if (entry == null) return false;
        entry.succeed(value);
        return true;
    }

    /** @return false if no entry holds this id */
    public boolean reject(String correlationId, RelayException error) {
        PendingRequest entry = pending.remove(correlationId);
        if (entry == null) return false;
        entry.fail(error);
        return true;
    }

    /**
     * Fail every entry still pending.
     *
     * @return number of entries failed
     */
    public int failAll(Supplier<? extends RelayException> error) {
        List<String> ids = new ArrayList<>(pending.keySet());
        int failed = 0;
        for (String id : ids) {
            if (reject(id, error.get())) failed++;
        }
        return failed;
    }

    public boolean contains(String correlationId) {
        return pending.containsKey(correlationId);
    }

    public int size() {
        return pending.size();
    }

    public boolean isEmpty() {
        return pending.isEmpty();
    }

    private void expire(PendingRequest entry, long timeoutMs) {
        if (pending.remove(entry.getCorrelationId(), entry)) {
            log.debug("[{}] {} ({}) timed out after {}ms",
                    owner, entry.getDescription(), entry.getCorrelationId(), timeoutMs);
            entry.fail(new CommandTimeoutException(entry.getCorrelationId(), entry.getDescription(), timeoutMs));
        }
    }
}
