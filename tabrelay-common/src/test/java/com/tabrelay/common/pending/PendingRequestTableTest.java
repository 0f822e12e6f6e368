package com.tabrelay.common.pending;

import com.fasterxml.jackson.databind.JsonNode;
import com.tabrelay.common.error.CommandTimeoutException;
import com.tabrelay.common.error.RelayException;
import com.tabrelay.common.error.SessionClosedException;
import com.tabrelay.common.protocol.RelayJson;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for PendingRequestTable: resolution, timeout, and exactly-once removal.
 */
class PendingRequestTableTest {

    private ScheduledExecutorService scheduler;
    private PendingRequestTable table;

    @BeforeEach
    void setUp() {
        scheduler = Executors.newSingleThreadScheduledExecutor();
        table = new PendingRequestTable("test", scheduler);
    }

    @AfterEach
    void tearDown() {
        scheduler.shutdownNow();
    }

    @Test
    void resolve_completesWithValue_andRemovesEntry() throws Exception {
        CompletableFuture<JsonNode> future = table.register("r1", "NAVIGATE", 5_000);
        JsonNode value = RelayJson.object().put("ok", true);

        assertTrue(table.resolve("r1", value));

        assertEquals(value, future.get(1, TimeUnit.SECONDS));
        assertFalse(table.contains("r1"));
        assertTrue(table.isEmpty());
    }

    @Test
    void reject_completesExceptionally() throws Exception {
        CompletableFuture<JsonNode> future = table.register("r2", "EVALUATE", 5_000);

        assertTrue(table.reject("r2", new RelayException("boom")));

        ExecutionException e = assertThrows(ExecutionException.class, () -> future.get(1, TimeUnit.SECONDS));
        assertEquals("boom", e.getCause().getMessage());
    }

    @Test
    void unknownId_isNoOp_andDoesNotPerturbOthers() throws Exception {
        CompletableFuture<JsonNode> future = table.register("r1", "EVALUATE", 5_000);

        assertFalse(table.resolve("never-issued", RelayJson.object()));
        assertFalse(table.reject("never-issued", new RelayException("x")));

        assertFalse(future.isDone());
        assertEquals(1, table.size());
    }

    @Test
    void timeout_removesEntry_andLateResponseIsDropped() throws Exception {
        CompletableFuture<JsonNode> future = table.register("slow", "GET_TAB_INFO", 50);

        ExecutionException e = assertThrows(ExecutionException.class, () -> future.get(2, TimeUnit.SECONDS));
        assertInstanceOf(CommandTimeoutException.class, e.getCause());
        assertEquals("slow", ((CommandTimeoutException) e.getCause()).getCorrelationId());
        assertFalse(table.contains("slow"));

        assertFalse(table.resolve("slow", RelayJson.object()));
        assertTrue(future.isCompletedExceptionally());
    }

    @Test
    void duplicateLiveId_isRejected() throws Exception {
        table.register("dup", "A", 5_000);
        assertThrows(RelayException.class, () -> table.register("dup", "B", 5_000));
        assertEquals(1, table.size());
    }

    @Test
    void failAll_failsEveryEntry() throws Exception {
        CompletableFuture<JsonNode> a = table.register("a", "A", 5_000);
        CompletableFuture<JsonNode> b = table.register("b", "B", 5_000);

        int failed = table.failAll(() -> new SessionClosedException("Session closed"));

        assertEquals(2, failed);
        assertTrue(table.isEmpty());
        for (CompletableFuture<JsonNode> f : new CompletableFuture[]{a, b}) {
            ExecutionException e = assertThrows(ExecutionException.class, () -> f.get(1, TimeUnit.SECONDS));
            assertInstanceOf(SessionClosedException.class, e.getCause());
        }
    }

    @Test
    void resolvedEntry_doesNotTimeOutLater() throws Exception {
        CompletableFuture<JsonNode> future = table.register("fast", "A", 50);
        table.resolve("fast", RelayJson.object().put("v", 1));

        Thread.sleep(150);

        assertEquals(1, future.get().get("v").asInt());
        assertFalse(future.isCompletedExceptionally());
    }
}
