package com.tabrelay.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.tabrelay.client.transport.RelayTransport;
import com.tabrelay.common.config.ClientConfig;
import com.tabrelay.common.error.CommandFailedException;
import com.tabrelay.common.error.ConnectTimeoutException;
import com.tabrelay.common.error.ProtocolException;
import com.tabrelay.common.error.RelayErrors;
import com.tabrelay.common.error.RelayException;
import com.tabrelay.common.error.SessionClosedException;
import com.tabrelay.common.pending.PendingRequestTable;
import com.tabrelay.common.protocol.MessageTypes;
import com.tabrelay.common.protocol.RelayEnvelope;
import com.tabrelay.common.protocol.RelayJson;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Map;
import java.util.OptionalInt;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Consumer;

/**
 * Client side of a relay session: correlates commands with their responses and
 * dispatches CDP events to subscribers.
 *
 * <p>All inbound frames arrive on the transport's receive thread. Event callbacks run
 * on a separate per-router event thread, so a callback may issue commands of its own.
 * Events are delivered in arrival order, callbacks in registration order; a failing
 * callback is logged and skipped.</p>
 */
@Slf4j
public class ClientMessageRouter implements AutoCloseable {

    /** Timeout for listener registration round trips, which are never awaited. */
    private static final long LISTENER_REGISTRATION_TIMEOUT_MS = 5_000;

    private final RelayTransport transport;
    @Getter private final ClientConfig config;
    private final ScheduledExecutorService scheduler;
    private final ExecutorService eventExecutor;
    @Getter private final PendingRequestTable pending;
    private final CompletableFuture<JsonNode> welcome = new CompletableFuture<>();

    private final Map<String, List<Consumer<JsonNode>>> eventHandlers = new ConcurrentHashMap<>();
    private final Map<String, String> listenerIds = new ConcurrentHashMap<>();

    private volatile Integer tabId;
    private volatile boolean closed;

    public ClientMessageRouter(RelayTransport transport, ClientConfig config) {
        this.transport = transport;
        this.config = config;
        this.scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "relay-client-timeouts");
            t.setDaemon(true);
            return t;
        });
        this.eventExecutor = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "relay-client-events");
            t.setDaemon(true);
            return t;
        });
        this.pending = new PendingRequestTable("client " + transport.describe(), scheduler);
        transport.setListener(new RelayTransport.Listener() {
            @Override
            public void onFrame(String text) {
                handleFrame(text);
            }

            @Override
            public void onClosed(String reason) {
                handleClosed(reason);
            }
        });
    }

    // ==================== Receive loop ====================

    void handleFrame(String text) {
        RelayEnvelope msg;
        try {
            msg = RelayEnvelope.parse(text);
        } catch (ProtocolException e) {
            log.warn("Dropping malformed frame from relay: {}", e.getMessage());
            return;
        }

        if (!welcome.isDone()) {
            if (msg.is(MessageTypes.CONNECTED)) {
                welcome.complete(msg.payload());
                return;
            }
            welcome.completeExceptionally(new ProtocolException("Unexpected welcome message: " + msg.raw()));
        }

        switch (msg.type()) {
            case MessageTypes.RESPONSE -> handleResponse(msg);
            case MessageTypes.CDP_EVENT -> dispatchEvent(msg);
            case MessageTypes.EXTENSION_DISCONNECTED ->
                    log.warn("Relay reports extension disconnected: {}", msg.text("error", ""));
            case MessageTypes.ERROR -> log.warn("Relay error: {}", msg.text("error", "Unknown error"));
            case MessageTypes.DEBUGGER_DETACHED, MessageTypes.TAB_CLOSED ->
                    log.info("Relay notification {}: {}", msg.type(), msg.raw());
            default -> log.debug("Ignoring {} from relay", msg.type());
        }
    }

    private void handleResponse(RelayEnvelope msg) {
        String id = msg.id().orElse(null);
        if (id == null) {
            log.debug("Dropping uncorrelated RESPONSE");
            return;
        }
        boolean matched;
        if (msg.flag("success")) {
            JsonNode result = msg.get("result");
            matched = pending.resolve(id, result != null ? result : NullNode.getInstance());
        } else {
            matched = pending.reject(id, RelayErrors.fromResponse(id, msg.text("error", "Unknown error")));
        }
        if (!matched) {
            log.debug("Dropping response for unknown or expired id {}", id);
        }
    }

    private void dispatchEvent(RelayEnvelope msg) {
        String eventName = msg.text("method", null);
        if (eventName == null) return;
        List<Consumer<JsonNode>> handlers = eventHandlers.get(eventName);
        if (handlers == null || handlers.isEmpty()) return;

        JsonNode params = msg.get("params") != null ? msg.get("params") : RelayJson.object();
        List<Consumer<JsonNode>> snapshot = List.copyOf(handlers);
        try {
            eventExecutor.execute(() -> {
                for (Consumer<JsonNode> handler : snapshot) {
                    try {
                        handler.accept(params);
                    } catch (Exception e) {
                        log.error("Error in event handler for {}: {}", eventName, e.getMessage(), e);
                    }
                }
            });
        } catch (RejectedExecutionException e) {
            log.debug("Dropping {} event: router closed", eventName);
        }
    }

    private void handleClosed(String reason) {
        closed = true;
        welcome.completeExceptionally(new SessionClosedException("Relay connection " + reason));
        int failed = pending.failAll(() -> new SessionClosedException("Relay connection " + reason));
        if (failed > 0) {
            log.info("Relay connection {}; failed {} pending command(s)", reason, failed);
        }
        scheduler.shutdownNow();
        eventExecutor.shutdown();
    }

    // ==================== Welcome ====================

    /**
     * Wait for the relay's CONNECTED frame.
     *
     * @return the welcome payload
     */
    public JsonNode awaitWelcome(long timeoutMs) throws RelayException {
        try {
            return welcome.get(timeoutMs, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            throw new ConnectTimeoutException("No welcome from relay within " + timeoutMs + "ms");
        } catch (ExecutionException e) {
            throw RelayException.from(e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RelayException("Interrupted waiting for relay welcome");
        }
    }

    // ==================== Commands ====================

    /**
     * Send a correlated command and block until its response, using the configured timeout.
     */
    public JsonNode sendCommand(String type, ObjectNode params) throws RelayException {
        return sendCommand(type, params, config.getCommandTimeoutMs());
    }

    /**
     * Send a correlated command and block until its response or the timeout.
     *
     * @throws CommandFailedException the extension reported a failure
     * @throws com.tabrelay.common.error.CommandTimeoutException no response in time
     * @throws com.tabrelay.common.error.ExtensionUnavailableException the relay has no extension
     */
    public JsonNode sendCommand(String type, ObjectNode params, long timeoutMs) throws RelayException {
        CompletableFuture<JsonNode> future = sendCommandAsync(type, params, timeoutMs);
        try {
            return future.get();
        } catch (ExecutionException e) {
            throw RelayException.from(e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RelayException("Interrupted waiting for " + type);
        }
    }

    /**
     * Send a correlated command. The returned future completes exactly once: with the
     * result, the reported failure, a timeout or the session closing.
     */
    public CompletableFuture<JsonNode> sendCommandAsync(String type, ObjectNode params, long timeoutMs) {
        if (closed) {
            return CompletableFuture.failedFuture(new SessionClosedException("Relay connection closed"));
        }
        String id = UUID.randomUUID().toString();
        CompletableFuture<JsonNode> future;
        try {
            future = pending.register(id, "Command " + type, timeoutMs);
        } catch (RelayException e) {
            return CompletableFuture.failedFuture(e);
        }

        if (!transport.send(RelayJson.write(envelope(id, type, params)))) {
            pending.reject(id, new SessionClosedException("Relay connection closed"));
        }
        return future;
    }

    /**
     * Send an uncorrelated command; nothing is awaited.
     */
    public void sendFireAndForget(String type, ObjectNode params) throws RelayException {
        if (closed || !transport.send(RelayJson.write(envelope(null, type, params)))) {
            throw new SessionClosedException("Relay connection closed");
        }
    }

    private static ObjectNode envelope(String id, String type, ObjectNode params) {
        ObjectNode msg = RelayJson.object();
        if (id != null) msg.put("id", id);
        msg.put("type", type);
        if (params != null) {
            params.fields().forEachRemaining(field -> {
                if (!"id".equals(field.getKey()) && !"type".equals(field.getKey())) {
                    msg.set(field.getKey(), field.getValue());
                }
            });
        }
        return msg;
    }

    // ==================== Tab binding ====================

    /** Record the tab this session drives; listener registrations carry it. */
    public void bindTab(int tabId) {
        this.tabId = tabId;
    }

    public OptionalInt tabId() {
        Integer bound = tabId;
        return bound == null ? OptionalInt.empty() : OptionalInt.of(bound);
    }

    // ==================== Events ====================

    /**
     * Add a callback for a CDP event. The first callback for a name registers a listener
     * with the extension; that round trip is not awaited.
     */
    public void registerEventHandler(String eventName, Consumer<JsonNode> callback) {
        boolean[] first = {false};
        eventHandlers.compute(eventName, (name, handlers) -> {
            if (handlers == null) {
                handlers = new CopyOnWriteArrayList<>();
                first[0] = true;
            }
            handlers.add(callback);
            return handlers;
        });
        if (first[0]) {
            String listenerId = UUID.randomUUID().toString();
            listenerIds.put(eventName, listenerId);
            sendCommandAsync(MessageTypes.REGISTER_CDP_LISTENER, listenerFrame(eventName, listenerId),
                    LISTENER_REGISTRATION_TIMEOUT_MS)
                    .whenComplete((result, error) -> {
                        if (error != null) {
                            log.warn("Registering CDP listener {} failed: {}", eventName,
                                    RelayException.from(error).getMessage());
                        }
                    });
        }
    }

    /**
     * Remove one registration of {@code callback}. Removing the last callback for a name
     * unregisters the listener with the extension, fire-and-forget.
     *
     * @return true if the callback was registered
     */
    public boolean unregisterEventHandler(String eventName, Consumer<JsonNode> callback) {
        boolean[] removed = {false};
        boolean[] last = {false};
        eventHandlers.computeIfPresent(eventName, (name, handlers) -> {
            removed[0] = handlers.remove(callback);
            if (handlers.isEmpty()) {
                last[0] = true;
                return null;
            }
            return handlers;
        });
        if (last[0]) {
            String listenerId = listenerIds.remove(eventName);
            try {
                sendFireAndForget(MessageTypes.UNREGISTER_CDP_LISTENER, listenerFrame(eventName, listenerId));
            } catch (RelayException e) {
                log.debug("Could not unregister CDP listener {}: {}", eventName, e.getMessage());
            }
        }
        return removed[0];
    }

    /**
     * Subscribe to a CDP event through a bounded queue of the configured capacity.
     */
    public EventSubscription subscribe(String eventName) {
        return subscribe(eventName, config.getEventQueueCapacity());
    }

    public EventSubscription subscribe(String eventName, int capacity) {
        EventSubscription subscription = new EventSubscription(eventName, capacity,
                s -> unregisterEventHandler(s.getEventName(), s.sink()));
        registerEventHandler(eventName, subscription.sink());
        return subscription;
    }

    public int handlerCount(String eventName) {
        List<Consumer<JsonNode>> handlers = eventHandlers.get(eventName);
        return handlers == null ? 0 : handlers.size();
    }

    private ObjectNode listenerFrame(String eventName, String listenerId) {
        ObjectNode params = RelayJson.object();
        Integer bound = tabId;
        if (bound != null) params.put("tabId", bound);
        params.put("eventName", eventName);
        if (listenerId != null) params.put("listenerId", listenerId);
        return params;
    }

    // ==================== Lifecycle ====================

    public boolean isOpen() {
        return !closed && transport.isOpen();
    }

    /**
     * Close the transport; every pending command fails with {@link SessionClosedException}.
     */
    @Override
    public void close() {
        if (closed) return;
        transport.close();
        handleClosed("closed");
    }
}
