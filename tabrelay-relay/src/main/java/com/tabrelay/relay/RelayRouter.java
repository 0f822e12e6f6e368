package com.tabrelay.relay;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.NullNode;
import com.tabrelay.common.config.RelayConfig;
import com.tabrelay.common.error.CommandFailedException;
import com.tabrelay.common.error.ExtensionUnavailableException;
import com.tabrelay.common.error.ProtocolException;
import com.tabrelay.common.error.RelayException;
import com.tabrelay.common.error.SessionClosedException;
import com.tabrelay.common.protocol.MessageTypes;
import com.tabrelay.common.protocol.RelayEnvelope;
import com.tabrelay.common.protocol.RelayJson;
import com.tabrelay.common.protocol.RelayProtocolTypes.ConnectedMessage;
import com.tabrelay.common.protocol.RelayProtocolTypes.ErrorMessage;
import com.tabrelay.common.protocol.RelayProtocolTypes.ExtensionDisconnectedMessage;
import com.tabrelay.common.protocol.RelayProtocolTypes.PongMessage;
import com.tabrelay.common.protocol.RelayProtocolTypes.ResponseMessage;
import com.tabrelay.relay.session.ClientSession;
import com.tabrelay.relay.session.ExtensionConnection;
import com.tabrelay.relay.session.RelayConnection;
import com.tabrelay.relay.session.RelayPeer;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ScheduledExecutorService;

/**
 * Brokers frames between the extension agent and client sessions.
 *
 * <p>Owns the session table and the (at most one) active extension connection:
 * <ul>
 *   <li>classifies a new socket from its first frame</li>
 *   <li>forwards client commands and routes RESPONSE frames back by correlation id</li>
 *   <li>fans CDP events out by tab affiliation and broadcasts notifications</li>
 *   <li>fails pending requests when either side disconnects</li>
 * </ul>
 *
 * <p>Every correlated client command receives exactly one RESPONSE frame.</p>
 */
@Slf4j
public class RelayRouter {

    private final RelayConfig config;
    private final ScheduledExecutorService scheduler;
    private final ConcurrentMap<String, ClientSession> sessions = new ConcurrentHashMap<>();
    private volatile ExtensionConnection extension;

    public RelayRouter(RelayConfig config, ScheduledExecutorService scheduler) {
        this.config = config;
        this.scheduler = scheduler;
    }

    // ==================== Classification ====================

    /**
     * Classify a socket from its first frame. {@code EXTENSION_READY} makes it the
     * extension connection; anything else opens a client session, and that frame is
     * then handled as the session's first command.
     */
    public RelayConnection accept(RelayPeer peer, RelayEnvelope first) {
        if (first.is(MessageTypes.EXTENSION_READY)) {
            return attachExtension(peer);
        }
        ClientSession session = openSession(peer);
        handleClientEnvelope(session, first);
        return session;
    }

    private ExtensionConnection attachExtension(RelayPeer peer) {
        ExtensionConnection connection = new ExtensionConnection(this, peer);
        ExtensionConnection previous = extension;
        if (previous != null && previous.isOpen()) {
            // last writer wins; the stale socket stays open so its in-flight responses still route
            log.warn("Replacing active extension connection {} with {}", previous, connection);
        }
        extension = connection;
        log.info("Chrome extension connected: {}", connection);
        return connection;
    }

    private ClientSession openSession(RelayPeer peer) {
        String sessionId = UUID.randomUUID().toString();
        ClientSession session = new ClientSession(this, peer, sessionId, scheduler);
        sessions.put(sessionId, session);
        log.info("Client connected: {} ({})", sessionId, peer.describe());

        session.send(ConnectedMessage.builder()
                .sessionId(sessionId)
                .extensionConnected(isExtensionConnected())
                .build());
        return session;
    }

    // ==================== Extension side ====================

    public void handleExtensionFrame(ExtensionConnection source, String text) {
        RelayEnvelope msg;
        try {
            msg = RelayEnvelope.parse(text);
        } catch (ProtocolException e) {
            log.error("Invalid frame from extension: {}", e.getMessage());
            return;
        }

        try {
            switch (msg.type()) {
                case MessageTypes.EXTENSION_READY -> log.info("Extension ready");
                case MessageTypes.PING -> source.send(RelayJson.write(new PongMessage()));
                case MessageTypes.RESPONSE -> {
                    Optional<String> id = msg.id();
                    if (id.isPresent()) {
                        routeResponse(id.get(), msg);
                    } else {
                        log.debug("Dropping uncorrelated RESPONSE from extension");
                    }
                }
                case MessageTypes.CDP_EVENT -> forwardCdpEvent(msg);
                case MessageTypes.DEBUGGER_DETACHED, MessageTypes.TAB_CLOSED -> notifySessions(msg);
                default -> log.debug("Ignoring {} from extension", msg.type());
            }
        } catch (Exception e) {
            log.error("Error handling extension message {}: {}", msg, e.getMessage(), e);
        }
    }

    public void handleExtensionClosed(ExtensionConnection source) {
        if (extension != source) {
            log.info("Stale extension connection closed: {}", source);
            return;
        }
        extension = null;
        log.info("Chrome extension disconnected");

        int failed = 0;
        for (ClientSession session : sessions.values()) {
            failed += session.getPending().failAll(ExtensionUnavailableException::disconnected);
        }
        if (failed > 0) {
            log.info("Failed {} pending request(s) after extension disconnect", failed);
        }

        notifySessions(ExtensionDisconnectedMessage.builder()
                .error(ExtensionUnavailableException.DISCONNECTED)
                .build());
    }

    /**
     * Resolve the pending request holding {@code id}, in whichever session owns it.
     *
     * @return false if no session holds that id (the response is dropped)
     */
    public boolean routeResponse(String id, RelayEnvelope response) {
        boolean success = response.flag("success");
        for (ClientSession session : sessions.values()) {
            boolean resolved = success
                    ? session.getPending().resolve(id, resultOf(response))
                    : session.getPending().reject(id,
                    new CommandFailedException(id, response.text("error", "Unknown error")));
            if (resolved) {
                return true;
            }
        }
        log.warn("No pending request found for ID: {}", id);
        return false;
    }

    /**
     * Deliver a CDP event to sessions bound to its tab and to unbound sessions.
     */
    public int forwardCdpEvent(RelayEnvelope event) {
        String tabId = event.tabId().orElse(null);
        int delivered = 0;
        for (ClientSession session : sessions.values()) {
            if (!session.accepts(tabId)) continue;
            try {
                if (session.send(event.raw())) delivered++;
            } catch (Exception e) {
                log.error("Error forwarding CDP event to session {}: {}", session.getSessionId(), e.getMessage());
            }
        }
        return delivered;
    }

    /** Best-effort broadcast to every session. */
    public void notifySessions(Object notification) {
        String text = notification instanceof RelayEnvelope env ? env.raw() : RelayJson.write(notification);
        for (ClientSession session : sessions.values()) {
            try {
                session.send(text);
            } catch (Exception e) {
                log.error("Error notifying session {}: {}", session.getSessionId(), e.getMessage());
            }
        }
    }

    // ==================== Client side ====================

    public void handleClientFrame(ClientSession session, String text) {
        RelayEnvelope msg;
        try {
            msg = RelayEnvelope.parse(text);
        } catch (ProtocolException e) {
            log.error("Invalid JSON from client {}: {}", session.getSessionId(), e.getMessage());
            session.send(ErrorMessage.of("Invalid JSON"));
            return;
        }
        handleClientEnvelope(session, msg);
    }

    private void handleClientEnvelope(ClientSession session, RelayEnvelope msg) {
        try {
            ExtensionConnection ext = extension;
            if (ext == null || !ext.isOpen()) {
                rejectUnavailable(session, msg);
                return;
            }
            if (msg.is(MessageTypes.INIT)) {
                // classification only; the extension has no handler for it
                log.debug("Session {} initialized", session.getSessionId());
                return;
            }

            msg.tabId().ifPresent(tabId -> {
                if (session.bindTab(tabId)) {
                    log.debug("Session {} bound to tab {}", session.getSessionId(), tabId);
                }
            });

            Optional<String> id = msg.id();
            if (id.isPresent()) {
                forwardWithResponse(session, id.get(), msg);
            } else if (!ext.send(msg.raw())) {
                log.warn("Dropped {} from {}: extension socket closed", msg, session);
            }
        } catch (Exception e) {
            log.error("Error handling client message {} from {}: {}", msg, session, e.getMessage(), e);
            session.send(ErrorMessage.builder().id(msg.id().orElse(null)).error(e.getMessage()).build());
        }
    }

    private void rejectUnavailable(ClientSession session, RelayEnvelope msg) {
        Optional<String> id = msg.id();
        if (id.isPresent()) {
            session.send(ResponseMessage.failure(id.get(), ExtensionUnavailableException.NOT_CONNECTED));
        } else {
            session.send(ErrorMessage.of(ExtensionUnavailableException.NOT_CONNECTED));
        }
    }

    /**
     * Forward a correlated command with the configured default timeout.
     */
    public CompletableFuture<JsonNode> forwardWithResponse(ClientSession session, String id, RelayEnvelope msg) {
        return forwardWithResponse(session, id, msg, config.getCommandTimeoutMs());
    }

    /**
     * Register a pending request, forward the command verbatim to the extension and
     * answer the session with exactly one RESPONSE once it resolves.
     */
    public CompletableFuture<JsonNode> forwardWithResponse(ClientSession session, String id,
                                                           RelayEnvelope msg, long timeoutMs) {
        CompletableFuture<JsonNode> future;
        try {
            future = session.getPending().register(id, msg.type() + " " + id, timeoutMs);
        } catch (RelayException e) {
            // ERROR, not RESPONSE: the live request owns this id
            log.warn("Rejected {} from {}: {}", msg, session, e.getMessage());
            session.send(ErrorMessage.builder().id(id).error(e.getMessage()).build());
            return CompletableFuture.failedFuture(e);
        }
        future.whenComplete((result, error) -> replyToSession(session, id, result, error));

        ExtensionConnection ext = extension;
        if (ext == null || !ext.isOpen()) {
            session.getPending().reject(id, ExtensionUnavailableException.notConnected());
            return future;
        }
        try {
            if (!ext.send(msg.raw())) {
                session.getPending().reject(id, ExtensionUnavailableException.disconnected());
            }
        } catch (Exception e) {
            log.error("Error forwarding request {}: {}", id, e.getMessage());
            session.getPending().reject(id, RelayException.from(e));
        }
        return future;
    }

    private void replyToSession(ClientSession session, String id, JsonNode result, Throwable error) {
        ResponseMessage response;
        try {
            if (error == null) {
                response = ResponseMessage.success(id, result);
            } else {
                RelayException cause = RelayException.from(error);
                log.error("Error forwarding request {}: {}", id, cause.getMessage());
                response = ResponseMessage.failure(id, cause.getMessage());
            }
        } catch (Exception e) {
            log.error("Internal fault building response for {}", id, e);
            response = ResponseMessage.failure(id, "Internal relay error");
        }
        if (!session.send(response)) {
            log.debug("Response {} not delivered: {} is closed", id, session);
        }
    }

    public void handleSessionClosed(ClientSession session) {
        int failed = session.getPending().failAll(() -> new SessionClosedException("Session closed"));
        sessions.remove(session.getSessionId());
        log.info("Client disconnected: {} ({} pending request(s) failed)", session.getSessionId(), failed);
    }

    /** Close a session on request: the socket is closed and its pending requests are failed. */
    public boolean closeSession(String sessionId) {
        ClientSession session = sessions.get(sessionId);
        if (session == null) return false;
        session.peer().close();
        handleSessionClosed(session);
        return true;
    }

    // ==================== State ====================

    public boolean isExtensionConnected() {
        ExtensionConnection ext = extension;
        return ext != null && ext.isOpen();
    }

    public int sessionCount() {
        return sessions.size();
    }

    public Optional<ClientSession> session(String sessionId) {
        return Optional.ofNullable(sessions.get(sessionId));
    }

    public Collection<ClientSession> sessions() {
        return List.copyOf(sessions.values());
    }

    /**
     * Close every connection and fail everything still pending.
     */
    public void shutdown() {
        ExtensionConnection ext = extension;
        extension = null;
        if (ext != null) {
            ext.peer().close();
        }
        for (ClientSession session : new ArrayList<>(sessions.values())) {
            session.getPending().failAll(() -> new SessionClosedException("Relay stopping"));
            session.peer().close();
        }
        sessions.clear();
    }

    private static JsonNode resultOf(RelayEnvelope response) {
        JsonNode result = response.get("result");
        return result != null ? result : NullNode.getInstance();
    }
}
