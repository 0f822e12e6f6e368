package com.tabrelay.client.transport;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.tabrelay.common.error.ExtensionUnavailableException;
import com.tabrelay.common.error.ProtocolException;
import com.tabrelay.common.protocol.MessageTypes;
import com.tabrelay.common.protocol.RelayEnvelope;
import com.tabrelay.common.protocol.RelayJson;
import com.tabrelay.common.protocol.RelayProtocolTypes.ConnectedMessage;
import com.tabrelay.common.protocol.RelayProtocolTypes.ErrorMessage;
import com.tabrelay.common.protocol.RelayProtocolTypes.ExtensionDisconnectedMessage;
import com.tabrelay.common.protocol.RelayProtocolTypes.ResponseMessage;
import lombok.extern.slf4j.Slf4j;

import java.util.UUID;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;

/**
 * In-process stand-in for a relay with one extension attached. Commands are handed
 * to an {@link ExtensionAgent} and answered the way the relay would answer them,
 * so the router and the facade can run without sockets.
 */
@Slf4j
public final class EmbeddedAgentTransport extends AbstractRelayTransport {

    private final ExtensionAgent agent;
    private final String sessionId = UUID.randomUUID().toString();
    private final ExecutorService loop = Executors.newSingleThreadExecutor(r -> {
        Thread t = new Thread(r, "embedded-relay");
        t.setDaemon(true);
        return t;
    });
    private volatile boolean open = true;
    private volatile boolean extensionConnected = true;
    private volatile boolean welcomed;

    public EmbeddedAgentTransport(ExtensionAgent agent) {
        this.agent = agent;
    }

    @Override
    public boolean send(String text) {
        if (!open) return false;
        try {
            loop.execute(() -> handleClientFrame(text));
            return true;
        } catch (RejectedExecutionException e) {
            return false;
        }
    }

    private void handleClientFrame(String text) {
        if (!welcomed) {
            welcomed = true;
            deliver(RelayJson.write(ConnectedMessage.builder()
                    .sessionId(sessionId)
                    .extensionConnected(extensionConnected)
                    .build()));
        }

        RelayEnvelope command;
        try {
            command = RelayEnvelope.parse(text);
        } catch (ProtocolException e) {
            deliver(RelayJson.write(ErrorMessage.of("Invalid JSON")));
            return;
        }

        String id = command.id().orElse(null);
        if (!extensionConnected) {
            deliver(RelayJson.write(id != null
                    ? ResponseMessage.failure(id, ExtensionUnavailableException.NOT_CONNECTED)
                    : ErrorMessage.of(ExtensionUnavailableException.NOT_CONNECTED)));
            return;
        }
        if (command.is(MessageTypes.INIT)) return;

        try {
            JsonNode result = agent.handle(command);
            if (id != null) deliver(RelayJson.write(ResponseMessage.success(id, result)));
        } catch (Exception e) {
            log.debug("Agent failed {}: {}", command, e.getMessage());
            if (id != null) {
                String error = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
                deliver(RelayJson.write(ResponseMessage.failure(id, error)));
            }
        }
    }

    /**
     * Push a CDP event to the client, as the extension would for a registered listener.
     */
    public void emitEvent(int tabId, String method, JsonNode params) {
        ObjectNode event = RelayJson.object();
        event.put("type", MessageTypes.CDP_EVENT);
        event.put("tabId", tabId);
        event.put("method", method);
        event.set("params", params != null ? params : RelayJson.object());
        emit(RelayJson.write(event));
    }

    /** Push an arbitrary frame to the client from the relay's receive loop. */
    public void emit(String frame) {
        if (!open) return;
        loop.execute(() -> deliver(frame));
    }

    /**
     * Simulate the extension going away: later commands fail as unavailable. A client
     * that has already been welcomed is told with EXTENSION_DISCONNECTED.
     */
    public void disconnectExtension() {
        extensionConnected = false;
        if (welcomed) {
            emit(RelayJson.write(ExtensionDisconnectedMessage.builder()
                    .error(ExtensionUnavailableException.DISCONNECTED)
                    .build()));
        }
    }

    @Override
    public boolean isOpen() {
        return open;
    }

    @Override
    public String describe() {
        return "embedded:" + sessionId;
    }

    @Override
    public void close() {
        if (!open) return;
        open = false;
        loop.shutdown();
        dispatchClosed("closed locally");
    }

    private void deliver(String frame) {
        if (open) dispatchFrame(frame);
    }
}
