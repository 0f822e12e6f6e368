package com.tabrelay.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.tabrelay.client.facade.relayed.RelayTabContext;
import com.tabrelay.client.transport.OkHttpRelayTransport;
import com.tabrelay.client.transport.RelayTransport;
import com.tabrelay.common.config.ClientConfig;
import com.tabrelay.common.error.CommandFailedException;
import com.tabrelay.common.error.ProtocolException;
import com.tabrelay.common.error.RelayException;
import com.tabrelay.common.protocol.MessageTypes;
import com.tabrelay.common.protocol.RelayJson;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

/**
 * Connects an automation client to the relay and hands back a context on the active tab.
 *
 * <p>The sequence is INIT, welcome, GET_ACTIVE_TAB, ATTACH_DEBUGGER. Any failure aborts
 * the whole attempt: the transport is closed and the triggering error is thrown. There
 * is no retry of individual steps.</p>
 */
@Slf4j
public class RelayConnector {

    /**
     * Opens the raw channel to a relay.
     */
    @FunctionalInterface
    public interface TransportFactory {
        RelayTransport open(String url, long timeoutMs) throws RelayException;
    }

    private final ClientConfig config;
    private final TransportFactory transportFactory;
    @Getter private volatile ConnectState state = ConnectState.DISCONNECTED;

    public RelayConnector(ClientConfig config) {
        this(config, OkHttpRelayTransport::connect);
    }

    public RelayConnector(ClientConfig config, TransportFactory transportFactory) {
        this.config = config;
        this.transportFactory = transportFactory;
    }

    /**
     * Run the connect sequence.
     *
     * @return a ready context bound to the browser's active tab
     */
    public RelayTabContext connect() throws RelayException {
        String url = config.getRelayUrl();
        long stepTimeout = config.getConnectStepTimeoutMs();
        log.info("Connecting to relay at {}", url);

        RelayTransport transport = null;
        ClientMessageRouter router = null;
        try {
            transport = transportFactory.open(url, stepTimeout);
            router = new ClientMessageRouter(transport, config);
            router.sendFireAndForget(MessageTypes.INIT, null);
            state = ConnectState.AWAITING_WELCOME;

            JsonNode welcome = router.awaitWelcome(stepTimeout);
            if (!welcome.path("extension_connected").asBoolean(false)) {
                log.warn("Chrome extension is not connected to the relay; make sure it is loaded in Chrome");
            }
            log.info("Relay session: {}", welcome.path("session_id").asText("?"));
            state = ConnectState.ROUTER_STARTED;

            JsonNode tab = router.sendCommand(MessageTypes.GET_ACTIVE_TAB, RelayJson.object(), stepTimeout);
            if (!tab.path("tabId").canConvertToInt()) {
                throw new ProtocolException("GET_ACTIVE_TAB returned no tabId: " + tab);
            }
            int tabId = tab.get("tabId").asInt();
            router.bindTab(tabId);
            log.info("Active tab: {} - {}", tabId, tab.path("title").asText("Untitled"));
            state = ConnectState.TAB_BOUND;

            attachDebugger(router, tabId, stepTimeout);
            state = ConnectState.READY;
            log.info("Relay connection established");
            return new RelayTabContext(router, tabId);
        } catch (RelayException | RuntimeException e) {
            log.error("Failed to connect to relay: {}", e.getMessage());
            state = ConnectState.DISCONNECTED;
            if (router != null) {
                router.close();
            } else if (transport != null) {
                transport.close();
            }
            throw e;
        }
    }

    private void attachDebugger(ClientMessageRouter router, int tabId, long timeoutMs) throws RelayException {
        ObjectNode params = RelayJson.object();
        params.put("tabId", tabId);
        try {
            router.sendCommand(MessageTypes.ATTACH_DEBUGGER, params, timeoutMs);
            log.info("Debugger attached to tab {}", tabId);
        } catch (CommandFailedException e) {
            if (e.getMessage() != null && e.getMessage().contains("Cannot access a chrome://")) {
                log.error("Cannot attach the debugger to chrome:// pages; open a regular website as the active tab");
            }
            throw e;
        }
    }
}
