package com.tabrelay.client.facade.relayed;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.tabrelay.client.ClientMessageRouter;
import com.tabrelay.client.EventSubscription;
import com.tabrelay.client.facade.TabCdpSession;
import com.tabrelay.common.error.RelayException;
import com.tabrelay.common.error.SessionClosedException;
import com.tabrelay.common.protocol.MessageTypes;
import com.tabrelay.common.protocol.RelayJson;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * CDP session tunnelled through the relay as CDP_COMMAND frames. Event callbacks are
 * registered with the router, which registers the listener with the extension.
 */
@Slf4j
public class RelayTabCdpSession implements TabCdpSession {

    private final ClientMessageRouter router;
    private final int tabId;
    private final List<Map.Entry<String, Consumer<JsonNode>>> registrations = new CopyOnWriteArrayList<>();
    private final List<EventSubscription> subscriptions = new CopyOnWriteArrayList<>();
    private volatile boolean detached;

    RelayTabCdpSession(ClientMessageRouter router, int tabId) {
        this.router = router;
        this.tabId = tabId;
    }

    @Override
    public JsonNode send(String method) throws RelayException {
        return send(method, null);
    }

    @Override
    public JsonNode send(String method, JsonNode params) throws RelayException {
        if (detached) throw new SessionClosedException("CDP session detached");
        ObjectNode frame = RelayJson.object();
        frame.put("method", method);
        frame.set("params", params != null ? params : RelayJson.object());
        frame.put("tabId", tabId);
        JsonNode result = router.sendCommand(MessageTypes.CDP_COMMAND, frame);
        return result == null || result.isNull() ? RelayJson.object() : result;
    }

    @Override
    public void on(String eventName, Consumer<JsonNode> callback) {
        registrations.add(Map.entry(eventName, callback));
        router.registerEventHandler(eventName, callback);
    }

    @Override
    public void removeListener(String eventName, Consumer<JsonNode> callback) {
        for (Map.Entry<String, Consumer<JsonNode>> entry : registrations) {
            if (entry.getKey().equals(eventName) && entry.getValue() == callback) {
                registrations.remove(entry);
                router.unregisterEventHandler(eventName, callback);
                return;
            }
        }
    }

    @Override
    public EventSubscription subscribe(String eventName) {
        EventSubscription subscription = router.subscribe(eventName);
        subscriptions.add(subscription);
        return subscription;
    }

    @Override
    public boolean isConnected() {
        return !detached && router.isOpen();
    }

    @Override
    public void detach() {
        if (detached) return;
        detached = true;
        for (Map.Entry<String, Consumer<JsonNode>> entry : new ArrayList<>(registrations)) {
            router.unregisterEventHandler(entry.getKey(), entry.getValue());
        }
        registrations.clear();
        subscriptions.forEach(EventSubscription::close);
        subscriptions.clear();
        log.debug("CDP session on tab {} detached", tabId);
    }
}
