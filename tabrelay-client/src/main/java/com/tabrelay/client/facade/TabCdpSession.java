package com.tabrelay.client.facade;

import com.fasterxml.jackson.databind.JsonNode;
import com.tabrelay.client.EventSubscription;
import com.tabrelay.common.error.RelayException;

import java.util.function.Consumer;

/**
 * Chrome DevTools Protocol session on a tab. Payloads are opaque JSON.
 */
public interface TabCdpSession {

    JsonNode send(String method) throws RelayException;

    /** @return the method's result payload, an empty object when it has none */
    JsonNode send(String method, JsonNode params) throws RelayException;

    void on(String eventName, Consumer<JsonNode> callback);

    void removeListener(String eventName, Consumer<JsonNode> callback);

    /** Receive {@code eventName} through a bounded queue instead of a callback. */
    EventSubscription subscribe(String eventName);

    boolean isConnected();

    /** Drop every listener of this session and stop using it. */
    void detach() throws RelayException;
}
