package com.tabrelay.client.facade.direct;

import com.fasterxml.jackson.databind.JsonNode;
import com.google.gson.JsonObject;
import com.microsoft.playwright.CDPSession;
import com.microsoft.playwright.Page;
import com.tabrelay.client.EventSubscription;
import com.tabrelay.client.facade.TabCdpSession;
import com.tabrelay.common.config.RelayConstants;
import com.tabrelay.common.error.RelayException;
import com.tabrelay.common.error.SessionClosedException;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * Playwright {@link CDPSession} behind the tab facade. Events are converted from Gson
 * to Jackson trees before they reach callbacks.
 */
@Slf4j
public class DirectTabCdpSession implements TabCdpSession {

    private record Registration(String eventName, Consumer<JsonNode> callback, Consumer<JsonObject> adapter) {
    }

    private final CDPSession session;
    private final Page page;
    private final List<Registration> registrations = new CopyOnWriteArrayList<>();
    private final List<EventSubscription> subscriptions = new CopyOnWriteArrayList<>();
    private volatile boolean detached;

    DirectTabCdpSession(CDPSession session, Page page) {
        this.session = session;
        this.page = page;
    }

    @Override
    public JsonNode send(String method) throws RelayException {
        return send(method, null);
    }

    @Override
    public JsonNode send(String method, JsonNode params) throws RelayException {
        if (detached) throw new SessionClosedException("CDP session detached");
        return PlaywrightCalls.call("CDP " + method,
                () -> PlaywrightCalls.fromGson(session.send(method, PlaywrightCalls.toGson(params))));
    }

    @Override
    public void on(String eventName, Consumer<JsonNode> callback) {
        Consumer<JsonObject> adapter = event -> {
            try {
                callback.accept(PlaywrightCalls.fromGson(event));
            } catch (Exception e) {
                log.error("Error in event handler for {}: {}", eventName, e.getMessage(), e);
            }
        };
        registrations.add(new Registration(eventName, callback, adapter));
        session.on(eventName, adapter);
    }

    @Override
    public void removeListener(String eventName, Consumer<JsonNode> callback) {
        for (Registration registration : registrations) {
            if (registration.eventName().equals(eventName) && registration.callback() == callback) {
                registrations.remove(registration);
                session.off(eventName, registration.adapter());
                return;
            }
        }
    }

    @Override
    public EventSubscription subscribe(String eventName) {
        EventSubscription subscription = new EventSubscription(eventName,
                RelayConstants.DEFAULT_EVENT_QUEUE_CAPACITY,
                s -> removeListener(s.getEventName(), s.sink()));
        subscriptions.add(subscription);
        on(eventName, subscription.sink());
        return subscription;
    }

    @Override
    public boolean isConnected() {
        return !detached && !page.isClosed();
    }

    @Override
    public void detach() throws RelayException {
        if (detached) return;
        subscriptions.forEach(EventSubscription::close);
        subscriptions.clear();
        for (Registration registration : new ArrayList<>(registrations)) {
            session.off(registration.eventName(), registration.adapter());
        }
        registrations.clear();
        detached = true;
        PlaywrightCalls.run("CDP detach", session::detach);
    }
}
