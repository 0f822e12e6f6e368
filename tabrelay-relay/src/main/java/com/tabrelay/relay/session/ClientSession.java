package com.tabrelay.relay.session;

import com.tabrelay.common.pending.PendingRequestTable;
import com.tabrelay.common.protocol.RelayJson;
import com.tabrelay.relay.RelayRouter;
import lombok.Getter;

import java.util.Optional;
import java.util.concurrent.ScheduledExecutorService;

/**
 * A client session: one automation client's socket plus the requests it has in flight.
 *
 * <p>{@code tabId} is bound at most once, from the first frame carrying one, and never
 * changes afterwards. An unbound session receives CDP events for every tab.</p>
 */
public class ClientSession implements RelayConnection {

    private final RelayRouter router;
    private final RelayPeer peer;
    @Getter private final String sessionId;
    @Getter private final PendingRequestTable pending;
    private volatile String tabId;

    public ClientSession(RelayRouter router, RelayPeer peer, String sessionId,
                         ScheduledExecutorService scheduler) {
        this.router = router;
        this.peer = peer;
        this.sessionId = sessionId;
        this.pending = new PendingRequestTable("session " + sessionId, scheduler);
    }

    public Optional<String> tabId() {
        return Optional.ofNullable(tabId);
    }

    /**
     * Bind the session to a tab unless it is already bound.
     *
     * @return true if this call performed the binding
     */
    public synchronized boolean bindTab(String candidate) {
        if (tabId != null || candidate == null || candidate.isEmpty()) return false;
        tabId = candidate;
        return true;
    }

    /** Events for {@code eventTabId} reach this session if it is bound to that tab or unbound. */
    public boolean accepts(String eventTabId) {
        String bound = tabId;
        return bound == null || bound.equals(eventTabId);
    }

    public boolean send(Object frame) {
        return peer.send(frame instanceof String text ? text : RelayJson.write(frame));
    }

    @Override
    public RelayPeer peer() {
        return peer;
    }

    @Override
    public void onFrame(String text) {
        router.handleClientFrame(this, text);
    }

    @Override
    public void onClosed() {
        router.handleSessionClosed(this);
    }

    @Override
    public String toString() {
        return "session " + sessionId;
    }
}
