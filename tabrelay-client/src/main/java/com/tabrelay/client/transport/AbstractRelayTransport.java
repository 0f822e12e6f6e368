package com.tabrelay.client.transport;

import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;

/**
 * Listener bookkeeping shared by transports: buffers early frames and makes sure
 * {@link Listener#onClosed} fires exactly once.
 */
@Slf4j
abstract class AbstractRelayTransport implements RelayTransport {

    private final List<String> early = new ArrayList<>();
    private Listener listener;
    private String closedReason;
    private boolean closeDelivered;

    @Override
    public void setListener(Listener listener) {
        List<String> replay;
        boolean deliverClose;
        synchronized (this) {
            this.listener = listener;
            replay = new ArrayList<>(early);
            early.clear();
            deliverClose = closedReason != null && !closeDelivered;
            if (deliverClose) closeDelivered = true;
        }
        replay.forEach(listener::onFrame);
        if (deliverClose) listener.onClosed(closedReason);
    }

    protected void dispatchFrame(String text) {
        Listener target;
        synchronized (this) {
            target = listener;
            if (target == null) {
                early.add(text);
                return;
            }
        }
        try {
            target.onFrame(text);
        } catch (Exception e) {
            log.error("Frame listener failed on {}: {}", describe(), e.getMessage(), e);
        }
    }

    protected void dispatchClosed(String reason) {
        Listener target;
        synchronized (this) {
            if (closedReason != null) return;
            closedReason = reason;
            target = listener;
            if (target == null) return;
            closeDelivered = true;
        }
        target.onClosed(reason);
    }

    protected synchronized boolean isClosed() {
        return closedReason != null;
    }
}
