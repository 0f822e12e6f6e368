package com.tabrelay.relay.session;

import com.tabrelay.relay.RelayRouter;

/**
 * The extension agent's socket. At most one is active in a {@link RelayRouter}.
 */
public class ExtensionConnection implements RelayConnection {

    private final RelayRouter router;
    private final RelayPeer peer;

    public ExtensionConnection(RelayRouter router, RelayPeer peer) {
        this.router = router;
        this.peer = peer;
    }

    @Override
    public RelayPeer peer() {
        return peer;
    }

    public boolean isOpen() {
        return peer.isOpen();
    }

    public boolean send(String text) {
        return peer.send(text);
    }

    @Override
    public void onFrame(String text) {
        router.handleExtensionFrame(this, text);
    }

    @Override
    public void onClosed() {
        router.handleExtensionClosed(this);
    }

    @Override
    public String toString() {
        return "extension@" + peer.describe();
    }
}
