package com.tabrelay.relay.session;

/**
 * A classified connection: either the extension agent or a client session.
 * The transport hands every later frame and the final close to it.
 */
public interface RelayConnection {

    RelayPeer peer();

    void onFrame(String text);

    void onClosed();
}
