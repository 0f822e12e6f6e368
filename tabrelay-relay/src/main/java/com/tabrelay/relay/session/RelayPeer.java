package com.tabrelay.relay.session;

/**
 * One end of a full-duplex message socket, as seen by the router.
 */
public interface RelayPeer {

    /** Stable identifier for logs (remote address or channel id). */
    String describe();

    boolean isOpen();

    /**
     * Queue a text frame for delivery.
     *
     * @return false if the socket is no longer open and nothing was sent
     */
    boolean send(String text);

    void close();
}
