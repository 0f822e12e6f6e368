package com.tabrelay.client.transport;

/**
 * A bidirectional text-frame channel to a relay.
 *
 * <p>Frames are delivered to the listener one at a time, in arrival order, from a
 * single receive thread. Frames that arrive before a listener is installed are
 * buffered and replayed to it.</p>
 */
public interface RelayTransport extends AutoCloseable {

    /**
     * Receiver for inbound frames and the end of the channel.
     */
    interface Listener {

        void onFrame(String text);

        /** Called once when the channel ends, whether closed locally, remotely or by failure. */
        void onClosed(String reason);
    }

    void setListener(Listener listener);

    /**
     * Queue a frame for sending.
     *
     * @return false if the channel is already closed
     */
    boolean send(String text);

    boolean isOpen();

    /** Short human-readable name for logs. */
    String describe();

    @Override
    void close();
}
