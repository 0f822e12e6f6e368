package com.tabrelay.common.config;

/**
 * Relay defaults: ports, timeouts and limits.
 */
public final class RelayConstants {

    private RelayConstants() {}

    // ==================== Network ====================

    /** Host the relay binds to; the extension and local clients connect over loopback. */
    public static final String DEFAULT_HOST = "localhost";

    /** Single port shared by the extension agent and client sessions. */
    public static final int DEFAULT_PORT = 8766;

    /** Largest text frame accepted (evaluate results can be large). */
    public static final int DEFAULT_MAX_FRAME_BYTES = 16 * 1024 * 1024;

    // ==================== Timeouts ====================

    /** Per-command timeout, overridable per call. */
    public static final long DEFAULT_COMMAND_TIMEOUT_MS = 30_000;

    /** Window in which a new socket must send a classifiable first frame. */
    public static final long DEFAULT_HANDSHAKE_TIMEOUT_MS = 5_000;

    /** Timeout for the client's welcome wait and the tab-binding steps of connect. */
    public static final long DEFAULT_CONNECT_STEP_TIMEOUT_MS = 5_000;

    /** Fixed delay standing in for a real load-state wait on relayed pages. */
    public static final long DEFAULT_LOAD_STATE_DELAY_MS = 500;

    // ==================== Client ====================

    /** Bounded capacity of an event subscription's queue. */
    public static final int DEFAULT_EVENT_QUEUE_CAPACITY = 256;

    public static final String DEFAULT_RELAY_URL = "ws://" + DEFAULT_HOST + ":" + DEFAULT_PORT;
}
