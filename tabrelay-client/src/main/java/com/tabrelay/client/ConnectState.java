package com.tabrelay.client;

/**
 * Steps of {@link RelayConnector#connect()}, in order.
 */
public enum ConnectState {
    DISCONNECTED,
    /** Socket open and INIT sent. */
    AWAITING_WELCOME,
    /** CONNECTED received; the router owns the socket. */
    ROUTER_STARTED,
    /** The active tab is known and bound. */
    TAB_BOUND,
    /** Debugger attached; the context is usable. */
    READY
}
