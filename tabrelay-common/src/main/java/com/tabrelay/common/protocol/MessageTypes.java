package com.tabrelay.common.protocol;

/**
 * Message {@code type} discriminators exchanged between the extension agent,
 * the relay and client sessions.
 */
public final class MessageTypes {

    private MessageTypes() {
    }

    // ==================== Extension → Relay ====================

    public static final String EXTENSION_READY = "EXTENSION_READY";
    public static final String PING = "PING";
    public static final String RESPONSE = "RESPONSE";
    public static final String CDP_EVENT = "CDP_EVENT";
    public static final String DEBUGGER_DETACHED = "DEBUGGER_DETACHED";
    public static final String TAB_CLOSED = "TAB_CLOSED";

    // ==================== Relay → Extension ====================

    public static final String PONG = "PONG";

    // ==================== Relay → Client ====================

    public static final String CONNECTED = "CONNECTED";
    public static final String ERROR = "ERROR";
    public static final String EXTENSION_DISCONNECTED = "EXTENSION_DISCONNECTED";

    // ==================== Client → Relay ====================

    /** First frame a client sends so the relay can classify the socket. */
    public static final String INIT = "INIT";

    public static final String GET_ACTIVE_TAB = "GET_ACTIVE_TAB";
    public static final String ATTACH_DEBUGGER = "ATTACH_DEBUGGER";
    public static final String DETACH_DEBUGGER = "DETACH_DEBUGGER";
    public static final String SET_COOKIES = "SET_COOKIES";
    public static final String GET_COOKIES = "GET_COOKIES";
    public static final String NAVIGATE = "NAVIGATE";
    public static final String GET_TAB_INFO = "GET_TAB_INFO";
    public static final String GET_ALL_TABS = "GET_ALL_TABS";
    public static final String CLOSE_TAB = "CLOSE_TAB";
    public static final String EVALUATE = "EVALUATE";
    public static final String INJECT_SCRIPT = "INJECT_SCRIPT";
    public static final String CDP_COMMAND = "CDP_COMMAND";
    public static final String REGISTER_CDP_LISTENER = "REGISTER_CDP_LISTENER";
    public static final String UNREGISTER_CDP_LISTENER = "UNREGISTER_CDP_LISTENER";
}
