package com.tabrelay.common.error;

/** No extension agent connection exists, or it went away mid-flight. */
public class ExtensionUnavailableException extends RelayException {

    public static final String NOT_CONNECTED = "Chrome extension not connected";
    public static final String DISCONNECTED = "Chrome extension disconnected";

    public ExtensionUnavailableException(String message) {
        super(message);
    }

    public static ExtensionUnavailableException notConnected() {
        return new ExtensionUnavailableException(NOT_CONNECTED);
    }

    public static ExtensionUnavailableException disconnected() {
        return new ExtensionUnavailableException(DISCONNECTED);
    }
}
