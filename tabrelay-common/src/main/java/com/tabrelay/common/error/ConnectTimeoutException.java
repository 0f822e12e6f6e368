package com.tabrelay.common.error;

/** A handshake step did not complete within its window. */
public class ConnectTimeoutException extends RelayException {

    public ConnectTimeoutException(String message) {
        super(message);
    }
}
