package com.tabrelay.common.error;

/** The socket owning a pending request closed before the request resolved. */
public class SessionClosedException extends RelayException {

    public SessionClosedException(String message) {
        super(message);
    }
}
