package com.tabrelay.common.error;

/** Malformed or non-JSON frame. The frame is dropped, the connection stays open. */
public class ProtocolException extends RelayException {

    public ProtocolException(String message) {
        super(message);
    }

    public ProtocolException(String message, Throwable cause) {
        super(message, cause);
    }
}
