package com.tabrelay.common.error;

import lombok.Getter;

/** No RESPONSE arrived before the command's deadline. */
@Getter
public class CommandTimeoutException extends RelayException {

    private final String correlationId;
    private final long timeoutMs;

    public CommandTimeoutException(String correlationId, String description, long timeoutMs) {
        super(description + " timed out after " + timeoutMs + "ms");
        this.correlationId = correlationId;
        this.timeoutMs = timeoutMs;
    }

    /** A timeout reported by the far side, keeping its message. */
    public CommandTimeoutException(String correlationId, long timeoutMs, String message) {
        super(message);
        this.correlationId = correlationId;
        this.timeoutMs = timeoutMs;
    }
}
