package com.tabrelay.common.error;

import lombok.Getter;

/**
 * The far side answered with {@code success=false}; the message is the error it reported.
 */
@Getter
public class CommandFailedException extends RelayException {

    private final String correlationId;

    public CommandFailedException(String correlationId, String error) {
        super(error != null && !error.isBlank() ? error : "Unknown error");
        this.correlationId = correlationId;
    }
}
