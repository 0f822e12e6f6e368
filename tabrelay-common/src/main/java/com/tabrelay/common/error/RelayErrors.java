package com.tabrelay.common.error;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Maps the error string of a failed RESPONSE back onto the exception type the relay
 * raised for it. Unrecognized errors are the extension's own and become
 * {@link CommandFailedException}.
 */
public final class RelayErrors {

    private static final Pattern TIMEOUT = Pattern.compile(" timed out after (\\d+)ms$");

    private RelayErrors() {
    }

    public static RelayException fromResponse(String correlationId, String error) {
        if (error == null || error.isBlank()) {
            return new CommandFailedException(correlationId, error);
        }
        if (ExtensionUnavailableException.NOT_CONNECTED.equals(error)
                || ExtensionUnavailableException.DISCONNECTED.equals(error)) {
            return new ExtensionUnavailableException(error);
        }
        Matcher timeout = TIMEOUT.matcher(error);
        if (timeout.find()) {
            try {
                return new CommandTimeoutException(correlationId, Long.parseLong(timeout.group(1)), error);
            } catch (NumberFormatException e) {
                return new CommandFailedException(correlationId, error);
            }
        }
        return new CommandFailedException(correlationId, error);
    }
}
