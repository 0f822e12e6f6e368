package com.tabrelay.common.error;

import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

/**
 * Base of every failure a relayed command can terminate with.
 */
public class RelayException extends Exception {

    public RelayException(String message) {
        super(message);
    }

    public RelayException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Unwrap a future's failure into a {@link RelayException}, wrapping anything else.
     */
    public static RelayException from(Throwable error) {
        Throwable cause = error;
        while ((cause instanceof CompletionException || cause instanceof ExecutionException)
                && cause.getCause() != null) {
            cause = cause.getCause();
        }
        if (cause instanceof RelayException re) return re;
        String message = cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
        return new RelayException(message, cause);
    }
}
