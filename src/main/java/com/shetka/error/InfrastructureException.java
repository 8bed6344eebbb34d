package com.shetka.error;

/**
 * Database unavailable, query failure or corrupt stored data. Rendered as 500, never retried.
 */
public class InfrastructureException extends ApiException {

    public InfrastructureException(String message, Throwable cause) {
        super(message, cause);
    }
}
