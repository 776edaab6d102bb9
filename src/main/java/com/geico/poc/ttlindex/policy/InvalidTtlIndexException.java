package com.geico.poc.ttlindex.policy;

/**
 * Thrown when a TTL policy cannot be registered: unknown column, non-temporal column,
 * or out-of-range threshold / batch size. Never retried.
 */
public class InvalidTtlIndexException extends RuntimeException {

    public InvalidTtlIndexException(String message) {
        super(message);
    }

    public InvalidTtlIndexException(String message, Throwable cause) {
        super(message, cause);
    }
}
