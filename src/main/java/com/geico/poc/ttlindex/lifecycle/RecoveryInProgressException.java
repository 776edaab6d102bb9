package com.geico.poc.ttlindex.lifecycle;

/**
 * The operation needs a writable store but the store is in recovery.
 */
public class RecoveryInProgressException extends RuntimeException {

    public RecoveryInProgressException(String message) {
        super(message);
    }
}
