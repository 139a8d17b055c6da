package com.concierge.core.persistence;

/**
 * Thrown when checkpoint storage fails.
 */
public class CheckpointStoreException extends RuntimeException {

    public CheckpointStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
