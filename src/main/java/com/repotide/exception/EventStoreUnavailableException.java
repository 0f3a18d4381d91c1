package com.repotide.exception;

/**
 * The event store backend could not be reached or rejected the operation.
 * Surfaced to the caller as 503; nothing retries it inside the service.
 */
public class EventStoreUnavailableException extends RuntimeException {

    public EventStoreUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
