package com.repotide.exception;

import lombok.Getter;

/**
 * The X-GitHub-Event header names an event kind this service does not track.
 * Answered with a "skipped" acknowledgement rather than a failure, so GitHub
 * does not keep redelivering it.
 */
@Getter
public class UnsupportedEventTypeException extends RuntimeException {

    private final String eventType;

    public UnsupportedEventTypeException(String eventType) {
        super("Event type \"" + eventType + "\" not supported");
        this.eventType = eventType;
    }
}
