package com.repotide.exception;

import lombok.Getter;

/**
 * A webhook body that cannot be turned into an event: unparsable JSON, or a
 * required source field is absent. {@link #getField()} names the JSON path that
 * was missing so the sender can see what to fix.
 */
@Getter
public class MalformedPayloadException extends RuntimeException {

    private final String field;

    public MalformedPayloadException(String field, String message) {
        super(message);
        this.field = field;
    }

    public MalformedPayloadException(String field, String message, Throwable cause) {
        super(message, cause);
        this.field = field;
    }

    public static MalformedPayloadException missing(String field) {
        return new MalformedPayloadException(field, "Missing required field: " + field);
    }
}
