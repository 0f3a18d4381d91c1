package com.repotide.controller;

import com.repotide.dto.WebhookResponse;
import com.repotide.exception.EventStoreUnavailableException;
import com.repotide.exception.MalformedPayloadException;
import com.repotide.exception.UnsupportedEventTypeException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.ErrorResponse;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * Turns the service's exceptions into {status, message} bodies.
 *
 *   UnsupportedEventTypeException  → 200 skipped
 *   MalformedPayloadException      → 400
 *   EventStoreUnavailableException → 503
 *   Spring MVC errors              → their own status
 *   anything else                  → 500
 */
@RestControllerAdvice
@Slf4j
public class ApiExceptionHandler {

    @ExceptionHandler(UnsupportedEventTypeException.class)
    public ResponseEntity<WebhookResponse> unsupported(UnsupportedEventTypeException e) {
        log.debug("Unsupported event type: {}", e.getEventType());
        return ResponseEntity.ok(WebhookResponse.skipped(e.getMessage()));
    }

    @ExceptionHandler(MalformedPayloadException.class)
    public ResponseEntity<WebhookResponse> malformed(MalformedPayloadException e) {
        log.error("Validation error on field '{}': {}", e.getField(), e.getMessage());
        return ResponseEntity.badRequest().body(WebhookResponse.error(e.getMessage()));
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<WebhookResponse> unreadable(HttpMessageNotReadableException e) {
        log.warn("Unreadable request body: {}", e.getMessage());
        return ResponseEntity.badRequest().body(WebhookResponse.error("Invalid or empty JSON payload"));
    }

    @ExceptionHandler(EventStoreUnavailableException.class)
    public ResponseEntity<WebhookResponse> storeUnavailable(EventStoreUnavailableException e) {
        log.error("Event store unavailable: {}", e.getMessage());
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                .body(WebhookResponse.error("Event store unavailable"));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<WebhookResponse> unexpected(Exception e) {
        // Spring MVC's own errors (405, 415, ...) keep their status
        if (e instanceof ErrorResponse) {
            ErrorResponse errorResponse = (ErrorResponse) e;
            return ResponseEntity.status(errorResponse.getStatusCode())
                    .body(WebhookResponse.error(e.getMessage()));
        }
        log.error("Unexpected error: {}", e.getMessage(), e);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(WebhookResponse.error("Internal server error"));
    }
}
