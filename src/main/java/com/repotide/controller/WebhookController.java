package com.repotide.controller;

import com.repotide.dto.WebhookResponse;
import com.repotide.service.IngestionResult;
import com.repotide.service.WebhookIngestionService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * GitHub webhook receiver.
 *
 * POST /webhook/receiver
 *   X-GitHub-Event: push | pull_request | ping
 *   X-GitHub-Delivery: 72d3162e-cc78-11e3-81ab-4c9367dc0958
 *
 * 201 → event stored
 * 200 → ping acknowledged, or delivery skipped
 * 400 → missing header or malformed payload
 * 503 → event store unavailable (GitHub will show the delivery as failed)
 */
@RestController
@RequestMapping("/webhook")
@RequiredArgsConstructor
@Slf4j
public class WebhookController {

    static final String EVENT_HEADER = "X-GitHub-Event";
    static final String DELIVERY_HEADER = "X-GitHub-Delivery";

    private final WebhookIngestionService ingestionService;

    @PostMapping("/receiver")
    public ResponseEntity<WebhookResponse> receive(
            @RequestHeader(value = EVENT_HEADER, required = false) String eventType,
            @RequestHeader(value = DELIVERY_HEADER, required = false) String deliveryId,
            @RequestBody(required = false) String body) {

        if (eventType == null || eventType.isBlank()) {
            log.warn("Missing {} header", EVENT_HEADER);
            return ResponseEntity.badRequest()
                    .body(WebhookResponse.error("Missing " + EVENT_HEADER + " header"));
        }

        IngestionResult result = ingestionService.ingest(eventType.trim(), deliveryId, body);

        return switch (result.getOutcome()) {
            case STORED -> ResponseEntity.status(HttpStatus.CREATED)
                    .body(WebhookResponse.success(result.getMessage(), result.getEvent()));
            case ACKNOWLEDGED -> ResponseEntity.ok(WebhookResponse.success(result.getMessage(), null));
            case SKIPPED -> ResponseEntity.ok(WebhookResponse.skipped(result.getMessage()));
        };
    }
}
