package com.repotide.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.repotide.exception.EventStoreUnavailableException;
import com.repotide.exception.MalformedPayloadException;
import com.repotide.exception.UnsupportedEventTypeException;
import com.repotide.model.GitHubEvent;
import com.repotide.store.EventStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * The webhook ingestion pipeline.
 *
 * FLOW:
 *   1. Receive X-GitHub-Event + X-GitHub-Delivery + raw JSON body
 *   2. ping → acknowledge, nothing else to do
 *   3. Unsupported event type → reject before looking at the body
 *   4. Parse the body and hand it to the WebhookNormalizer
 *   5. Ignored by the mapping rules → skip
 *   6. Already-seen delivery → skip
 *   7. Append the canonical event to the EventStore
 *
 * Exactly one append per accepted delivery, none for skipped or invalid ones.
 * Unsupported types, malformed bodies and store failures leave as exceptions
 * for ApiExceptionHandler to turn into responses.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class WebhookIngestionService {

    static final String PING_EVENT = "ping";

    private final WebhookNormalizer normalizer;
    private final EventStore eventStore;
    private final DeliveryDeduplicationService deduplicationService;
    private final ObjectMapper objectMapper;

    public IngestionResult ingest(String eventType, String deliveryId, String body) {
        log.info("Received webhook: type={}, delivery={}", eventType, deliveryId);

        if (PING_EVENT.equals(eventType)) {
            log.info("Received ping event from GitHub");
            return IngestionResult.acknowledged("Webhook configured successfully");
        }

        if (!WebhookMappingRule.isSupportedEventType(eventType)) {
            throw new UnsupportedEventTypeException(eventType);
        }

        NormalizationResult result = normalizer.normalize(eventType, parse(body));
        if (result.isIgnored()) {
            log.debug("Skipping {} delivery {}: {}", eventType, deliveryId, result.getReason());
            return IngestionResult.skipped(result.getReason());
        }

        GitHubEvent event = result.getEvent();

        if (deduplicationService.isDuplicate(deliveryId)) {
            return IngestionResult.skipped("Delivery " + deliveryId + " already processed");
        }

        try {
            eventStore.append(event, deliveryId);
        } catch (EventStoreUnavailableException e) {
            // Let GitHub's redelivery through next time
            deduplicationService.release(deliveryId);
            throw e;
        }

        log.info("Stored event: {} by {} (request_id={})",
                event.getAction(), event.getAuthor(), event.getRequestId());
        return IngestionResult.stored(event);
    }

    private JsonNode parse(String body) {
        if (body == null || body.isBlank()) {
            throw new MalformedPayloadException("body", "Invalid or empty JSON payload");
        }
        try {
            return objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            throw new MalformedPayloadException("body",
                    "Invalid JSON payload: " + e.getOriginalMessage(), e);
        }
    }
}
