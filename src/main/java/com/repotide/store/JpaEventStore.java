package com.repotide.store;

import com.repotide.exception.EventStoreUnavailableException;
import com.repotide.exception.MalformedPayloadException;
import com.repotide.model.GitHubEvent;
import com.repotide.model.StoredEvent;
import com.repotide.repository.GitHubEventRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Component;
import org.springframework.transaction.TransactionException;

import java.time.Clock;
import java.util.List;
import java.util.stream.Collectors;

/**
 * {@link EventStore} backed by the github_events table.
 *
 * Each append is a single-row insert in its own transaction, so a failure
 * never leaves a partial event behind. Spring's data-access and transaction
 * exceptions (connection refused, pool exhausted, ...) are translated into
 * {@link EventStoreUnavailableException}. A row the database refuses
 * (constraint or length violation) is a bad payload, not an outage, and
 * becomes {@link MalformedPayloadException}.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class JpaEventStore implements EventStore {

    private final GitHubEventRepository repository;
    private final Clock clock;

    @Override
    public void append(GitHubEvent event, String deliveryId) {
        try {
            StoredEvent saved = repository.save(StoredEvent.from(event, deliveryId, clock.instant()));
            log.debug("Appended event id={}, action={}, requestId={}",
                    saved.getId(), event.getAction(), event.getRequestId());
        } catch (DataIntegrityViolationException e) {
            // The row itself was rejected; the backend is fine
            log.error("Event {} rejected by the store: {}", event.getRequestId(), e.getMessage());
            throw new MalformedPayloadException("event", "Event rejected by the store: "
                    + e.getMostSpecificCause().getMessage(), e);
        } catch (DataAccessException | TransactionException e) {
            log.error("Failed to append event {}: {}", event.getRequestId(), e.getMessage(), e);
            throw new EventStoreUnavailableException("Event store unavailable", e);
        }
    }

    @Override
    public List<GitHubEvent> recent(int limit) {
        int clamped = EventStore.clampLimit(limit);
        try {
            return repository.findAllByOrderByIdDesc(PageRequest.of(0, clamped)).stream()
                    .map(StoredEvent::toEvent)
                    .collect(Collectors.toList());
        } catch (DataAccessException | TransactionException e) {
            log.error("Failed to read recent events: {}", e.getMessage(), e);
            throw new EventStoreUnavailableException("Event store unavailable", e);
        }
    }

    @Override
    public boolean isAvailable() {
        try {
            repository.findAllByOrderByIdDesc(PageRequest.of(0, 1));
            return true;
        } catch (DataAccessException | TransactionException e) {
            log.error("Event store health check failed: {}", e.getMessage());
            return false;
        }
    }
}
