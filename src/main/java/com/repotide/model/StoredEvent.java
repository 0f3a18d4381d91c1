package com.repotide.model;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

/**
 * Persistent form of a {@link GitHubEvent}.
 *
 * The generated id is the only ordering key: "most recent" means highest id,
 * never the GitHub-supplied timestamp, which can arrive out of order.
 * Rows are written once and never updated.
 */
@Entity
@Table(name = "github_events", indexes = {
    @Index(name = "idx_github_events_delivery_id", columnList = "delivery_id")
})
@Getter @NoArgsConstructor @AllArgsConstructor @Builder
public class StoredEvent {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "request_id", length = GitHubEvent.MAX_FIELD_LENGTH, nullable = false, updatable = false)
    private String requestId;

    @Column(length = GitHubEvent.MAX_FIELD_LENGTH, nullable = false, updatable = false)
    private String author;

    @Enumerated(EnumType.STRING)
    @Column(name = "event_action", nullable = false, updatable = false)
    private EventAction action;

    // Null for PUSH
    @Column(name = "from_branch", length = GitHubEvent.MAX_FIELD_LENGTH, updatable = false)
    private String fromBranch;

    @Column(name = "to_branch", length = GitHubEvent.MAX_FIELD_LENGTH, nullable = false, updatable = false)
    private String toBranch;

    @Column(name = "event_timestamp", length = GitHubEvent.MAX_FIELD_LENGTH, nullable = false, updatable = false)
    private String timestamp;

    /** GitHub's X-GitHub-Delivery GUID, when the sender supplied one. */
    @Column(name = "delivery_id", length = GitHubEvent.MAX_FIELD_LENGTH, updatable = false)
    private String deliveryId;

    @Column(name = "received_at", nullable = false, updatable = false)
    private Instant receivedAt;

    public static StoredEvent from(GitHubEvent event, String deliveryId, Instant receivedAt) {
        return StoredEvent.builder()
                .requestId(event.getRequestId())
                .author(event.getAuthor())
                .action(event.getAction())
                .fromBranch(event.getFromBranch())
                .toBranch(event.getToBranch())
                .timestamp(event.getTimestamp())
                .deliveryId(deliveryId)
                .receivedAt(receivedAt)
                .build();
    }

    public GitHubEvent toEvent() {
        return GitHubEvent.of(requestId, author, action, fromBranch, toBranch, timestamp);
    }
}
