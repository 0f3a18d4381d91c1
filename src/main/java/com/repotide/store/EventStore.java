package com.repotide.store;

import com.repotide.exception.EventStoreUnavailableException;
import com.repotide.model.GitHubEvent;

import java.util.List;

/**
 * Append-only home for normalized events.
 *
 * No update or delete: an event is written once by the webhook receiver and
 * read many times by the feed.
 */
public interface EventStore {

    int MIN_LIMIT = 1;
    int MAX_LIMIT = 100;

    /**
     * Persists one event, all or nothing.
     *
     * @param deliveryId GitHub's delivery GUID, or null when the sender gave none
     * @throws EventStoreUnavailableException if the backend cannot take the write
     */
    void append(GitHubEvent event, String deliveryId);

    default void append(GitHubEvent event) {
        append(event, null);
    }

    /**
     * Up to {@code limit} most recently appended events, newest first.
     * {@code limit} is clamped to [{@value #MIN_LIMIT}, {@value #MAX_LIMIT}].
     *
     * @throws EventStoreUnavailableException if the backend cannot be read
     */
    List<GitHubEvent> recent(int limit);

    boolean isAvailable();

    static int clampLimit(int limit) {
        return Math.min(Math.max(MIN_LIMIT, limit), MAX_LIMIT);
    }
}
