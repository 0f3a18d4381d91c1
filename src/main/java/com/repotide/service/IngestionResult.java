package com.repotide.service;

import com.repotide.model.GitHubEvent;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * Outcome of one webhook delivery.
 * STORED       → a new event was appended
 * SKIPPED      → nothing stored: untracked action, unsupported type or redelivery
 * ACKNOWLEDGED → GitHub's ping after the hook was configured
 */
@Getter
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class IngestionResult {

    public enum Outcome { STORED, SKIPPED, ACKNOWLEDGED }

    private final Outcome outcome;
    private final String message;
    private final GitHubEvent event;

    public static IngestionResult stored(GitHubEvent event) {
        return new IngestionResult(Outcome.STORED, "Event processed and stored", event);
    }

    public static IngestionResult skipped(String message) {
        return new IngestionResult(Outcome.SKIPPED, message, null);
    }

    public static IngestionResult acknowledged(String message) {
        return new IngestionResult(Outcome.ACKNOWLEDGED, message, null);
    }
}
