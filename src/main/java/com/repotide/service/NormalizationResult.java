package com.repotide.service;

import com.repotide.model.GitHubEvent;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;

import java.util.Optional;

/**
 * What the normalizer made of a payload: either a canonical event to store,
 * or the reason this delivery is not tracked.
 */
@Getter
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class NormalizationResult {

    private final GitHubEvent event;
    private final String reason;

    public static NormalizationResult normalized(GitHubEvent event) {
        return new NormalizationResult(event, null);
    }

    public static NormalizationResult ignored(String reason) {
        return new NormalizationResult(null, reason);
    }

    public boolean isIgnored() {
        return event == null;
    }

    public Optional<GitHubEvent> asEvent() {
        return Optional.ofNullable(event);
    }
}
