package com.repotide.service;

import com.repotide.config.RepoTideProperties;
import com.repotide.model.GitHubEvent;
import com.repotide.store.EventStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.regex.Pattern;

/**
 * Backs the dashboard's polling feed.
 *
 * limit handling:
 *   absent / non-numeric / zero / negative → repotide.query.default-limit (10)
 *   above 100 (including beyond int range) → 100
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class EventQueryService {

    private static final Pattern POSITIVE_DIGITS = Pattern.compile("\\+?\\d+");

    private final EventStore eventStore;
    private final RepoTideProperties properties;

    public List<GitHubEvent> recent(String rawLimit) {
        int limit = resolveLimit(rawLimit);
        List<GitHubEvent> events = eventStore.recent(limit);
        log.info("Retrieved {} events (limit={})", events.size(), limit);
        return events;
    }

    int resolveLimit(String rawLimit) {
        int defaultLimit = properties.getQuery().getDefaultLimit();
        if (rawLimit == null || rawLimit.isBlank()) {
            return EventStore.clampLimit(defaultLimit);
        }
        String trimmed = rawLimit.trim();
        try {
            int requested = Integer.parseInt(trimmed);
            return EventStore.clampLimit(requested > 0 ? requested : defaultLimit);
        } catch (NumberFormatException e) {
            // Digits too large for an int are still a numeric request: cap them
            if (POSITIVE_DIGITS.matcher(trimmed).matches()) {
                return EventStore.MAX_LIMIT;
            }
            log.debug("Ignoring unparsable limit '{}'", rawLimit);
            return EventStore.clampLimit(defaultLimit);
        }
    }
}
