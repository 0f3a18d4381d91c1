package com.repotide.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Locale;

/**
 * Renders GitHub's ISO-8601 timestamps for the feed.
 *
 *   "2026-01-29T22:30:00Z"      → "29 January 2026 - 10:30 PM UTC"
 *   "2026-01-29T17:30:00-05:00" → "29 January 2026 - 10:30 PM UTC"
 *   "2026-01-29T22:30:00"       → "29 January 2026 - 10:30 PM UTC" (no offset = UTC)
 *
 * Push payloads carry the committer's local offset, pull request payloads
 * use Z; both end up in UTC. A missing or unreadable value falls back to the
 * current time so a single odd field never loses the whole event.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class GitHubTimestampFormatter {

    static final DateTimeFormatter DISPLAY_FORMAT = DateTimeFormatter
            .ofPattern("dd MMMM yyyy - hh:mm a 'UTC'", Locale.ENGLISH)
            .withZone(ZoneOffset.UTC);

    private final Clock clock;

    public String format(String isoTimestamp) {
        return DISPLAY_FORMAT.format(parseOrNow(isoTimestamp));
    }

    private Instant parseOrNow(String isoTimestamp) {
        if (isoTimestamp == null || isoTimestamp.isBlank()) {
            log.warn("No source timestamp in payload, using current time");
            return clock.instant();
        }
        String trimmed = isoTimestamp.trim();
        try {
            return OffsetDateTime.parse(trimmed).toInstant();
        } catch (DateTimeParseException e) {
            log.debug("No offset in timestamp '{}', reading it as UTC", trimmed);
        }
        try {
            return LocalDateTime.parse(trimmed).toInstant(ZoneOffset.UTC);
        } catch (DateTimeParseException e) {
            log.warn("Error parsing timestamp '{}': {}", isoTimestamp, e.getMessage());
            return clock.instant();
        }
    }
}
