package com.repotide.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.repotide.exception.MalformedPayloadException;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * The canonical activity record every supported webhook is normalized into.
 *
 * Example JSON (pull request):
 * {
 *   "request_id":  "42",
 *   "author":      "octocat",
 *   "action":      "PULL_REQUEST",
 *   "from_branch": "feature",
 *   "to_branch":   "main",
 *   "timestamp":   "29 January 2026 - 04:30 PM UTC"
 * }
 *
 * - request_id:  head commit SHA for PUSH, pull request number for PULL_REQUEST / MERGE
 * - from_branch: omitted entirely for PUSH
 * - timestamp:   always rendered in UTC by GitHubTimestampFormatter
 *
 * Instances are immutable and only created through {@link #of}, which rejects
 * anything that would break those rules or not fit in a {@link StoredEvent} column.
 */
@Getter
@EqualsAndHashCode
@ToString
@AllArgsConstructor(access = AccessLevel.PRIVATE)
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"request_id", "author", "action", "from_branch", "to_branch", "timestamp"})
public final class GitHubEvent {

    /** Column width of every text field in github_events. */
    public static final int MAX_FIELD_LENGTH = 255;

    @JsonProperty("request_id")
    private final String requestId;

    @JsonProperty("author")
    private final String author;

    @JsonProperty("action")
    private final EventAction action;

    @JsonProperty("from_branch")
    private final String fromBranch;

    @JsonProperty("to_branch")
    private final String toBranch;

    @JsonProperty("timestamp")
    private final String timestamp;

    public static GitHubEvent of(String requestId, String author, EventAction action,
                                 String fromBranch, String toBranch, String timestamp) {
        if (action == null) {
            throw new MalformedPayloadException("action", "action is required");
        }
        requireText("request_id", requestId);
        requireText("author", author);
        requireText("to_branch", toBranch);
        requireText("timestamp", timestamp);

        // A push has no source branch distinct from the one it lands on
        if (action == EventAction.PUSH) {
            return new GitHubEvent(requestId, author, action, null, toBranch, timestamp);
        }
        requireText("from_branch", fromBranch);
        return new GitHubEvent(requestId, author, action, fromBranch, toBranch, timestamp);
    }

    public static GitHubEvent push(String commitId, String pusher, String branch, String timestamp) {
        return of(commitId, pusher, EventAction.PUSH, null, branch, timestamp);
    }

    private static void requireText(String field, String value) {
        if (value == null || value.isBlank()) {
            throw new MalformedPayloadException(field, field + " is required");
        }
        if (value.length() > MAX_FIELD_LENGTH) {
            throw new MalformedPayloadException(field,
                    field + " exceeds " + MAX_FIELD_LENGTH + " characters");
        }
    }
}
