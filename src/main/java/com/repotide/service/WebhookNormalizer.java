package com.repotide.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.repotide.exception.MalformedPayloadException;
import com.repotide.exception.UnsupportedEventTypeException;
import com.repotide.model.EventAction;
import com.repotide.model.GitHubEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Maps raw GitHub webhook payloads onto {@link GitHubEvent}.
 *
 * HOW IT WORKS:
 *   1. Reject event types with no row in {@link WebhookMappingRule}
 *   2. Read the payload's "action" and "pull_request.merged" fields
 *   3. Look up the matching rule → no match means the delivery is ignored
 *   4. Derive the six canonical fields for that rule's action
 *
 * Field sources:
 *   PUSH          author=pusher.name, request_id=head_commit.id (or after),
 *                 to_branch=ref minus "refs/heads/", timestamp=head_commit.timestamp
 *   PULL_REQUEST  author=pull_request.user.login, request_id=number,
 *                 from_branch=pull_request.head.ref, to_branch=pull_request.base.ref,
 *                 timestamp=pull_request.updated_at (or created_at)
 *   MERGE         as PULL_REQUEST, timestamp=pull_request.merged_at (or updated_at)
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class WebhookNormalizer {

    static final String BRANCH_REF_PREFIX = "refs/heads/";

    private final GitHubTimestampFormatter timestampFormatter;

    public NormalizationResult normalize(String eventType, JsonNode payload) {
        if (!WebhookMappingRule.isSupportedEventType(eventType)) {
            throw new UnsupportedEventTypeException(eventType);
        }
        if (payload == null || !payload.isObject()) {
            throw new MalformedPayloadException("body", "Invalid or empty JSON payload");
        }

        String subAction = payload.path("action").asText("");
        boolean merged = payload.path("pull_request").path("merged").asBoolean(false);

        Optional<WebhookMappingRule> rule = WebhookMappingRule.match(eventType, subAction, merged);
        if (rule.isEmpty()) {
            log.debug("No mapping for {} action '{}' (merged={})", eventType, subAction, merged);
            return NormalizationResult.ignored(
                    String.format("Pull request action \"%s\" not tracked", subAction));
        }

        EventAction action = rule.get().getAction();
        GitHubEvent event = switch (action) {
            case PUSH -> fromPush(payload);
            case PULL_REQUEST, MERGE -> fromPullRequest(payload, action);
        };
        return NormalizationResult.normalized(event);
    }

    private GitHubEvent fromPush(JsonNode payload) {
        String ref = requireText(payload, "ref");
        String commitId = text(payload, "head_commit", "id")
                .or(() -> text(payload, "after"))
                .orElseThrow(() -> MalformedPayloadException.missing("head_commit.id"));
        String pusher = requireText(payload, "pusher", "name");
        String timestamp = timestampFormatter.format(
                text(payload, "head_commit", "timestamp").orElse(null));

        return GitHubEvent.push(commitId, pusher, branchName(ref), timestamp);
    }

    private GitHubEvent fromPullRequest(JsonNode payload, EventAction action) {
        JsonNode pullRequest = payload.path("pull_request");
        if (!pullRequest.isObject()) {
            throw MalformedPayloadException.missing("pull_request");
        }

        String number = text(payload, "number")
                .or(() -> text(pullRequest, "number"))
                .orElseThrow(() -> MalformedPayloadException.missing("number"));
        String author = requireText(payload, "pull_request", "user", "login");
        String fromBranch = requireText(payload, "pull_request", "head", "ref");
        String toBranch = requireText(payload, "pull_request", "base", "ref");

        Optional<String> updatedAt = text(pullRequest, "updated_at");
        Optional<String> source = action == EventAction.MERGE
                ? text(pullRequest, "merged_at").or(() -> updatedAt)
                : updatedAt.or(() -> text(pullRequest, "created_at"));

        return GitHubEvent.of(number, author, action, fromBranch, toBranch,
                timestampFormatter.format(source.orElse(null)));
    }

    /** "refs/heads/feature/x" → "feature/x"; other refs (tags) are kept as-is. */
    static String branchName(String ref) {
        return ref.startsWith(BRANCH_REF_PREFIX) ? ref.substring(BRANCH_REF_PREFIX.length()) : ref;
    }

    private static String requireText(JsonNode node, String... path) {
        return text(node, path)
                .orElseThrow(() -> MalformedPayloadException.missing(String.join(".", path)));
    }

    private static Optional<String> text(JsonNode node, String... path) {
        JsonNode target = node;
        for (String p : path) {
            target = target.path(p);
        }
        if (!target.isValueNode() || target.isNull()) {
            return Optional.empty();
        }
        String value = target.asText();
        return value.isBlank() ? Optional.empty() : Optional.of(value);
    }
}
