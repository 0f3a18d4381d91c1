package com.repotide.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.repotide.exception.MalformedPayloadException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class GitHubEventTest {

    private static final String TS = "29 January 2026 - 04:30 PM UTC";

    @Test
    @DisplayName("PUSH drops any from_branch it is given")
    void push_dropsFromBranch() {
        GitHubEvent event = GitHubEvent.of("abc123", "testuser", EventAction.PUSH, "main", "main", TS);

        assertNull(event.getFromBranch());
        assertEquals("main", event.getToBranch());
    }

    @Test
    @DisplayName("PULL_REQUEST requires from_branch")
    void pullRequest_requiresFromBranch() {
        MalformedPayloadException e = assertThrows(MalformedPayloadException.class,
                () -> GitHubEvent.of("42", "testuser", EventAction.PULL_REQUEST, " ", "main", TS));
        assertEquals("from_branch", e.getField());
    }

    @Test
    @DisplayName("to_branch must not be blank")
    void toBranch_required() {
        MalformedPayloadException e = assertThrows(MalformedPayloadException.class,
                () -> GitHubEvent.push("abc123", "testuser", "", TS));
        assertEquals("to_branch", e.getField());
    }

    @Test
    @DisplayName("A branch longer than the column width is rejected as malformed")
    void toBranch_tooLong() {
        String longBranch = "feature/" + "x".repeat(GitHubEvent.MAX_FIELD_LENGTH);

        MalformedPayloadException e = assertThrows(MalformedPayloadException.class,
                () -> GitHubEvent.push("abc123", "testuser", longBranch, TS));
        assertEquals("to_branch", e.getField());
    }

    @Test
    @DisplayName("A field exactly at the column width is accepted")
    void fieldAtMaxLength() {
        String branch = "b".repeat(GitHubEvent.MAX_FIELD_LENGTH);

        assertEquals(branch, GitHubEvent.push("abc123", "testuser", branch, TS).getToBranch());
    }

    @Test
    @DisplayName("action must be present")
    void action_required() {
        assertThrows(MalformedPayloadException.class,
                () -> GitHubEvent.of("42", "testuser", null, "feature", "main", TS));
    }

    @Test
    @DisplayName("JSON uses snake_case keys and omits from_branch for PUSH")
    void json_pushShape() {
        JsonNode json = new ObjectMapper().valueToTree(GitHubEvent.push("abc123", "testuser", "main", TS));

        assertEquals("abc123", json.get("request_id").asText());
        assertEquals("testuser", json.get("author").asText());
        assertEquals("PUSH", json.get("action").asText());
        assertEquals("main", json.get("to_branch").asText());
        assertEquals(TS, json.get("timestamp").asText());
        assertFalse(json.has("from_branch"));
        assertEquals(5, json.size());
    }

    @Test
    @DisplayName("JSON for MERGE carries all six fields")
    void json_mergeShape() {
        JsonNode json = new ObjectMapper().valueToTree(
                GitHubEvent.of("42", "testuser", EventAction.MERGE, "feature", "main", TS));

        assertEquals("feature", json.get("from_branch").asText());
        assertEquals("MERGE", json.get("action").asText());
        assertEquals(6, json.size());
    }
}
