package com.repotide.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.repotide.model.GitHubEvent;
import lombok.*;

/**
 * Body returned to webhook senders and on API errors.
 *
 *   {"status": "success", "message": "Event processed and stored", "event": {...}}
 *   {"status": "skipped", "message": "Pull request action \"closed\" not tracked"}
 *   {"status": "error",   "message": "Missing required field: ref"}
 */
@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class WebhookResponse {

    public static final String SUCCESS = "success";
    public static final String SKIPPED = "skipped";
    public static final String ERROR = "error";

    private String status;
    private String message;
    private GitHubEvent event;

    public static WebhookResponse success(String message, GitHubEvent event) {
        return new WebhookResponse(SUCCESS, message, event);
    }

    public static WebhookResponse skipped(String message) {
        return new WebhookResponse(SKIPPED, message, null);
    }

    public static WebhookResponse error(String message) {
        return new WebhookResponse(ERROR, message, null);
    }
}
