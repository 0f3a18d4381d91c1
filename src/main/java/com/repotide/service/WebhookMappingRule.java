package com.repotide.service;

import com.repotide.model.EventAction;
import lombok.Getter;

import java.util.Arrays;
import java.util.Optional;

/**
 * Decision table from (X-GitHub-Event, payload action, merged flag) to the
 * canonical action. A null sub-action or merged value matches anything.
 *
 *   push          *            *      → PUSH
 *   pull_request  opened       false  → PULL_REQUEST
 *   pull_request  edited       false  → PULL_REQUEST
 *   pull_request  reopened     false  → PULL_REQUEST
 *   pull_request  synchronize  false  → PULL_REQUEST
 *   pull_request  closed       true   → MERGE
 *
 * Anything without a row (e.g. closed without merge, labeled, assigned) is ignored.
 */
@Getter
public enum WebhookMappingRule {

    PUSH("push", null, null, EventAction.PUSH),
    PULL_REQUEST_OPENED("pull_request", "opened", false, EventAction.PULL_REQUEST),
    PULL_REQUEST_EDITED("pull_request", "edited", false, EventAction.PULL_REQUEST),
    PULL_REQUEST_REOPENED("pull_request", "reopened", false, EventAction.PULL_REQUEST),
    PULL_REQUEST_SYNCHRONIZED("pull_request", "synchronize", false, EventAction.PULL_REQUEST),
    PULL_REQUEST_MERGED("pull_request", "closed", true, EventAction.MERGE);

    private final String eventType;
    private final String subAction;
    private final Boolean merged;
    private final EventAction action;

    WebhookMappingRule(String eventType, String subAction, Boolean merged, EventAction action) {
        this.eventType = eventType;
        this.subAction = subAction;
        this.merged = merged;
        this.action = action;
    }

    public static Optional<WebhookMappingRule> match(String eventType, String subAction, boolean merged) {
        return Arrays.stream(values())
                .filter(rule -> rule.matches(eventType, subAction, merged))
                .findFirst();
    }

    public static boolean isSupportedEventType(String eventType) {
        return Arrays.stream(values()).anyMatch(rule -> rule.eventType.equals(eventType));
    }

    private boolean matches(String eventType, String subAction, boolean merged) {
        return this.eventType.equals(eventType)
                && (this.subAction == null || this.subAction.equals(subAction))
                && (this.merged == null || this.merged == merged);
    }
}
