package com.repotide.controller;

import com.repotide.model.GitHubEvent;
import com.repotide.service.EventQueryService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * Polling feed for the dashboard.
 *
 * GET /api/events?limit=20
 * → [ {"request_id": "abc123", "author": "octocat", "action": "PUSH", ...}, ... ]
 *
 * Newest first; an empty store gives [] with 200.
 */
@RestController
@RequestMapping("/api/events")
@RequiredArgsConstructor
public class EventQueryController {

    private final EventQueryService queryService;

    // limit is taken as a String so garbage falls back to the default instead of a 400
    @GetMapping
    public ResponseEntity<List<GitHubEvent>> recent(
            @RequestParam(value = "limit", required = false) String limit) {
        return ResponseEntity.ok(queryService.recent(limit));
    }
}
