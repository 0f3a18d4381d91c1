package com.repotide.controller;

import com.repotide.dto.HealthResponse;
import com.repotide.store.EventStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequiredArgsConstructor
@Slf4j
public class HealthController {

    private final EventStore eventStore;

    @GetMapping("/health")
    public ResponseEntity<HealthResponse> health() {
        if (eventStore.isAvailable()) {
            return ResponseEntity.ok(new HealthResponse("healthy", "connected"));
        }
        log.error("Health check failed: event store unreachable");
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                .body(new HealthResponse("unhealthy", "disconnected"));
    }
}
