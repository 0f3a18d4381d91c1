package com.repotide.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Centralizes the service's tunables.
 *
 * Bound from application.yml under "repotide" prefix:
 *   repotide:
 *     query:
 *       default-limit: 10
 *     dedup:
 *       enabled: true
 *       ttl: 24h
 *     cors:
 *       allowed-origins: "*"
 */
@Component
@ConfigurationProperties(prefix = "repotide")
@Getter
@Setter
public class RepoTideProperties {

    private Query query = new Query();
    private Dedup dedup = new Dedup();
    private Cors cors = new Cors();

    @Getter
    @Setter
    public static class Query {
        /** Used when the caller omits ?limit or sends something unusable. */
        private int defaultLimit = 10;
    }

    @Getter
    @Setter
    public static class Dedup {
        private boolean enabled = true;
        private Duration ttl = Duration.ofHours(24);
    }

    @Getter
    @Setter
    public static class Cors {
        private List<String> allowedOrigins = new ArrayList<>(List.of("*"));
    }
}
