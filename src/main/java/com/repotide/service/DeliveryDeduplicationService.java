package com.repotide.service;

import com.repotide.config.RepoTideProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

/**
 * Drops GitHub redeliveries using Redis.
 *
 * HOW IT WORKS:
 *   1. Every webhook carries a unique X-GitHub-Delivery GUID
 *   2. isDuplicate(deliveryId) tries to SET "repotide:delivery:{deliveryId}" with NX
 *   3. If the SET succeeds → first time we see this delivery, return false
 *   4. If the SET fails    → already stored once, return true
 *
 * Keys expire after repotide.dedup.ttl (24h by default).
 * If Redis itself is unreachable the delivery is treated as new.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class DeliveryDeduplicationService {

    static final String DEDUP_PREFIX = "repotide:delivery:";

    private final StringRedisTemplate redisTemplate;
    private final RepoTideProperties properties;

    /**
     * Returns true if this delivery has already been accepted, false if new.
     */
    public boolean isDuplicate(String deliveryId) {
        if (!properties.getDedup().isEnabled() || deliveryId == null || deliveryId.isBlank()) {
            return false; // No delivery id = can't dedup, accept it
        }

        String key = DEDUP_PREFIX + deliveryId;
        try {
            Boolean wasSet = redisTemplate.opsForValue()
                    .setIfAbsent(key, "1", properties.getDedup().getTtl());

            if (Boolean.TRUE.equals(wasSet)) {
                return false;
            }
            log.warn("Duplicate delivery detected: {}", deliveryId);
            return true;
        } catch (DataAccessException e) {
            log.warn("Dedup check skipped for delivery {}, Redis unavailable: {}",
                    deliveryId, e.getMessage());
            return false;
        }
    }

    /**
     * Forgets a delivery so GitHub's redelivery of it is accepted.
     * Used when the event could not be stored after the dedup key was set.
     */
    public void release(String deliveryId) {
        if (!properties.getDedup().isEnabled() || deliveryId == null || deliveryId.isBlank()) {
            return;
        }
        try {
            redisTemplate.delete(DEDUP_PREFIX + deliveryId);
            log.info("Released dedup key for delivery {}", deliveryId);
        } catch (DataAccessException e) {
            log.warn("Could not release dedup key for delivery {}: {}", deliveryId, e.getMessage());
        }
    }
}
