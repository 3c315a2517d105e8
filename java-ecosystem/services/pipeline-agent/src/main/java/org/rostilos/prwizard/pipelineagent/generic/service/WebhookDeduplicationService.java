package org.rostilos.prwizard.pipelineagent.generic.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Drops redelivered webhooks. GitHub retries a delivery with the same {@code X-GitHub-Delivery}
 * id, which would otherwise produce a second reply to the same comment.
 */
@Service
public class WebhookDeduplicationService {

    private static final Logger log = LoggerFactory.getLogger(WebhookDeduplicationService.class);

    /**
     * Time window in seconds to consider deliveries as duplicates.
     */
    static final long DEDUP_WINDOW_SECONDS = 600;

    private static final int CLEANUP_INTERVAL = 50;

    private final AtomicInteger cleanupCounter = new AtomicInteger(0);

    /**
     * Key: delivery id, value: when it was first seen.
     */
    private final Map<String, Instant> recentDeliveries = new ConcurrentHashMap<>();

    private final Clock clock;

    public WebhookDeduplicationService(Clock clock) {
        this.clock = clock;
    }

    /**
     * Check whether a delivery was already accepted. If not, records it.
     *
     * @return true if this is a duplicate and should be skipped
     */
    public boolean isDuplicateDelivery(String deliveryId, String eventType) {
        if (deliveryId == null || deliveryId.isBlank()) {
            return false;
        }
        Instant now = clock.instant();

        Instant firstSeen = recentDeliveries.putIfAbsent(deliveryId, now);
        if (firstSeen != null) {
            long age = now.getEpochSecond() - firstSeen.getEpochSecond();
            if (age < DEDUP_WINDOW_SECONDS) {
                log.info("Skipping duplicate delivery {} ({}), first seen {}s ago", deliveryId, eventType, age);
                return true;
            }
            recentDeliveries.put(deliveryId, now);
        }

        if (cleanupCounter.incrementAndGet() % CLEANUP_INTERVAL == 0) {
            recentDeliveries.entrySet().removeIf(e -> now.getEpochSecond() - e.getValue().getEpochSecond() > DEDUP_WINDOW_SECONDS);
        }
        return false;
    }
}
