package com.medbook.shared.kafka;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Redis-backed deduplication of consumed messages.
 *
 * Kafka delivers at least once, and the outbox relay may republish a row whose
 * PUBLISHED mark was lost. The consumer checks the event-id before handling a message and
 * marks it only after its database work has committed. A crash in between leaves the
 * event unmarked, so the redelivery is handled again; handlers must be safe to repeat.
 *
 * Key format:  processed:{topic}:{eventId}
 * TTL:         24 hours
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class IdempotencyService {

    private static final String KEY_PREFIX = "processed:";
    private static final Duration DEFAULT_TTL = Duration.ofHours(24);

    private final StringRedisTemplate redisTemplate;

    /**
     * @return true if the event was handled before and must be skipped
     */
    public boolean isProcessed(String topic, String eventId) {
        boolean processed = Boolean.TRUE.equals(redisTemplate.hasKey(key(topic, eventId)));
        if (processed) {
            log.debug("Duplicate message skipped: topic={}, eventId={}", topic, eventId);
        }
        return processed;
    }

    public void markProcessed(String topic, String eventId) {
        redisTemplate.opsForValue().set(key(topic, eventId), "1", DEFAULT_TTL);
    }

    private static String key(String topic, String eventId) {
        return KEY_PREFIX + topic + ":" + eventId;
    }
}
