package com.medbook.shared.outbox;

import com.medbook.shared.events.EventTypes;
import com.medbook.shared.kafka.EventPublisher;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Map;

/**
 * Outbox relay: polls the outbox table and publishes pending rows to Kafka.
 *
 * Each poll locks up to {@code medbook.outbox.batch-size} rows (oldest first) and publishes them
 * one by one, waiting for the broker acknowledgement before marking a row PUBLISHED. The first
 * failure ends the poll: the failed row and everything after it stay PENDING and are retried on
 * the next tick, which keeps per-table publication order intact.
 */
@Slf4j
@Service
public class OutboxRelayService {

    private final OutboxRepository outboxRepository;
    private final EventPublisher eventPublisher;
    private final OutboxProperties properties;
    private final Counter relayedCounter;
    private final Counter relayErrorCounter;

    public OutboxRelayService(OutboxRepository outboxRepository,
                              EventPublisher eventPublisher,
                              OutboxProperties properties,
                              MeterRegistry meterRegistry) {
        this.outboxRepository = outboxRepository;
        this.eventPublisher = eventPublisher;
        this.properties = properties;
        this.relayedCounter = Counter.builder("outbox.records.relayed")
                .description("Outbox records successfully relayed to Kafka")
                .register(meterRegistry);
        this.relayErrorCounter = Counter.builder("outbox.relay.errors")
                .description("Outbox relay failures")
                .register(meterRegistry);
    }

    @Scheduled(fixedDelayString = "${medbook.outbox.relay-interval-ms:1000}")
    @Transactional
    public void relayPendingEvents() {
        List<OutboxEvent> batch = outboxRepository.lockPendingBatch(properties.getBatchSize());
        if (batch.isEmpty()) return;

        log.debug("Relaying {} outbox events", batch.size());
        int relayed = 0;
        for (OutboxEvent event : batch) {
            try {
                eventPublisher.publishAndWait(
                        event.getEventType(),
                        String.valueOf(event.getId()),
                        event.getPayload(),
                        Map.of(EventTypes.HEADER_EVENT_TYPE, event.getEventType(),
                               EventTypes.HEADER_EVENT_ID, event.messageId()));
            } catch (EventPublisher.EventPublishException ex) {
                log.error("Failed to relay outbox event: id={}, type={}; {} remaining rows stay pending",
                        event.getId(), event.getEventType(), batch.size() - relayed, ex);
                relayErrorCounter.increment();
                break;
            }
            event.markPublished();
            relayedCounter.increment();
            relayed++;
        }

        if (relayed > 0) {
            outboxRepository.saveAll(batch.subList(0, relayed));
        }
    }
}
