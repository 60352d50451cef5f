package com.medbook.shared.kafka;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.common.header.internals.RecordHeader;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Kafka producer for already-serialized JSON payloads.
 *
 * Wraps Spring's KafkaTemplate with:
 *  - string headers attached to each record
 *  - Micrometer metrics (publish count by status, publish latency)
 *  - structured logging of topic / key / offset
 *
 * The underlying KafkaTemplate is configured as an idempotent producer
 * (enable.idempotence=true), so broker-side retries never duplicate a record.
 */
@Slf4j
@Component
public class EventPublisher {

    private static final long SEND_TIMEOUT_SECONDS = 10;

    private final KafkaTemplate<String, String> kafkaTemplate;
    private final Counter publishSuccessCounter;
    private final Counter publishErrorCounter;
    private final Timer publishTimer;

    public EventPublisher(KafkaTemplate<String, String> kafkaTemplate, MeterRegistry meterRegistry) {
        this.kafkaTemplate = kafkaTemplate;
        this.publishSuccessCounter = Counter.builder("kafka.messages.published")
                .tag("status", "success")
                .description("Total Kafka messages published successfully")
                .register(meterRegistry);
        this.publishErrorCounter = Counter.builder("kafka.messages.published")
                .tag("status", "error")
                .description("Total Kafka message publish failures")
                .register(meterRegistry);
        this.publishTimer = Timer.builder("kafka.publish.duration")
                .description("Time to publish a message to Kafka")
                .register(meterRegistry);
    }

    /**
     * Publish a JSON payload asynchronously.
     *
     * @param topic   Kafka topic
     * @param key     partition key; records sharing a key keep their relative order
     * @param payload serialized JSON body
     * @param headers string headers added to the record
     * @return future completed when the broker acknowledges
     */
    public CompletableFuture<SendResult<String, String>> publish(String topic, String key, String payload,
                                                                 Map<String, String> headers) {
        Timer.Sample sample = Timer.start();
        ProducerRecord<String, String> record = new ProducerRecord<>(topic, key, payload);
        headers.forEach((name, value) ->
                record.headers().add(new RecordHeader(name, value.getBytes(StandardCharsets.UTF_8))));

        return kafkaTemplate.send(record)
                .whenComplete((result, ex) -> {
                    sample.stop(publishTimer);
                    if (ex == null) {
                        publishSuccessCounter.increment();
                        log.debug("Message published: topic={}, key={}, partition={}, offset={}",
                                topic, key,
                                result.getRecordMetadata().partition(),
                                result.getRecordMetadata().offset());
                    } else {
                        publishErrorCounter.increment();
                        log.error("Failed to publish message: topic={}, key={}, error={}",
                                topic, key, ex.getMessage());
                    }
                });
    }

    /**
     * Synchronous publish: blocks until the broker acknowledges or the send times out.
     *
     * @throws EventPublishException when the send fails, times out or the thread is interrupted
     */
    public void publishAndWait(String topic, String key, String payload, Map<String, String> headers) {
        try {
            publish(topic, key, payload, headers).get(SEND_TIMEOUT_SECONDS, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new EventPublishException("Interrupted while publishing to " + topic, e);
        } catch (ExecutionException | TimeoutException e) {
            throw new EventPublishException("Failed to publish message to " + topic, e);
        } catch (RuntimeException e) {
            throw new EventPublishException("Failed to publish message to " + topic, e);
        }
    }

    public static class EventPublishException extends RuntimeException {
        public EventPublishException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
