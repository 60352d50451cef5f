package com.medbook.order.consumer;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.medbook.order.domain.Order;
import com.medbook.order.service.OrderCommandService;
import com.medbook.shared.events.EventTypes;
import com.medbook.shared.events.Events.*;
import com.medbook.shared.kafka.IdempotencyService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.common.header.Header;
import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.kafka.support.Acknowledgment;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;

/**
 * Order Service Kafka Consumers
 *
 * Inventory and delivery report back on the orders.* topics; each report moves one order.
 *
 * Manual acknowledgment (AckMode.MANUAL_IMMEDIATE): the offset is committed only after the
 * status update has committed. If the handler throws, the message is redelivered by the
 * container's error handler.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class OrderEventConsumer {

    private final OrderCommandService commandService;
    private final IdempotencyService idempotencyService;
    private final ObjectMapper objectMapper;

    @KafkaListener(topics = EventTypes.ORDER_RESERVED, containerFactory = "kafkaListenerContainerFactory")
    public void onOrderReserved(ConsumerRecord<String, String> record, Acknowledgment ack) {
        processEvent(record, ack, payload -> {
            OrderReservedEvent event = objectMapper.readValue(payload, OrderReservedEvent.class);
            return commandService.updateStatus(event.getOrderId(), Order.Status.RESERVED);
        });
    }

    @KafkaListener(topics = EventTypes.ORDER_REJECTED, containerFactory = "kafkaListenerContainerFactory")
    public void onOrderRejected(ConsumerRecord<String, String> record, Acknowledgment ack) {
        processEvent(record, ack, payload -> {
            OrderRejectedEvent event = objectMapper.readValue(payload, OrderRejectedEvent.class);
            return commandService.updateStatus(event.getOrderId(), Order.Status.REJECTED);
        });
    }

    @KafkaListener(topics = EventTypes.ORDER_CANCELLED, containerFactory = "kafkaListenerContainerFactory")
    public void onOrderCancelled(ConsumerRecord<String, String> record, Acknowledgment ack) {
        processEvent(record, ack, payload -> {
            OrderCancelledEvent event = objectMapper.readValue(payload, OrderCancelledEvent.class);
            return commandService.updateStatus(event.getOrderId(), Order.Status.CANCELLED);
        });
    }

    @KafkaListener(topics = EventTypes.DELIVERY_CREATED, containerFactory = "kafkaListenerContainerFactory")
    public void onDeliveryCreated(ConsumerRecord<String, String> record, Acknowledgment ack) {
        processEvent(record, ack, payload -> {
            DeliveryCreatedEvent event = objectMapper.readValue(payload, DeliveryCreatedEvent.class);
            return commandService.assignDelivery(event.getOrderId(), event.getDeliveryId());
        });
    }

    @KafkaListener(topics = EventTypes.DELIVERY_SUCCESS, containerFactory = "kafkaListenerContainerFactory")
    public void onDeliverySuccess(ConsumerRecord<String, String> record, Acknowledgment ack) {
        processEvent(record, ack, payload -> {
            DeliveryCompletedEvent event = objectMapper.readValue(payload, DeliveryCompletedEvent.class);
            return commandService.updateStatus(event.getOrderId(), Order.Status.DELIVERED);
        });
    }

    /**
     * Shared processing wrapper:
     * 1. Skip and ack if the event-id was already processed
     *    (messages without an event-id are processed unconditionally)
     * 2. Run the handler; its transaction commits before it returns.
     *    An unknown order is logged and acknowledged
     * 3. Mark the event-id processed, then ack the offset
     * 4. On failure: rethrow without marking or acking
     *
     * Every handler writes an absolute value (a status, a delivery id), so a message handled
     * twice after a crash between steps 2 and 3 leaves the order as it was.
     */
    void processEvent(ConsumerRecord<String, String> record, Acknowledgment ack, OrderUpdate handler) {
        String topic = record.topic();
        String eventId = extractHeader(record, EventTypes.HEADER_EVENT_ID);

        if (eventId != null && idempotencyService.isProcessed(topic, eventId)) {
            ack.acknowledge();
            return;
        }

        try {
            if (!handler.apply(record.value())) {
                log.warn("Event references unknown order, skipped: topic={}, eventId={}, offset={}",
                        topic, eventId, record.offset());
            }
        } catch (Exception ex) {
            log.error("Failed to process event: topic={}, eventId={}, error={}", topic, eventId, ex.getMessage(), ex);
            throw new EventProcessingException("Event processing failed on " + topic, ex);
        }

        if (eventId != null) idempotencyService.markProcessed(topic, eventId);
        ack.acknowledge();
        log.debug("Event processed: topic={}, eventId={}, partition={}, offset={}",
                topic, eventId, record.partition(), record.offset());
    }

    private static String extractHeader(ConsumerRecord<?, ?> record, String headerName) {
        Header header = record.headers().lastHeader(headerName);
        return header != null ? new String(header.value(), StandardCharsets.UTF_8) : null;
    }

    /** Applies a payload to an order; false when the order does not exist. */
    @FunctionalInterface
    interface OrderUpdate {
        boolean apply(String payload) throws Exception;
    }

    public static class EventProcessingException extends RuntimeException {
        public EventProcessingException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
