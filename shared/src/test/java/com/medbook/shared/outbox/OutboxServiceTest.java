package com.medbook.shared.outbox;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.medbook.shared.events.EventTypes;
import com.medbook.shared.events.Events.DeliveryRequestedEvent;
import com.medbook.shared.events.Events.OrderLine;
import com.medbook.shared.events.Events.OrderPlacedEvent;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class OutboxServiceTest {

    @Mock OutboxRepository outboxRepository;

    final ObjectMapper objectMapper = new ObjectMapper();
    OutboxService outboxService;

    @BeforeEach
    void setUp() {
        outboxService = new OutboxService(outboxRepository, objectMapper);
        when(outboxRepository.save(any(OutboxEvent.class))).thenAnswer(inv -> {
            OutboxEvent event = inv.getArgument(0);
            event.setId(7);
            return event;
        });
    }

    @Test
    @DisplayName("publish — stores a PENDING row with the routing key and a snake_case JSON payload")
    void publish_shouldStorePendingRow() throws Exception {
        OutboxEvent stored = outboxService.publish(EventTypes.INVENTORY_RESERVE_ORDER,
                new OrderPlacedEvent(42, List.of(new OrderLine(3, 2), new OrderLine(5, 1))));

        ArgumentCaptor<OutboxEvent> captor = ArgumentCaptor.forClass(OutboxEvent.class);
        verify(outboxRepository).save(captor.capture());
        OutboxEvent saved = captor.getValue();

        assertThat(saved.getEventType()).isEqualTo("inventory.reserve_order");
        assertThat(saved.getStatus()).isEqualTo(OutboxStatus.PENDING);
        assertThat(stored.messageId()).isEqualTo("outbox-7");

        JsonNode payload = objectMapper.readTree(saved.getPayload());
        assertThat(payload.get("order_id").asInt()).isEqualTo(42);
        assertThat(payload.get("order_items")).hasSize(2);
        assertThat(payload.get("order_items").get(0).get("product_id").asInt()).isEqualTo(3);
        assertThat(payload.get("order_items").get(0).get("quantity").asInt()).isEqualTo(2);
    }

    @Test
    @DisplayName("publish — embeds an opaque JSON address as an object, not as a string")
    void publish_shouldEmbedAddressObject() throws Exception {
        JsonNode address = objectMapper.readTree("{\"patient_id\":9,\"street\":\"1 Main St\"}");

        outboxService.publish(EventTypes.DELIVERY_ORDER_REQUEST, new DeliveryRequestedEvent(42, "DELIVERY", address));

        ArgumentCaptor<OutboxEvent> captor = ArgumentCaptor.forClass(OutboxEvent.class);
        verify(outboxRepository).save(captor.capture());
        JsonNode payload = objectMapper.readTree(captor.getValue().getPayload());
        assertThat(payload.get("order_type").asText()).isEqualTo("DELIVERY");
        assertThat(payload.get("delivery_address").isObject()).isTrue();
        assertThat(payload.get("delivery_address").get("street").asText()).isEqualTo("1 Main St");
    }
}
