package com.medbook.shared.events;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.UUID;

/**
 * Event payloads. All payloads are flat JSON objects with snake_case keys,
 * independent of how the surrounding ObjectMapper is configured.
 */
public final class Events {

    private Events() {}

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public static class OrderLine {
        private Integer productId;
        private Integer quantity;
    }

    // ─── Outbound ──────────────────────────────────────────────────────────

    /** Asks inventory to reserve stock for every line of a freshly placed order. */
    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public static class OrderPlacedEvent {
        private Integer orderId;
        private List<OrderLine> orderItems;
    }

    /** Asks inventory to release the reservation of a cancelled order. */
    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public static class OrderCancellationRequestedEvent {
        private Integer orderId;
        private List<OrderLine> orderItems;
    }

    /** Asks delivery to ship (or prepare for pickup) a paid order. */
    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public static class DeliveryRequestedEvent {
        private Integer orderId;
        private String orderType;
        private JsonNode deliveryAddress;
    }

    // ─── Inbound ───────────────────────────────────────────────────────────

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public static class OrderReservedEvent {
        private Integer orderId;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public static class OrderRejectedEvent {
        private Integer orderId;
    }

    /** Inventory confirms a cancellation has been released. */
    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public static class OrderCancelledEvent {
        private Integer orderId;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public static class DeliveryCreatedEvent {
        private Integer orderId;
        private UUID deliveryId;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public static class DeliveryCompletedEvent {
        private Integer orderId;
    }
}
