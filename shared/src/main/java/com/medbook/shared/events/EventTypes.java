package com.medbook.shared.events;

/**
 * Routing keys exchanged between the order service and its neighbours.
 * The outbox stores these as event_type; the relay uses them as the Kafka topic.
 */
public final class EventTypes {

    private EventTypes() {}

    // ─── Outbound (order service → inventory / delivery) ───────────────────

    public static final String INVENTORY_RESERVE_ORDER = "inventory.reserve_order";
    public static final String INVENTORY_CANCEL_ORDER  = "inventory.cancel_order";
    public static final String DELIVERY_ORDER_REQUEST  = "delivery.order_request";

    // ─── Inbound (inventory / delivery → order service) ────────────────────

    public static final String ORDER_RESERVED   = "orders.order_reserved";
    public static final String ORDER_REJECTED   = "orders.order_rejected";
    public static final String ORDER_CANCELLED  = "orders.order_cancelled";
    public static final String DELIVERY_CREATED = "orders.delivery_created";
    public static final String DELIVERY_SUCCESS = "orders.delivery_success";

    // ─── Kafka headers ─────────────────────────────────────────────────────

    public static final String HEADER_EVENT_TYPE = "event-type";
    public static final String HEADER_EVENT_ID   = "event-id";
}
