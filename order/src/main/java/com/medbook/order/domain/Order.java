package com.medbook.order.domain;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonRawValue;
import com.medbook.shared.persistence.AuditedEntity;
import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.Instant;
import java.util.UUID;

/**
 * Order placed from a cart.
 *
 * Status is driven partly by the patient (checkout, payment, cancel) and partly by the
 * inventory and delivery services through Kafka:
 * <pre>
 *   PENDING ──reserved──▶ RESERVED ──pay──▶ PAYMENT_PENDING ──paid──▶ DELIVERY_PENDING ──▶ DELIVERED
 *      │                     │
 *      └──rejected──▶ REJECTED  └──cancel──▶ CANCEL_PENDING ──released──▶ CANCELLED
 * </pre>
 * A cancelled order is soft-deleted: deleted_at is set and the row stays in place.
 */
@Entity
@Table(name = "orders")
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Order extends AuditedEntity {

    public enum Status {
        PENDING,
        RESERVED,
        REJECTED,
        PAYMENT_PENDING,
        DELIVERY_PENDING,
        DELIVERED,
        CANCEL_PENDING,
        CANCELLED
    }

    public enum Type {
        PICKUP,
        DELIVERY
    }

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Integer id;

    @Column(name = "cart_id", nullable = false)
    private Integer cartId;

    @Column(name = "patient_id", nullable = false)
    private Integer patientId;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false)
    @Builder.Default
    private Status status = Status.PENDING;

    @Enumerated(EnumType.STRING)
    @Column(name = "order_type", nullable = false)
    @Builder.Default
    private Type orderType = Type.PICKUP;

    @Column(name = "delivery_id")
    private UUID deliveryId;

    /** Address snapshot as returned by the delivery service; opaque to this service. */
    @JsonRawValue
    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "delivery_address", columnDefinition = "jsonb")
    private String deliveryAddress;

    @Column(name = "deleted_at")
    private Instant deletedAt;

    @JsonIgnore
    public boolean isActive() {
        return deletedAt == null;
    }

    public void cancel() {
        this.deletedAt = Instant.now();
        this.status = Status.CANCEL_PENDING;
    }
}
