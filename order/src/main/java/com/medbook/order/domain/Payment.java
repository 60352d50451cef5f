package com.medbook.order.domain;

import com.medbook.shared.persistence.AuditedEntity;
import jakarta.persistence.*;
import lombok.*;

import java.util.UUID;

/**
 * A payment attempt against an order. Several attempts may exist per order;
 * they are removed by the database together with the order.
 */
@Entity
@Table(name = "payments")
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Payment extends AuditedEntity {

    public static final String DEFAULT_PROVIDER = "internal";
    public static final String QR_PAYMENT = "qr_payment";

    public enum Status {
        PENDING,
        PAID,
        FAILED
    }

    /** Generated on persist; rows written by other clients fall back to gen_random_uuid(). */
    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "order_id", nullable = false)
    private Integer orderId;

    @Column(name = "amount", nullable = false, columnDefinition = "real")
    private Float amount;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 32)
    @Builder.Default
    private Status status = Status.PENDING;

    @Column(name = "provider", nullable = false, length = 64)
    @Builder.Default
    private String provider = DEFAULT_PROVIDER;

    @Column(name = "provider_ref", length = 128)
    private String providerRef;

    @Column(name = "failure_reason", columnDefinition = "text")
    private String failureReason;

    public void markPaid() {
        this.status = Status.PAID;
    }
}
