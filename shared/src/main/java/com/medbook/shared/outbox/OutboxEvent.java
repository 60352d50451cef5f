package com.medbook.shared.outbox;

import com.medbook.shared.persistence.AuditedEntity;
import jakarta.persistence.*;
import lombok.*;

/**
 * A row of the outbox table, written in the same transaction as the state change it announces.
 *
 * The relay picks PENDING rows oldest first, publishes the payload to the topic named by
 * event_type and flips the row to PUBLISHED. Rows are never deleted here.
 */
@Entity
@Table(name = "outbox")
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OutboxEvent extends AuditedEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Integer id;

    @Column(name = "event_type", nullable = false)
    private String eventType;

    /** Serialized JSON, stored as text. */
    @Column(name = "payload", nullable = false, columnDefinition = "text")
    private String payload;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false)
    @Builder.Default
    private OutboxStatus status = OutboxStatus.PENDING;

    public boolean isPublished() {
        return status == OutboxStatus.PUBLISHED;
    }

    public void markPublished() {
        this.status = OutboxStatus.PUBLISHED;
    }

    /** Stable message id carried in the event-id header; consumers dedupe on it. */
    public String messageId() {
        return "outbox-" + id;
    }
}
