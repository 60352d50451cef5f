package com.medbook.shared.persistence;

import jakarta.persistence.Column;
import jakarta.persistence.MappedSuperclass;
import lombok.Getter;
import lombok.Setter;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.SourceType;
import org.hibernate.annotations.UpdateTimestamp;

import java.time.Instant;

/**
 * Base class for every table carrying created_at / updated_at.
 *
 * Both values come from the database clock (current_timestamp, i.e. the transaction time) and
 * are read back after the write. The BEFORE UPDATE trigger (set_updated_at) writes the same
 * now() on every row update, so the entity a service returns matches the stored row.
 *
 * A write that changes no mapped column issues no UPDATE; repositories expose a native
 * {@code touch} for rows whose updated_at must move anyway.
 */
@Getter
@Setter
@MappedSuperclass
public abstract class AuditedEntity {

    @CreationTimestamp(source = SourceType.DB)
    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @UpdateTimestamp(source = SourceType.DB)
    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;
}
