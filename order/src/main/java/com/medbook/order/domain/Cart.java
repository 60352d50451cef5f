package com.medbook.order.domain;

import com.medbook.shared.persistence.AuditedEntity;
import jakarta.persistence.*;
import lombok.*;

/**
 * A patient's shopping cart. Items live in cart_items and are removed by the database
 * (ON DELETE CASCADE) together with the cart, as are the orders placed from it.
 */
@Entity
@Table(name = "carts")
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Cart extends AuditedEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Integer id;

    @Column(name = "patient_id", nullable = false)
    private Integer patientId;
}
