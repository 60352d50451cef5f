package com.medbook.order.domain;

import com.medbook.shared.persistence.AuditedEntity;
import jakarta.persistence.*;
import lombok.*;

/** One product line of a cart, keyed by (cart_id, product_id). */
@Entity
@Table(name = "cart_items")
@IdClass(CartItemId.class)
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CartItem extends AuditedEntity {

    @Id
    @Column(name = "cart_id", nullable = false)
    private Integer cartId;

    @Id
    @Column(name = "product_id", nullable = false)
    private Integer productId;

    @Column(name = "quantity", nullable = false)
    @Builder.Default
    private Integer quantity = 1;
}
