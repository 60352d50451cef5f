package com.medbook.order.domain;

import lombok.Value;

/** Requested quantity of a product in a cart. */
@Value
public class CartLine {
    Integer productId;
    Integer quantity;
}
