package com.medbook.order.domain;

import lombok.Builder;
import lombok.Value;

/** Checkout of a cart by its owner. */
@Value
@Builder
public class CreateOrderCommand {
    Integer patientId;
    Integer cartId;
    Integer deliveryAddressId;
    Order.Type orderType;
}
