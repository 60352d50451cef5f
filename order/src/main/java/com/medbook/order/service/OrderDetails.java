package com.medbook.order.service;

import com.medbook.order.domain.CartItem;
import com.medbook.order.domain.Order;
import lombok.AllArgsConstructor;
import lombok.Getter;

import java.util.List;

/** An order with the lines of the cart it was placed from. */
@Getter
@AllArgsConstructor
public class OrderDetails {
    private final Order order;
    private final List<CartItem> orderItems;
    private final float totalPrice;
}
