package com.medbook.order.service;

import com.medbook.order.domain.Cart;
import com.medbook.order.domain.CartItem;
import lombok.AllArgsConstructor;
import lombok.Getter;

import java.util.List;

@Getter
@AllArgsConstructor
public class CartDetails {
    private final Cart cart;
    private final List<CartItem> cartItems;
    private final float totalPrice;
}
