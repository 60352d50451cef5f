package com.medbook.order.service;

import com.medbook.order.domain.Cart;
import com.medbook.order.domain.CartItem;
import lombok.AllArgsConstructor;
import lombok.Getter;

import java.util.List;

/** Outcome of replacing a cart's content: lines removed, lines written, and the touched cart. */
@Getter
@AllArgsConstructor
public class CartUpdate {
    private final List<CartItem> deletedItems;
    private final List<CartItem> updatedItems;
    private final Cart updatedCart;
}
