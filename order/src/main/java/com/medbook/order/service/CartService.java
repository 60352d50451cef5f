package com.medbook.order.service;

import com.medbook.order.domain.Cart;
import com.medbook.order.domain.CartItem;
import com.medbook.order.domain.CartLine;
import com.medbook.order.repository.CartItemRepository;
import com.medbook.order.repository.CartRepository;
import com.medbook.shared.error.NotFoundException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Patient carts.
 *
 * A cart line with quantity ≤ 0 is never stored: it is dropped when a cart is created and
 * removes the product when a cart is updated. Repeated product ids collapse to the last one.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CartService {

    private final CartRepository cartRepository;
    private final CartItemRepository cartItemRepository;
    private final CartPricing cartPricing;

    public List<Cart> listAll() {
        return cartRepository.findAll(Sort.by("id"));
    }

    public List<CartDetails> getMyCarts(Integer patientId) {
        List<Cart> carts = cartRepository.findByPatientIdOrderByIdAsc(patientId);
        if (carts.isEmpty()) return List.of();

        Map<Integer, List<CartItem>> itemsByCart = cartItemRepository
                .findByCartIdIn(carts.stream().map(Cart::getId).toList())
                .stream()
                .collect(Collectors.groupingBy(CartItem::getCartId));
        // one price lookup for every cart of the patient
        Map<Integer, Float> unitPrices = cartPricing.unitPricesFor(
                itemsByCart.values().stream().flatMap(Collection::stream).toList());

        return carts.stream()
                .map(cart -> {
                    List<CartItem> items = itemsByCart.getOrDefault(cart.getId(), List.of());
                    return new CartDetails(cart, items, CartPricing.total(items, unitPrices));
                })
                .toList();
    }

    public CartDetails getCart(Integer cartId, Integer patientId) {
        Cart cart = findOwned(cartId, patientId);
        List<CartItem> items = cartItemRepository.findByCartIdOrderByProductIdAsc(cart.getId());
        return new CartDetails(cart, items, cartPricing.totalOf(items));
    }

    @Transactional
    public NewCart createCart(Integer patientId, List<CartLine> lines) {
        Cart cart = cartRepository.save(Cart.builder().patientId(patientId).build());

        List<CartItem> items = new ArrayList<>();
        for (CartLine line : collapse(lines).values()) {
            if (line.getQuantity() <= 0) continue;
            items.add(cartItemRepository.save(CartItem.builder()
                    .cartId(cart.getId())
                    .productId(line.getProductId())
                    .quantity(line.getQuantity())
                    .build()));
        }

        log.info("Cart created: cartId={}, patientId={}, items={}", cart.getId(), patientId, items.size());
        return new NewCart(cart, items);
    }

    /**
     * Replace the content of a cart with {@code lines}: products absent from the request are
     * deleted, the others are written with the requested quantity. The cart itself is touched.
     */
    @Transactional
    public CartUpdate updateCart(Integer cartId, Integer patientId, List<CartLine> lines) {
        Cart cart = findOwned(cartId, patientId);

        Map<Integer, CartLine> requested = collapse(lines);
        requested.values().removeIf(line -> line.getQuantity() <= 0);

        List<CartItem> existing = cartItemRepository.findByCartIdOrderByProductIdAsc(cart.getId());
        List<CartItem> deleted = existing.stream()
                .filter(item -> !requested.containsKey(item.getProductId()))
                .toList();
        cartItemRepository.deleteAll(deleted);

        Map<Integer, CartItem> existingByProduct = existing.stream()
                .collect(Collectors.toMap(CartItem::getProductId, item -> item));
        for (CartLine line : requested.values()) {
            CartItem item = existingByProduct.get(line.getProductId());
            if (item != null) {
                item.setQuantity(line.getQuantity());
            } else {
                cartItemRepository.save(CartItem.builder()
                        .cartId(cart.getId())
                        .productId(line.getProductId())
                        .quantity(line.getQuantity())
                        .build());
            }
        }

        // every written row moves updated_at, even with an unchanged quantity
        cartItemRepository.touchByCartId(cartId);
        cartRepository.touch(cartId);

        Cart saved = findOwned(cartId, patientId);
        List<CartItem> updated = cartItemRepository.findByCartIdOrderByProductIdAsc(cartId);

        log.info("Cart updated: cartId={}, deleted={}, written={}", cartId, deleted.size(), updated.size());
        return new CartUpdate(deleted, updated, saved);
    }

    /** Hard delete; items and orders placed from the cart go with it (ON DELETE CASCADE). */
    @Transactional
    public Cart deleteCart(Integer cartId, Integer patientId) {
        Cart cart = findOwned(cartId, patientId);
        cartRepository.delete(cart);
        log.info("Cart deleted: cartId={}, patientId={}", cartId, patientId);
        return cart;
    }

    private Cart findOwned(Integer cartId, Integer patientId) {
        return cartRepository.findByIdAndPatientId(cartId, patientId)
                .orElseThrow(() -> new NotFoundException("Cart not found: " + cartId));
    }

    private static Map<Integer, CartLine> collapse(List<CartLine> lines) {
        Map<Integer, CartLine> byProduct = new LinkedHashMap<>();
        for (CartLine line : lines) {
            byProduct.put(line.getProductId(), line);
        }
        return byProduct;
    }
}
