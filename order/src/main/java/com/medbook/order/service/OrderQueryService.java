package com.medbook.order.service;

import com.medbook.order.domain.CartItem;
import com.medbook.order.domain.Order;
import com.medbook.order.repository.CartItemRepository;
import com.medbook.order.repository.OrderRepository;
import com.medbook.shared.error.NotFoundException;
import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Order reads. An order's lines are the current lines of the cart it was placed from,
 * priced at the inventory's current unit prices.
 */
@Service
@RequiredArgsConstructor
public class OrderQueryService {

    private final OrderRepository orderRepository;
    private final CartItemRepository cartItemRepository;
    private final CartPricing cartPricing;

    public List<Order> listAll() {
        return orderRepository.findAll(Sort.by("id"));
    }

    /** The patient's orders, most recently updated first. */
    public List<OrderDetails> getMyOrders(Integer patientId) {
        List<Order> orders = orderRepository.findByPatientIdOrderByUpdatedAtDesc(patientId);
        if (orders.isEmpty()) return List.of();

        Map<Integer, List<CartItem>> itemsByCart = cartItemRepository
                .findByCartIdIn(orders.stream().map(Order::getCartId).distinct().toList())
                .stream()
                .collect(Collectors.groupingBy(CartItem::getCartId));
        Map<Integer, Float> unitPrices = cartPricing.unitPricesFor(
                itemsByCart.values().stream().flatMap(Collection::stream).toList());

        return orders.stream()
                .map(order -> {
                    List<CartItem> items = itemsByCart.getOrDefault(order.getCartId(), List.of());
                    return new OrderDetails(order, items, CartPricing.total(items, unitPrices));
                })
                .toList();
    }

    public OrderDetails getPatientOrder(Integer orderId, Integer patientId) {
        Order order = orderRepository.findByIdAndPatientId(orderId, patientId)
                .orElseThrow(() -> new NotFoundException("Order not found: " + orderId));
        return withItems(order);
    }

    /** Service-to-service lookup, no ownership check. */
    public OrderDetails getOrder(Integer orderId) {
        Order order = orderRepository.findById(orderId)
                .orElseThrow(() -> new NotFoundException("Order not found: " + orderId));
        return withItems(order);
    }

    private OrderDetails withItems(Order order) {
        List<CartItem> items = cartItemRepository.findByCartIdOrderByProductIdAsc(order.getCartId());
        return new OrderDetails(order, items, cartPricing.totalOf(items));
    }
}
