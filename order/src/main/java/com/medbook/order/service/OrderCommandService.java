package com.medbook.order.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.medbook.order.client.DeliveryAddressClient;
import com.medbook.order.domain.CartItem;
import com.medbook.order.domain.CreateOrderCommand;
import com.medbook.order.domain.Order;
import com.medbook.order.repository.CartItemRepository;
import com.medbook.order.repository.CartRepository;
import com.medbook.order.repository.OrderRepository;
import com.medbook.shared.error.NotFoundException;
import com.medbook.shared.events.EventTypes;
import com.medbook.shared.events.Events.OrderCancellationRequestedEvent;
import com.medbook.shared.events.Events.OrderLine;
import com.medbook.shared.events.Events.OrderPlacedEvent;
import com.medbook.shared.outbox.OutboxService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.List;
import java.util.UUID;

/**
 * Order writes.
 *
 * Every state change that other services must hear about appends its outbox row in the same
 * transaction as the change itself; the relay publishes it after commit. Conditional
 * transitions load the order with SELECT ... FOR UPDATE first, so a concurrent writer either
 * waits or finds the order already moved on.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class OrderCommandService {

    private final OrderRepository orderRepository;
    private final CartRepository cartRepository;
    private final CartItemRepository cartItemRepository;
    private final OutboxService outboxService;
    private final DeliveryAddressClient deliveryAddressClient;
    private final TransactionTemplate transactionTemplate;

    /**
     * Place an order from a cart.
     *
     *  1. fetch the delivery address and check the patient owns it (outside the transaction)
     *  2. INSERT the order, PENDING, with the address snapshot
     *  3. INSERT outbox inventory.reserve_order with the cart's lines (same transaction)
     */
    public Order createOrder(CreateOrderCommand cmd) {
        JsonNode address = deliveryAddressClient.getOwnedAddress(cmd.getDeliveryAddressId(), cmd.getPatientId());

        Order order = transactionTemplate.execute(status -> {
            if (!cartRepository.existsByIdAndPatientId(cmd.getCartId(), cmd.getPatientId())) {
                throw new NotFoundException("Cart not found: " + cmd.getCartId());
            }

            Order saved = orderRepository.save(Order.builder()
                    .cartId(cmd.getCartId())
                    .patientId(cmd.getPatientId())
                    .status(Order.Status.PENDING)
                    .orderType(cmd.getOrderType() != null ? cmd.getOrderType() : Order.Type.PICKUP)
                    .deliveryAddress(address.toString())
                    .build());

            outboxService.publish(EventTypes.INVENTORY_RESERVE_ORDER,
                    new OrderPlacedEvent(saved.getId(), linesOf(saved.getCartId())));
            return saved;
        });

        log.info("Order created: orderId={}, patientId={}, cartId={}, type={}",
                order.getId(), cmd.getPatientId(), cmd.getCartId(), order.getOrderType());
        return order;
    }

    /**
     * Cancel a reserved, active order of the patient: soft-delete it, move it to
     * CANCEL_PENDING and ask inventory to release the reservation.
     */
    @Transactional
    public Order cancelOrder(Integer orderId, Integer patientId) {
        Order order = orderRepository
                .findLockedByIdAndPatientIdAndStatusAndDeletedAtIsNull(orderId, patientId, Order.Status.RESERVED)
                .orElseThrow(() -> new NotFoundException("No reserved order to cancel: " + orderId));

        order.cancel();
        Order saved = orderRepository.save(order);

        outboxService.publish(EventTypes.INVENTORY_CANCEL_ORDER,
                new OrderCancellationRequestedEvent(saved.getId(), linesOf(saved.getCartId())));

        log.info("Order cancellation requested: orderId={}, patientId={}", orderId, patientId);
        return saved;
    }

    /**
     * Status change reported by another service.
     *
     * @return false if no such order exists
     */
    @Transactional
    public boolean updateStatus(Integer orderId, Order.Status newStatus) {
        return orderRepository.findLockedById(orderId)
                .map(order -> {
                    Order.Status previous = order.getStatus();
                    order.setStatus(newStatus);
                    orderRepository.save(order);
                    log.info("Order status updated: orderId={}, {} -> {}", orderId, previous, newStatus);
                    return true;
                })
                .orElse(false);
    }

    /**
     * @return false if no such order exists
     */
    @Transactional
    public boolean assignDelivery(Integer orderId, UUID deliveryId) {
        return orderRepository.findLockedById(orderId)
                .map(order -> {
                    order.setDeliveryId(deliveryId);
                    orderRepository.save(order);
                    log.info("Delivery assigned: orderId={}, deliveryId={}", orderId, deliveryId);
                    return true;
                })
                .orElse(false);
    }

    private List<OrderLine> linesOf(Integer cartId) {
        List<CartItem> items = cartItemRepository.findByCartIdOrderByProductIdAsc(cartId);
        return items.stream()
                .map(item -> new OrderLine(item.getProductId(), item.getQuantity()))
                .toList();
    }
}
