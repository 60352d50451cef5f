package com.medbook.order.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.medbook.order.domain.CartItem;
import com.medbook.order.domain.Order;
import com.medbook.order.domain.Payment;
import com.medbook.order.repository.CartItemRepository;
import com.medbook.order.repository.OrderRepository;
import com.medbook.order.repository.PaymentRepository;
import com.medbook.shared.error.BadRequestException;
import com.medbook.shared.error.NotFoundException;
import com.medbook.shared.events.EventTypes;
import com.medbook.shared.events.Events.DeliveryRequestedEvent;
import com.medbook.shared.outbox.OutboxService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.List;
import java.util.UUID;

/**
 * Payments against reserved orders.
 *
 * Checkout creates a PENDING payment for the order total and moves the order to PAYMENT_PENDING.
 * Settlement (mock-pay) marks the payment PAID, moves the order to DELIVERY_PENDING and asks the
 * delivery service to take over.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PaymentService {

    private final PaymentRepository paymentRepository;
    private final OrderRepository orderRepository;
    private final CartItemRepository cartItemRepository;
    private final CartPricing cartPricing;
    private final OutboxService outboxService;
    private final TransactionTemplate transactionTemplate;
    private final ObjectMapper objectMapper;

    public PaymentCheckout createPayment(Integer orderId, Integer patientId, String provider) {
        if (!Payment.QR_PAYMENT.equals(provider)) {
            throw new BadRequestException("Unsupported payment provider: " + provider);
        }

        Order order = orderRepository.findByIdAndPatientIdAndStatus(orderId, patientId, Order.Status.RESERVED)
                .orElseThrow(() -> new NotFoundException("No reserved order to pay: " + orderId));

        // priced before the transaction opens: no row lock is held across the HTTP call
        List<CartItem> items = cartItemRepository.findByCartIdOrderByProductIdAsc(order.getCartId());
        float total = cartPricing.totalOf(items);

        PaymentCheckout checkout = transactionTemplate.execute(status -> {
            Order locked = orderRepository
                    .findLockedByIdAndPatientIdAndStatus(orderId, patientId, Order.Status.RESERVED)
                    .orElseThrow(() -> new NotFoundException("No reserved order to pay: " + orderId));
            locked.setStatus(Order.Status.PAYMENT_PENDING);
            Order updated = orderRepository.save(locked);

            Payment payment = paymentRepository.save(Payment.builder()
                    .orderId(orderId)
                    .amount(total)
                    .status(Payment.Status.PENDING)
                    .provider(provider)
                    .build());
            return new PaymentCheckout(payment, updated);
        });

        log.info("Payment created: paymentId={}, orderId={}, amount={}, provider={}",
                checkout.getPayment().getId(), orderId, total, provider);
        return checkout;
    }

    @Transactional
    public PaymentSettlement mockPay(UUID paymentId) {
        Payment payment = paymentRepository.findLockedByIdAndStatus(paymentId, Payment.Status.PENDING)
                .orElseThrow(() -> new NotFoundException("No pending payment: " + paymentId));
        Order order = orderRepository.findLockedById(payment.getOrderId())
                .filter(o -> o.getStatus() == Order.Status.PAYMENT_PENDING)
                .orElseThrow(() -> new NotFoundException("Order is not awaiting payment: " + payment.getOrderId()));

        payment.markPaid();
        order.setStatus(Order.Status.DELIVERY_PENDING);
        Payment paid = paymentRepository.save(payment);
        Order updated = orderRepository.save(order);

        outboxService.publish(EventTypes.DELIVERY_ORDER_REQUEST, new DeliveryRequestedEvent(
                updated.getId(), updated.getOrderType().name(), parseAddress(updated)));

        log.info("Payment settled: paymentId={}, orderId={}", paymentId, updated.getId());
        return new PaymentSettlement(paid, updated);
    }

    private JsonNode parseAddress(Order order) {
        if (order.getDeliveryAddress() == null) return null;
        try {
            return objectMapper.readTree(order.getDeliveryAddress());
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Stored delivery address is not valid JSON: orderId=" + order.getId(), e);
        }
    }
}
