package com.medbook.order.service;

import com.medbook.order.domain.Order;
import com.medbook.order.domain.Payment;
import lombok.AllArgsConstructor;
import lombok.Getter;

@Getter
@AllArgsConstructor
public class PaymentCheckout {
    private final Payment payment;
    private final Order updatedOrder;
}
