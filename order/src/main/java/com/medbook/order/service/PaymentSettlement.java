package com.medbook.order.service;

import com.medbook.order.domain.Order;
import com.medbook.order.domain.Payment;
import lombok.AllArgsConstructor;
import lombok.Getter;

@Getter
@AllArgsConstructor
public class PaymentSettlement {
    private final Payment updatedPayment;
    private final Order updatedOrder;
}
