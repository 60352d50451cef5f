package com.medbook.order.api;

import com.medbook.order.service.PaymentService;
import com.medbook.order.service.PaymentSettlement;
import com.medbook.shared.web.StdResponse;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.*;

import java.util.UUID;

@RestController
@RequestMapping("/payments")
@RequiredArgsConstructor
public class PaymentController {

    private final PaymentService paymentService;

    /** Stands in for the provider's callback: settles a pending payment. */
    @PostMapping("/{id}/mock-pay")
    public StdResponse<PaymentSettlement> mockPay(@PathVariable UUID id) {
        return StdResponse.of(paymentService.mockPay(id), "Payment paid successfully");
    }
}
