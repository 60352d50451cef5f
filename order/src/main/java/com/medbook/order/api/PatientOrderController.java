package com.medbook.order.api;

import com.medbook.order.domain.CreateOrderCommand;
import com.medbook.order.domain.Order;
import com.medbook.order.service.OrderCommandService;
import com.medbook.order.service.OrderDetails;
import com.medbook.order.service.OrderQueryService;
import com.medbook.order.service.PaymentCheckout;
import com.medbook.order.service.PaymentService;
import com.medbook.shared.web.StdResponse;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * Patient orders.
 *
 * Writes: POST /patients/orders (checkout), DELETE /patients/orders/{id} (cancel),
 *         POST /patients/orders/{id}/payment
 *   → validated → command/payment service → PostgreSQL + outbox, one transaction
 *
 * Reads: GET /patients/orders, /my-orders, /{id}
 *   → query service, lines priced by the inventory service
 */
@RestController
@RequestMapping("/patients/orders")
@RequiredArgsConstructor
public class PatientOrderController {

    private final OrderCommandService commandService;
    private final OrderQueryService queryService;
    private final PaymentService paymentService;

    // ─── Read Endpoints ───────────────────────────────────────────────────────

    @GetMapping
    public StdResponse<List<Order>> getOrders(@RequestHeader(CartController.PATIENT_HEADER) Integer patientId) {
        return StdResponse.of(queryService.listAll(), "Get orders successfully");
    }

    @GetMapping("/my-orders")
    public StdResponse<List<OrderDetails>> getMyOrders(@RequestHeader(CartController.PATIENT_HEADER) Integer patientId) {
        return StdResponse.of(queryService.getMyOrders(patientId), "Get my orders successfully");
    }

    @GetMapping("/{id}")
    public StdResponse<OrderDetails> getOrder(@PathVariable Integer id,
                                              @RequestHeader(CartController.PATIENT_HEADER) Integer patientId) {
        return StdResponse.of(queryService.getPatientOrder(id, patientId), "Get order successfully");
    }

    // ─── Write Endpoints ──────────────────────────────────────────────────────

    @PostMapping
    public StdResponse<Order> createOrder(@RequestHeader(CartController.PATIENT_HEADER) Integer patientId,
                                          @Valid @RequestBody CreateOrderRequest request) {
        Order order = commandService.createOrder(CreateOrderCommand.builder()
                .patientId(patientId)
                .cartId(request.getCartId())
                .deliveryAddressId(request.getDeliveryAddressId())
                .orderType(request.getOrderType())
                .build());
        return StdResponse.of(order, "Create order successfully");
    }

    @DeleteMapping("/{id}")
    public StdResponse<Order> cancelOrder(@PathVariable Integer id,
                                          @RequestHeader(CartController.PATIENT_HEADER) Integer patientId) {
        return StdResponse.of(commandService.cancelOrder(id, patientId), "Cancelled order successfully");
    }

    @PostMapping("/{id}/payment")
    public StdResponse<PaymentCheckout> createPayment(@PathVariable Integer id,
                                                      @RequestHeader(CartController.PATIENT_HEADER) Integer patientId,
                                                      @Valid @RequestBody CreatePaymentRequest request) {
        return StdResponse.of(paymentService.createPayment(id, patientId, request.getProvider()),
                "Created payment successfully");
    }
}

// ─── Request DTOs ──────────────────────────────────────────────────────────────

@Data
class CreateOrderRequest {
    @NotNull private Integer cartId;
    @NotNull private Integer deliveryAddressId;
    private Order.Type orderType;
}

@Data
class CreatePaymentRequest {
    @NotBlank private String provider;
}
