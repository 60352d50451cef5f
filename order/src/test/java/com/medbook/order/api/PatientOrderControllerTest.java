package com.medbook.order.api;

import com.medbook.order.domain.CreateOrderCommand;
import com.medbook.order.domain.Order;
import com.medbook.order.domain.Payment;
import com.medbook.order.service.OrderCommandService;
import com.medbook.order.service.OrderDetails;
import com.medbook.order.service.OrderQueryService;
import com.medbook.order.service.PaymentCheckout;
import com.medbook.order.service.PaymentService;
import com.medbook.shared.error.BadRequestException;
import com.medbook.shared.error.ForbiddenResourceException;
import com.medbook.shared.error.ServiceUnreachableException;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(PatientOrderController.class)
class PatientOrderControllerTest {

    @Autowired MockMvc mockMvc;

    @MockBean OrderCommandService commandService;
    @MockBean OrderQueryService queryService;
    @MockBean PaymentService paymentService;

    private static Order order(Order.Status status) {
        Order order = Order.builder()
                .id(77).cartId(10).patientId(4)
                .status(status)
                .orderType(Order.Type.DELIVERY)
                .deliveryAddress("{\"patient_id\":4,\"city\":\"Hanoi\"}")
                .build();
        order.setCreatedAt(Instant.parse("2024-05-01T10:00:00Z"));
        order.setUpdatedAt(Instant.parse("2024-05-01T10:00:00Z"));
        return order;
    }

    @Test
    void createOrder_buildsCommandFromBodyAndHeader() throws Exception {
        when(commandService.createOrder(any())).thenReturn(order(Order.Status.PENDING));

        mockMvc.perform(post("/patients/orders")
                        .header("X-Patient-Id", "4")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"cart_id\":10,\"delivery_address_id\":5,\"order_type\":\"DELIVERY\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.id").value(77))
                .andExpect(jsonPath("$.data.status").value("PENDING"))
                .andExpect(jsonPath("$.data.delivery_address.city").value("Hanoi"));

        ArgumentCaptor<CreateOrderCommand> captor = ArgumentCaptor.forClass(CreateOrderCommand.class);
        verify(commandService).createOrder(captor.capture());
        assertThat(captor.getValue().getPatientId()).isEqualTo(4);
        assertThat(captor.getValue().getCartId()).isEqualTo(10);
        assertThat(captor.getValue().getDeliveryAddressId()).isEqualTo(5);
        assertThat(captor.getValue().getOrderType()).isEqualTo(Order.Type.DELIVERY);
    }

    @Test
    void createOrder_missingCartIsBadRequest() throws Exception {
        mockMvc.perform(post("/patients/orders")
                        .header("X-Patient-Id", "4")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"delivery_address_id\":5}"))
                .andExpect(status().isBadRequest());

        verifyNoInteractions(commandService);
    }

    @Test
    void createOrder_foreignAddressIsForbidden() throws Exception {
        when(commandService.createOrder(any()))
                .thenThrow(new ForbiddenResourceException("Delivery address does not belong to the patient"));

        mockMvc.perform(post("/patients/orders")
                        .header("X-Patient-Id", "4")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"cart_id\":10,\"delivery_address_id\":5}"))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.message").value("Delivery address does not belong to the patient"));
    }

    @Test
    void createOrder_deliveryServiceDownIsUnavailable() throws Exception {
        when(commandService.createOrder(any())).thenThrow(new ServiceUnreachableException("Delivery service unreachable"));

        mockMvc.perform(post("/patients/orders")
                        .header("X-Patient-Id", "4")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"cart_id\":10,\"delivery_address_id\":5}"))
                .andExpect(status().isServiceUnavailable());
    }

    @Test
    void getMyOrders_rendersLinesAndTotals() throws Exception {
        when(queryService.getMyOrders(4)).thenReturn(List.of(new OrderDetails(order(Order.Status.RESERVED), List.of(), 0f)));

        mockMvc.perform(get("/patients/orders/my-orders").header("X-Patient-Id", "4"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data[0].order.status").value("RESERVED"))
                .andExpect(jsonPath("$.data[0].order_items").isArray())
                .andExpect(jsonPath("$.data[0].total_price").value(0.0));
    }

    @Test
    void cancelOrder_returnsTheCancelledOrder() throws Exception {
        Order cancelled = order(Order.Status.CANCEL_PENDING);
        cancelled.setDeletedAt(Instant.parse("2024-05-03T10:00:00Z"));
        when(commandService.cancelOrder(77, 4)).thenReturn(cancelled);

        mockMvc.perform(delete("/patients/orders/77").header("X-Patient-Id", "4"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.status").value("CANCEL_PENDING"))
                .andExpect(jsonPath("$.data.deleted_at").value("2024-05-03T10:00:00Z"));
    }

    @Test
    void createPayment_returnsPaymentAndUpdatedOrder() throws Exception {
        Payment payment = Payment.builder()
                .id(UUID.fromString("6f1d2c3b-4a5e-4f60-8b7c-9d0e1f2a3b4c"))
                .orderId(77).amount(36.0f).provider("qr_payment")
                .build();
        when(paymentService.createPayment(77, 4, "qr_payment"))
                .thenReturn(new PaymentCheckout(payment, order(Order.Status.PAYMENT_PENDING)));

        mockMvc.perform(post("/patients/orders/77/payment")
                        .header("X-Patient-Id", "4")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"provider\":\"qr_payment\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.payment.id").value("6f1d2c3b-4a5e-4f60-8b7c-9d0e1f2a3b4c"))
                .andExpect(jsonPath("$.data.payment.status").value("PENDING"))
                .andExpect(jsonPath("$.data.updated_order.status").value("PAYMENT_PENDING"));
    }

    @Test
    void createPayment_unsupportedProviderIsBadRequest() throws Exception {
        when(paymentService.createPayment(77, 4, "cash"))
                .thenThrow(new BadRequestException("Unsupported payment provider: cash"));

        mockMvc.perform(post("/patients/orders/77/payment")
                        .header("X-Patient-Id", "4")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"provider\":\"cash\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("Unsupported payment provider: cash"));
    }
}
