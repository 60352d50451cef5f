package com.medbook.order.api;

import com.medbook.order.service.OrderDetails;
import com.medbook.order.service.OrderQueryService;
import com.medbook.shared.web.StdResponse;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.*;

/** Service-to-service order lookup; not exposed through the patient gateway. */
@RestController
@RequestMapping("/orders")
@RequiredArgsConstructor
public class OrderController {

    private final OrderQueryService queryService;

    @GetMapping("/{id}")
    public StdResponse<OrderDetails> getOrder(@PathVariable Integer id) {
        return StdResponse.of(queryService.getOrder(id), "Get order successfully");
    }
}
