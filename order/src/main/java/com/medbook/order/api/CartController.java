package com.medbook.order.api;

import com.medbook.order.domain.Cart;
import com.medbook.order.domain.CartLine;
import com.medbook.order.service.CartDetails;
import com.medbook.order.service.CartService;
import com.medbook.order.service.CartUpdate;
import com.medbook.order.service.NewCart;
import com.medbook.shared.web.StdResponse;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * Patient carts. The caller is identified by {@code X-Patient-Id}, set by the gateway.
 */
@RestController
@RequestMapping("/patients/carts")
@RequiredArgsConstructor
public class CartController {

    static final String PATIENT_HEADER = "X-Patient-Id";

    private final CartService cartService;

    @GetMapping
    public StdResponse<List<Cart>> getCarts(@RequestHeader(PATIENT_HEADER) Integer patientId) {
        return StdResponse.of(cartService.listAll(), "Get carts successfully");
    }

    @GetMapping("/my-carts")
    public StdResponse<List<CartDetails>> getMyCarts(@RequestHeader(PATIENT_HEADER) Integer patientId) {
        return StdResponse.of(cartService.getMyCarts(patientId), "Get my carts successfully");
    }

    @GetMapping("/{id}")
    public StdResponse<CartDetails> getCart(@PathVariable Integer id,
                                            @RequestHeader(PATIENT_HEADER) Integer patientId) {
        return StdResponse.of(cartService.getCart(id, patientId), "Get cart successfully");
    }

    @PostMapping
    public StdResponse<NewCart> createCart(@RequestHeader(PATIENT_HEADER) Integer patientId,
                                           @Valid @RequestBody CartItemsRequest request) {
        return StdResponse.of(cartService.createCart(patientId, request.toLines()), "Create cart successfully");
    }

    /** Replaces the cart content with the request body. */
    @PatchMapping("/{id}")
    public StdResponse<CartUpdate> updateCart(@PathVariable Integer id,
                                              @RequestHeader(PATIENT_HEADER) Integer patientId,
                                              @Valid @RequestBody CartItemsRequest request) {
        return StdResponse.of(cartService.updateCart(id, patientId, request.toLines()), "Update cart successfully");
    }

    @DeleteMapping("/{id}")
    public StdResponse<Cart> deleteCart(@PathVariable Integer id,
                                        @RequestHeader(PATIENT_HEADER) Integer patientId) {
        return StdResponse.of(cartService.deleteCart(id, patientId), "Delete cart successfully");
    }
}

// ─── Request DTOs ──────────────────────────────────────────────────────────────

@Data
class CartItemsRequest {
    @NotNull @Valid private List<CartItemRequest> cartItems;

    List<CartLine> toLines() {
        return cartItems.stream()
                .map(item -> new CartLine(item.getProductId(), item.getQuantity()))
                .toList();
    }

    @Data
    static class CartItemRequest {
        @NotNull private Integer productId;
        @NotNull private Integer quantity;
    }
}
