package com.medbook.order.service;

import com.medbook.order.client.ProductCatalogClient;
import com.medbook.order.domain.CartItem;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.Map;

/**
 * Prices cart lines against the inventory service.
 * A line is worth quantity × unit price; a product the inventory does not price counts 0.
 */
@Component
@RequiredArgsConstructor
public class CartPricing {

    private final ProductCatalogClient productCatalogClient;

    public Map<Integer, Float> unitPricesFor(Collection<CartItem> items) {
        return productCatalogClient.getUnitPrices(items.stream().map(CartItem::getProductId).toList());
    }

    public float totalOf(Collection<CartItem> items) {
        return total(items, unitPricesFor(items));
    }

    public static float total(Collection<CartItem> items, Map<Integer, Float> unitPrices) {
        float total = 0f;
        for (CartItem item : items) {
            total += item.getQuantity() * unitPrices.getOrDefault(item.getProductId(), 0f);
        }
        return total;
    }
}
