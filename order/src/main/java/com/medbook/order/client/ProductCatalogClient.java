package com.medbook.order.client;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.medbook.order.config.ServiceUrlsProperties;
import com.medbook.shared.error.ServiceUnreachableException;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Unit prices from the inventory service: {@code GET /products?ids=1,2,3 → [{id, unit_price}]}.
 */
@Slf4j
@Component
public class ProductCatalogClient {

    static final String BREAKER_NAME = "inventory-service";

    private final RestClient restClient;
    private final CircuitBreaker circuitBreaker;

    public ProductCatalogClient(RestClient.Builder restClientBuilder,
                                ServiceUrlsProperties serviceUrls,
                                CircuitBreakerRegistry circuitBreakerRegistry) {
        this.restClient = restClientBuilder.baseUrl(serviceUrls.getInventoryUrl()).build();
        this.circuitBreaker = circuitBreakerRegistry.circuitBreaker(BREAKER_NAME);
    }

    /**
     * @return unit price by product id; products unknown to the inventory service are absent
     * @throws ServiceUnreachableException when the call fails or the breaker is open
     */
    public Map<Integer, Float> getUnitPrices(Collection<Integer> productIds) {
        if (productIds.isEmpty()) return Map.of();

        String ids = productIds.stream().distinct().map(String::valueOf).collect(Collectors.joining(","));
        List<ProductPrice> prices;
        try {
            prices = circuitBreaker.executeSupplier(() -> restClient.get()
                    .uri(uri -> uri.path("/products").queryParam("ids", ids).build())
                    .retrieve()
                    .body(new ParameterizedTypeReference<List<ProductPrice>>() {}));
        } catch (CallNotPermittedException e) {
            throw new ServiceUnreachableException("Inventory service unavailable (circuit open)", e);
        } catch (RestClientException e) {
            log.error("Inventory price lookup failed: ids={}, error={}", ids, e.getMessage());
            throw new ServiceUnreachableException("Inventory service unreachable", e);
        }

        Map<Integer, Float> byId = new HashMap<>();
        if (prices != null) {
            prices.stream()
                    .filter(p -> p.getId() != null && p.getUnitPrice() != null)
                    .forEach(p -> byId.put(p.getId(), p.getUnitPrice()));
        }
        return byId;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public static class ProductPrice {
        private Integer id;
        private Float unitPrice;
    }
}
