package com.medbook.order.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.medbook.order.config.ServiceUrlsProperties;
import com.medbook.shared.error.ForbiddenResourceException;
import com.medbook.shared.error.ServiceUnreachableException;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

/**
 * Delivery addresses from the delivery service:
 * {@code GET /delivery-addresses/{id} → {"data": {..., "patient_id": n}, "message": "..."}}.
 */
@Slf4j
@Component
public class DeliveryAddressClient {

    static final String BREAKER_NAME = "delivery-service";

    private final RestClient restClient;
    private final CircuitBreaker circuitBreaker;

    public DeliveryAddressClient(RestClient.Builder restClientBuilder,
                                 ServiceUrlsProperties serviceUrls,
                                 CircuitBreakerRegistry circuitBreakerRegistry) {
        this.restClient = restClientBuilder.baseUrl(serviceUrls.getDeliveryUrl()).build();
        this.circuitBreaker = circuitBreakerRegistry.circuitBreaker(BREAKER_NAME);
    }

    /**
     * Fetch an address and check it belongs to the patient.
     *
     * @return the address object as returned by the delivery service
     * @throws ForbiddenResourceException  when the address is unknown or owned by someone else
     * @throws ServiceUnreachableException when the call fails or the breaker is open
     */
    public JsonNode getOwnedAddress(Integer addressId, Integer patientId) {
        JsonNode body;
        try {
            body = circuitBreaker.executeSupplier(() -> restClient.get()
                    .uri("/delivery-addresses/{id}", addressId)
                    .retrieve()
                    .body(JsonNode.class));
        } catch (HttpClientErrorException e) {
            log.debug("Delivery address lookup rejected: addressId={}, status={}", addressId, e.getStatusCode());
            throw new ForbiddenResourceException("Delivery address not accessible");
        } catch (CallNotPermittedException e) {
            throw new ServiceUnreachableException("Delivery service unavailable (circuit open)", e);
        } catch (RestClientException e) {
            log.error("Delivery address lookup failed: addressId={}, error={}", addressId, e.getMessage());
            throw new ServiceUnreachableException("Delivery service unreachable", e);
        }

        JsonNode address = body == null ? null : body.get("data");
        if (address == null || !address.isObject()) {
            throw new ForbiddenResourceException("Delivery address not accessible");
        }
        JsonNode owner = address.get("patient_id");
        if (owner == null || !owner.canConvertToInt() || owner.asInt() != patientId) {
            log.warn("Delivery address ownership mismatch: addressId={}, patientId={}", addressId, patientId);
            throw new ForbiddenResourceException("Delivery address does not belong to the patient");
        }
        return address;
    }
}
