package com.medbook.order.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/** Base URLs of the HTTP services this service calls synchronously. */
@Data
@ConfigurationProperties(prefix = "medbook.services")
public class ServiceUrlsProperties {

    private String deliveryUrl = "http://localhost:3000/deliveries-service";

    private String inventoryUrl = "http://localhost:3000/inventory-service";
}
