package com.medbook.order;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.kafka.annotation.EnableKafka;

/**
 * Medbook order service: carts, orders and payments of patients, with inventory and delivery
 * coordinated through the outbox and Kafka.
 */
@SpringBootApplication(scanBasePackages = {"com.medbook.order", "com.medbook.shared"})
@EnableKafka
public class OrderServiceApplication {

    public static void main(String[] args) {
        SpringApplication.run(OrderServiceApplication.class, args);
    }
}
