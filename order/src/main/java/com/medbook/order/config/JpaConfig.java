package com.medbook.order.config;

import org.springframework.boot.autoconfigure.domain.EntityScan;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.jpa.repository.config.EnableJpaRepositories;

/**
 * Entities and repositories live in two modules: the order tables here and the outbox in shared.
 * Kept apart from the application class so that web slices do not pull in JPA.
 */
@Configuration
@EntityScan(basePackages = {"com.medbook.order.domain", "com.medbook.shared.outbox"})
@EnableJpaRepositories(basePackages = {"com.medbook.order.repository", "com.medbook.shared.outbox"})
public class JpaConfig {
}
