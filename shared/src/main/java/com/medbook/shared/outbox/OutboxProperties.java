package com.medbook.shared.outbox;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

@Data
@ConfigurationProperties(prefix = "medbook.outbox")
public class OutboxProperties {

    /** Delay between two relay polls, in milliseconds. */
    private long relayIntervalMs = 1000;

    /** Maximum rows locked and published per poll. */
    private int batchSize = 50;
}
