package com.medbook.shared.outbox;

public enum OutboxStatus {
    PENDING,
    PUBLISHED
}
