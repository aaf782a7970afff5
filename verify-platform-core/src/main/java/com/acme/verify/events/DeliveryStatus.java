package com.acme.verify.events;

public enum DeliveryStatus {
    PENDING,
    IN_PROGRESS,
    DELIVERED,
    /** Gave up after the maximum number of attempts; kept for inspection. */
    PARKED
}
