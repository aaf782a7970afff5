package com.acme.verify.domain;

/** Lifecycle of a row in the ingress queue. */
public enum QueueStatus {
    AVAILABLE,
    IN_FLIGHT,
    /** Claimed by the redrive sweeper; being moved to the dead-letter queue. */
    DEAD
}
