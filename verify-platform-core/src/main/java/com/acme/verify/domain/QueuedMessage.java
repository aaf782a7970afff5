package com.acme.verify.domain;

import java.time.Instant;
import java.util.UUID;

/**
 * A verification request as handed to a consumer. The receipt handle identifies this particular
 * delivery and must be presented to acknowledge it.
 */
public record QueuedMessage(
        UUID messageId,
        String receiptHandle,
        VerificationRequest request,
        int receiveCount,
        Instant enqueuedAt,
        Instant visibleUntil) {
}
