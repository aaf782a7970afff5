package com.acme.verify.events;

import java.time.Instant;
import java.util.UUID;

/**
 * Immutable fact that a subject passed verification. Once published, the channel owns it; the
 * publisher does not track who consumes it.
 */
public record VerifiedEvent(
        UUID eventId,
        String source,
        String detailType,
        VerificationDetail detail,
        Instant occurredAt) {

    public static VerifiedEvent of(String source, String subject, String context, Instant occurredAt) {
        return new VerifiedEvent(
                UUID.randomUUID(),
                source,
                EventTypeConstants.VERIFICATION_SUCCEEDED,
                new VerificationDetail(subject, context),
                occurredAt);
    }
}
