package com.acme.verify.events;

import java.time.Instant;
import java.util.UUID;

/** A published event as held by the channel's store, detail already serialized. */
public record StoredEvent(
        UUID eventId,
        String source,
        String detailType,
        String detailJson,
        Instant occurredAt) {
}
