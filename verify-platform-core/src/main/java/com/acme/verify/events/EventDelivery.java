package com.acme.verify.events;

import java.util.UUID;

/**
 * One event on its way to one subscriber. Deliveries of the same event to different subscribers
 * progress independently.
 *
 * @param attempts number of delivery attempts including the one this record was claimed for
 */
public record EventDelivery(
        long id,
        UUID eventId,
        String subscription,
        String detailJson,
        int attempts) {
}
