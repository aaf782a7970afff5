package com.acme.verify.spi;

import com.acme.verify.events.VerifiedEvent;

public interface EventPublisher {

    /**
     * Hands the event to the channel. Returning normally means the channel durably accepted it.
     *
     * @throws com.acme.verify.core.PublishException if the channel rejected the event
     */
    void publish(VerifiedEvent event);
}
