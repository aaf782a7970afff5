package com.acme.verify.spi;

import com.acme.verify.domain.QueuedMessage;
import com.acme.verify.domain.VerificationRequest;

import java.util.List;
import java.util.UUID;

/**
 * Durable work queue of verification requests with a single-attempt delivery policy: a received
 * message that is not acknowledged within the visibility window is dead-lettered, never redelivered.
 */
public interface VerificationQueue {

    /**
     * @return message id, once the request is durably stored
     * @throws com.acme.verify.core.TransportException if the store is unreachable
     */
    UUID enqueue(VerificationRequest request);

    /** Claims up to {@code max} available messages and starts their visibility window. */
    List<QueuedMessage> receive(int max);

    /**
     * @return {@code false} if the message is no longer in flight under this receipt (already
     *     dead-lettered)
     */
    boolean ack(QueuedMessage message);
}
