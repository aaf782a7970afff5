package com.acme.verify.worker.processing;

import com.acme.verify.domain.QueuedMessage;
import com.acme.verify.events.VerifiedEvent;
import com.acme.verify.spi.EventPublisher;
import com.acme.verify.spi.VerificationQueue;
import io.micronaut.transaction.annotation.Transactional;
import jakarta.inject.Singleton;

/**
 * Commits a succeeded attempt: acknowledges its message and publishes its event in one
 * transaction, so either both take effect or neither does.
 *
 * <p>The ack runs first. It deletes the in-flight row under the receipt handle, which locks the row
 * against a concurrent redrive; if redrive already took the message nothing is published. A publish
 * failure rolls the ack back and the message stays in flight.
 */
@Singleton
public class OutcomeCommitter {

  private final VerificationQueue queue;
  private final EventPublisher publisher;

  public OutcomeCommitter(VerificationQueue queue, EventPublisher publisher) {
    this.queue = queue;
    this.publisher = publisher;
  }

  /**
   * @return {@code false} if the message was no longer in flight; no event is published then
   * @throws com.acme.verify.core.PublishException if the channel rejected the event
   */
  @Transactional
  public boolean ackAndPublish(QueuedMessage message, VerifiedEvent event) {
    if (!queue.ack(message)) {
      return false;
    }
    publisher.publish(event);
    return true;
  }
}
