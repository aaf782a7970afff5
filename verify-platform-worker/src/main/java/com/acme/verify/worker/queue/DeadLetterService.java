package com.acme.verify.worker.queue;

import com.acme.verify.config.QueueConfig;
import com.acme.verify.domain.DeadLetter;
import com.acme.verify.domain.QueueStats;
import com.acme.verify.domain.QueueStatus;
import com.acme.verify.domain.QueuedMessage;
import com.acme.verify.repository.DeadLetterRepository;
import com.acme.verify.repository.QueueRepository;
import com.acme.verify.spi.VerificationQueue;
import io.micronaut.transaction.annotation.Transactional;
import jakarta.inject.Singleton;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Redrive policy with a maximum receive count of one: an in-flight message whose visibility window
 * elapsed goes straight to the dead-letter queue. Also serves operator inspection and replay.
 */
@Singleton
public class DeadLetterService {
  private static final Logger LOG = LoggerFactory.getLogger(DeadLetterService.class);

  private final QueueRepository queue;
  private final DeadLetterRepository deadLetters;
  private final VerificationQueue ingress;
  private final QueueConfig config;
  private final Clock clock;

  public DeadLetterService(
      QueueRepository queue,
      DeadLetterRepository deadLetters,
      VerificationQueue ingress,
      QueueConfig config,
      Clock clock) {
    this.queue = queue;
    this.deadLetters = deadLetters;
    this.ingress = ingress;
    this.config = config;
    this.clock = clock;
  }

  /**
   * Moves expired in-flight messages to the DLQ.
   *
   * @return number of messages dead-lettered by this pass
   */
  public int redriveExpired() {
    Instant now = clock.instant();
    int batch = config.getRedriveBatchSize();

    // DEAD rows left behind by a pass that stopped between marking and moving
    for (UUID id : queue.findDeadIds(batch)) {
      moveToDeadLetterQueue(id, now, "dead-letter move resumed");
    }

    int moved = 0;
    for (UUID id : queue.findExpiredIds(now, batch)) {
      if (expire(id, now)) {
        moved++;
      }
    }
    if (moved > 0) {
      LOG.info("Dead-lettered {} message(s) whose visibility window elapsed", moved);
    }
    return moved;
  }

  /** Marks one expired message dead and moves it; loses quietly to a concurrent ack. */
  @Transactional
  public boolean expire(UUID messageId, Instant now) {
    if (!queue.markDead(messageId, now)) {
      LOG.debug("messageId={} acknowledged before it could be dead-lettered", messageId);
      return false;
    }
    moveToDeadLetterQueue(
        messageId,
        now,
        "not acknowledged within visibility window of " + config.getVisibilityWindow());
    return true;
  }

  private void moveToDeadLetterQueue(UUID messageId, Instant now, String reason) {
    Optional<QueuedMessage> row = queue.findById(messageId);
    if (row.isEmpty()) {
      return;
    }
    QueuedMessage message = row.get();
    DeadLetter deadLetter =
        new DeadLetter(
            message.messageId(),
            message.request().subject(),
            message.request().context(),
            message.request().signal(),
            message.receiveCount(),
            message.enqueuedAt(),
            now,
            reason);
    if (!deadLetters.insertIfAbsent(deadLetter)) {
      LOG.debug("Dead letter for messageId={} already stored", messageId);
    }
    queue.deleteDead(messageId);
    LOG.warn("messageId={} moved to dead-letter queue: {}", messageId, reason);
  }

  /**
   * Deletes dead letters older than the configured retention.
   *
   * @return number purged
   */
  public int purgeExpired() {
    Instant cutoff = clock.instant().minus(config.getDlqRetention());
    int purged = deadLetters.deleteOlderThan(cutoff);
    if (purged > 0) {
      LOG.info("Purged {} dead letter(s) older than {}", purged, cutoff);
    }
    return purged;
  }

  public List<DeadLetter> list(int limit) {
    return deadLetters.findRecent(limit);
  }

  public Optional<DeadLetter> find(UUID messageId) {
    return deadLetters.findById(messageId);
  }

  /**
   * Puts a dead letter back on the ingress queue as a brand-new message.
   *
   * @return id of the new message, or empty if no such dead letter exists
   */
  @Transactional
  public Optional<UUID> replay(UUID messageId) {
    Optional<DeadLetter> deadLetter = deadLetters.findById(messageId);
    if (deadLetter.isEmpty()) {
      return Optional.empty();
    }
    UUID replayed = ingress.enqueue(deadLetter.get().toRequest());
    deadLetters.delete(messageId);
    LOG.info("Replayed dead letter {} as messageId={}", messageId, replayed);
    return Optional.of(replayed);
  }

  public QueueStats stats() {
    return new QueueStats(
        queue.countByStatus(QueueStatus.AVAILABLE),
        queue.countByStatus(QueueStatus.IN_FLIGHT),
        deadLetters.count());
  }
}
