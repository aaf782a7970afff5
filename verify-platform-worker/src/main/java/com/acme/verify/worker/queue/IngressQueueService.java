package com.acme.verify.worker.queue;

import com.acme.verify.config.QueueConfig;
import com.acme.verify.core.InvalidInputException;
import com.acme.verify.domain.QueuedMessage;
import com.acme.verify.domain.VerificationRequest;
import com.acme.verify.repository.QueueRepository;
import com.acme.verify.spi.VerificationQueue;
import io.micronaut.transaction.annotation.Transactional;
import jakarta.inject.Singleton;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The ingress queue on top of {@link QueueRepository}. Every receive starts a fresh visibility
 * window under a new receipt handle; messages never return to AVAILABLE once claimed.
 */
@Singleton
public class IngressQueueService implements VerificationQueue {
  private static final Logger LOG = LoggerFactory.getLogger(IngressQueueService.class);

  private final QueueRepository repository;
  private final QueueConfig config;
  private final Clock clock;

  public IngressQueueService(QueueRepository repository, QueueConfig config, Clock clock) {
    this.repository = repository;
    this.config = config;
    this.clock = clock;
  }

  @Override
  public UUID enqueue(VerificationRequest request) {
    if (request == null) {
      throw new InvalidInputException("request body is required");
    }
    UUID messageId = UUID.randomUUID();
    repository.insert(messageId, request, clock.instant());
    LOG.info("Enqueued verification request messageId={}", messageId);
    return messageId;
  }

  @Override
  @Transactional
  public List<QueuedMessage> receive(int max) {
    if (max <= 0) {
      return List.of();
    }
    Instant visibleUntil = clock.instant().plus(config.getVisibilityWindow());
    List<QueuedMessage> claimed = new ArrayList<>();
    for (UUID id : repository.findAvailableIds(max)) {
      repository
          .claim(id, UUID.randomUUID().toString(), visibleUntil)
          .ifPresent(claimed::add);
    }
    if (!claimed.isEmpty()) {
      LOG.debug("Received {} message(s), visible until {}", claimed.size(), visibleUntil);
    }
    return claimed;
  }

  @Override
  public boolean ack(QueuedMessage message) {
    boolean deleted = repository.deleteInFlight(message.messageId(), message.receiptHandle());
    if (deleted) {
      LOG.debug("Acknowledged messageId={}", message.messageId());
    } else {
      LOG.warn("Ack rejected for messageId={}: no longer in flight under this receipt", message.messageId());
    }
    return deleted;
  }
}
