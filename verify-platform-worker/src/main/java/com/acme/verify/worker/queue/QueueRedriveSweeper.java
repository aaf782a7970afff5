package com.acme.verify.worker.queue;

import io.micronaut.scheduling.annotation.Scheduled;
import jakarta.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Periodic redrive of expired messages and purge of old dead letters. */
@Singleton
public class QueueRedriveSweeper {
  private static final Logger LOG = LoggerFactory.getLogger(QueueRedriveSweeper.class);

  private final DeadLetterService deadLetters;

  public QueueRedriveSweeper(DeadLetterService deadLetters) {
    this.deadLetters = deadLetters;
  }

  @Scheduled(fixedDelay = "${queue.redrive-interval:5s}")
  public void tick() {
    try {
      deadLetters.redriveExpired();
    } catch (Exception e) {
      LOG.error("Error in QueueRedriveSweeper tick: {}", e.getMessage(), e);
    }
  }

  @Scheduled(fixedDelay = "${queue.dlq-purge-interval:1h}", initialDelay = "1m")
  public void purge() {
    try {
      deadLetters.purgeExpired();
    } catch (Exception e) {
      LOG.error("Error purging dead letters: {}", e.getMessage(), e);
    }
  }
}
