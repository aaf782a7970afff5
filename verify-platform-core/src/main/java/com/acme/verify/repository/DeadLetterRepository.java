package com.acme.verify.repository;

import com.acme.verify.domain.DeadLetter;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/** Repository for the dead-letter queue - requests parked for manual inspection or replay. */
public interface DeadLetterRepository {

  /**
   * Park a dead letter keyed by its original message id.
   *
   * @return false if a dead letter with that id already exists
   */
  boolean insertIfAbsent(DeadLetter deadLetter);

  /** Most recently dead-lettered first. */
  List<DeadLetter> findRecent(int limit);

  Optional<DeadLetter> findById(UUID messageId);

  boolean delete(UUID messageId);

  /** @return number of dead letters removed */
  int deleteOlderThan(Instant cutoff);

  long count();
}
