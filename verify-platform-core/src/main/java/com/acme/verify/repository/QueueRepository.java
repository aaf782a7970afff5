package com.acme.verify.repository;

import com.acme.verify.domain.QueueStatus;
import com.acme.verify.domain.QueuedMessage;
import com.acme.verify.domain.VerificationRequest;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/** Repository for the ingress queue of verification requests. */
public interface QueueRepository {

  /** Store a new AVAILABLE message. */
  void insert(UUID messageId, VerificationRequest request, Instant enqueuedAt);

  /** Ids of AVAILABLE messages, oldest first. */
  List<UUID> findAvailableIds(int max);

  /**
   * Atomically move an AVAILABLE message to IN_FLIGHT.
   *
   * @param receiptHandle handle identifying this delivery
   * @param visibleUntil end of the visibility window
   * @return the claimed message, or empty if another consumer claimed it first
   */
  Optional<QueuedMessage> claim(UUID messageId, String receiptHandle, Instant visibleUntil);

  /**
   * Delete a message that is still IN_FLIGHT under the given receipt handle.
   *
   * @return true if the message was deleted
   */
  boolean deleteInFlight(UUID messageId, String receiptHandle);

  /** Ids of IN_FLIGHT messages whose visibility window ended at or before {@code now}. */
  List<UUID> findExpiredIds(Instant now, int max);

  /**
   * Atomically move an expired IN_FLIGHT message to DEAD.
   *
   * @return true if this caller won the message (an ack did not get there first)
   */
  boolean markDead(UUID messageId, Instant now);

  /** Ids of messages left in DEAD state, e.g. by a sweeper that stopped mid-move. */
  List<UUID> findDeadIds(int max);

  Optional<QueuedMessage> findById(UUID messageId);

  /** Delete a message in DEAD state once its dead letter is stored. */
  void deleteDead(UUID messageId);

  long countByStatus(QueueStatus status);
}
