package com.acme.verify.repository;

import com.acme.verify.events.EventDelivery;
import com.acme.verify.events.StoredEvent;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Storage behind the event channel: published events and their per-subscriber deliveries.
 */
public interface EventRepository {

  /** Durably store a published event as NEW. */
  void insertEvent(StoredEvent event);

  /** Events not yet fanned out to their subscribers, oldest first. */
  List<StoredEvent> findUnrouted(int max);

  /**
   * Create the delivery of an event to one subscriber.
   *
   * @return false if that delivery already exists
   */
  boolean insertDeliveryIfAbsent(StoredEvent event, String subscription, Instant now);

  void markRouted(UUID eventId, Instant now);

  /**
   * Claim PENDING deliveries that are due, moving them to IN_PROGRESS and counting the attempt.
   */
  List<EventDelivery> claimDue(int max, Instant now);

  void markDelivered(long deliveryId, Instant now);

  void reschedule(long deliveryId, String error, Instant nextAttemptAt);

  void park(long deliveryId, String error, Instant now);

  /** Return IN_PROGRESS deliveries claimed before {@code claimedBefore} to PENDING. */
  int recoverStuck(Instant claimedBefore);

  long countDeliveries(String status);
}
