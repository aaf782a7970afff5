package com.acme.verify.worker.events;

import com.acme.verify.config.EventsConfig;
import com.acme.verify.core.InvalidInputException;
import com.acme.verify.events.EventDelivery;
import com.acme.verify.events.EventRouter;
import com.acme.verify.events.EventRule;
import com.acme.verify.events.EventSubscriber;
import com.acme.verify.events.StoredEvent;
import com.acme.verify.repository.EventRepository;
import io.micronaut.scheduling.annotation.Scheduled;
import jakarta.inject.Singleton;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Fans stored events out to the subscribers whose rules match, then delivers each delivery
 * independently. A failed delivery is retried with exponential backoff and parked after
 * {@code events.max-attempts}; other subscribers of the same event are unaffected. A subscriber
 * rejecting the detail as invalid is parked at once, since a retry cannot succeed.
 */
@Singleton
public class EventDeliveryRelay {
  private static final Logger LOG = LoggerFactory.getLogger(EventDeliveryRelay.class);

  private static final int MAX_BACKOFF_EXPONENT = 30;

  private final EventRepository repository;
  private final EventRouter router;
  private final Clock clock;
  private final int batchSize;
  private final int maxAttempts;
  private final long maxBackoffMillis;
  private final EventsConfig config;

  public EventDeliveryRelay(EventRepository repository, EventRouter router, EventsConfig config, Clock clock) {
    this.repository = repository;
    this.router = router;
    this.clock = clock;
    this.config = config;
    this.batchSize = config.getBatchSize();
    this.maxAttempts = config.getMaxAttempts();
    this.maxBackoffMillis = config.getMaxBackoffMillis();
  }

  @Scheduled(fixedDelay = "${events.relay-interval:1s}")
  public void tick() {
    try {
      int recovered = repository.recoverStuck(clock.instant().minus(config.getClaimTimeout()));
      if (recovered > 0) {
        LOG.info("Recovered {} stuck IN_PROGRESS deliveries", recovered);
      }
      routeNew();
      deliverDue();
    } catch (Exception e) {
      LOG.error("Error in EventDeliveryRelay tick: {}", e.getMessage(), e);
    }
  }

  /**
   * Creates one delivery per matching rule for each unrouted event.
   *
   * @return number of events routed
   */
  public int routeNew() {
    List<StoredEvent> events = repository.findUnrouted(batchSize);
    Instant now = clock.instant();
    for (StoredEvent event : events) {
      List<EventRule> rules = router.route(event.source(), event.detailType());
      if (rules.isEmpty()) {
        LOG.debug("No rule matches {}/{} eventId={}", event.source(), event.detailType(), event.eventId());
      }
      for (EventRule rule : rules) {
        repository.insertDeliveryIfAbsent(event, rule.target(), now);
      }
      repository.markRouted(event.eventId(), now);
    }
    return events.size();
  }

  /**
   * Delivers due deliveries.
   *
   * @return number delivered successfully
   */
  public int deliverDue() {
    List<EventDelivery> deliveries = repository.claimDue(batchSize, clock.instant());
    if (!deliveries.isEmpty()) {
      LOG.debug("Delivering {} event deliveries", deliveries.size());
    }
    int delivered = 0;
    for (EventDelivery delivery : deliveries) {
      if (deliver(delivery)) {
        delivered++;
      }
    }
    return delivered;
  }

  private boolean deliver(EventDelivery delivery) {
    Optional<EventSubscriber> subscriber = router.subscriber(delivery.subscription());
    if (subscriber.isEmpty()) {
      LOG.error("Parking delivery id={}: no subscriber named {}", delivery.id(), delivery.subscription());
      repository.park(delivery.id(), "no subscriber named " + delivery.subscription(), clock.instant());
      return false;
    }
    try {
      subscriber.get().deliver(delivery.detailJson());
      repository.markDelivered(delivery.id(), clock.instant());
      LOG.debug("Delivered eventId={} to {}", delivery.eventId(), delivery.subscription());
      return true;
    } catch (InvalidInputException e) {
      LOG.error(
          "Parking delivery of eventId={} to {}: rejected as invalid: {}",
          delivery.eventId(), delivery.subscription(), e.getMessage());
      repository.park(delivery.id(), e.toString(), clock.instant());
      return false;
    } catch (Exception e) {
      if (delivery.attempts() >= maxAttempts) {
        LOG.error(
            "Parking delivery of eventId={} to {} after {} attempts: {}",
            delivery.eventId(), delivery.subscription(), delivery.attempts(), e.getMessage());
        repository.park(delivery.id(), e.toString(), clock.instant());
      } else {
        long backoff = backoffMillis(delivery.attempts());
        LOG.warn(
            "Delivery of eventId={} to {} failed (attempt {}/{}), retrying in {}ms: {}",
            delivery.eventId(), delivery.subscription(), delivery.attempts(), maxAttempts, backoff, e.getMessage());
        repository.reschedule(delivery.id(), e.toString(), clock.instant().plusMillis(backoff));
      }
      return false;
    }
  }

  long backoffMillis(int attempts) {
    int exponent = Math.min(MAX_BACKOFF_EXPONENT, Math.max(1, attempts));
    return Math.min(maxBackoffMillis, (1L << exponent) * 1000L);
  }
}
