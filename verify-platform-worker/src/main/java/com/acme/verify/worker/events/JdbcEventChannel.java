package com.acme.verify.worker.events;

import com.acme.verify.config.EventsConfig;
import com.acme.verify.core.Jsons;
import com.acme.verify.core.PublishException;
import com.acme.verify.events.StoredEvent;
import com.acme.verify.events.VerifiedEvent;
import com.acme.verify.repository.EventRepository;
import com.acme.verify.spi.EventPublisher;
import jakarta.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Publishing side of the event bus. An event counts as published once its single row insert has
 * committed; fan-out to subscribers happens later in {@link EventDeliveryRelay}.
 */
@Singleton
public class JdbcEventChannel implements EventPublisher {
  private static final Logger LOG = LoggerFactory.getLogger(JdbcEventChannel.class);

  private final EventRepository repository;
  private final String busName;

  public JdbcEventChannel(EventRepository repository, EventsConfig config) {
    this.repository = repository;
    this.busName = config.getBusName();
  }

  @Override
  public void publish(VerifiedEvent event) {
    if (event == null || event.detail() == null) {
      throw new PublishException("event and its detail are required");
    }
    StoredEvent stored =
        new StoredEvent(
            event.eventId(),
            event.source(),
            event.detailType(),
            Jsons.toJson(event.detail()),
            event.occurredAt());
    try {
      repository.insertEvent(stored);
    } catch (RuntimeException e) {
      throw new PublishException(busName + " rejected event " + event.eventId() + ": " + e.getMessage(), e);
    }
    LOG.info("Published {} from {} on {} eventId={}", event.detailType(), event.source(), busName, event.eventId());
  }
}
