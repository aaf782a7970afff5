package com.acme.verify.worker.events;

import static org.assertj.core.api.Assertions.assertThat;

import com.acme.verify.config.EventsConfig;
import com.acme.verify.core.Jsons;
import com.acme.verify.events.DeliveryStatus;
import com.acme.verify.events.EventPattern;
import com.acme.verify.events.EventRouter;
import com.acme.verify.events.EventTypeConstants;
import com.acme.verify.events.VerificationDetail;
import com.acme.verify.events.VerifiedEvent;
import com.acme.verify.worker.support.H2PipelineTestBase;
import java.time.Duration;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class EventDeliveryRelayTest extends H2PipelineTestBase {

  private static final EventPattern SUCCEEDED =
      new EventPattern(EventTypeConstants.WORLD_ID_SOURCE, EventTypeConstants.VERIFICATION_SUCCEEDED);

  private EventsConfig config;
  private RecordingSubscriber grants;
  private RecordingSubscriber audit;
  private RecordingSubscriber other;
  private JdbcEventChannel channel;
  private EventDeliveryRelay relay;

  @BeforeEach
  void setUpRelay() {
    config = new EventsConfig();
    config.setMaxAttempts(3);
    grants = new RecordingSubscriber("grants", SUCCEEDED);
    audit = new RecordingSubscriber("audit", SUCCEEDED);
    other = new RecordingSubscriber("other", new EventPattern("billing", EventTypeConstants.VERIFICATION_SUCCEEDED));
    EventRouter router = new EventRouter(List.of(grants, audit, other));
    channel = new JdbcEventChannel(eventRepository, config);
    relay = new EventDeliveryRelay(eventRepository, router, config, clock);
  }

  private void publish(String subject) {
    channel.publish(VerifiedEvent.of(EventTypeConstants.WORLD_ID_SOURCE, subject, "guild-1", clock.instant()));
  }

  @Nested
  @DisplayName("Routing")
  class RoutingTests {

    @Test
    @DisplayName("each matching subscriber receives only the detail")
    void fanOutDetailOnly() {
      publish("user-1");

      assertThat(relay.routeNew()).isEqualTo(1);
      assertThat(relay.deliverDue()).isEqualTo(2);

      assertThat(grants.received).hasSize(1);
      assertThat(audit.received).hasSize(1);
      assertThat(other.received).isEmpty();
      VerificationDetail detail = Jsons.fromJson(grants.received.get(0), VerificationDetail.class);
      assertThat(detail).isEqualTo(new VerificationDetail("user-1", "guild-1"));
      assertThat(grants.received.get(0)).doesNotContain("detailType", "source");
    }

    @Test
    @DisplayName("an event with no matching rule is routed to nobody")
    void noMatchingRule() {
      channel.publish(VerifiedEvent.of("unknown-source", "user-1", "guild-1", clock.instant()));

      relay.routeNew();

      assertThat(relay.deliverDue()).isZero();
      assertThat(eventRepository.findUnrouted(10)).isEmpty();
    }

    @Test
    @DisplayName("routing twice does not duplicate deliveries")
    void noDuplicateDeliveries() {
      publish("user-1");
      relay.routeNew();
      relay.routeNew();
      relay.deliverDue();
      relay.deliverDue();

      assertThat(grants.received).hasSize(1);
      assertThat(audit.received).hasSize(1);
      assertThat(eventRepository.countDeliveries(DeliveryStatus.DELIVERED.name())).isEqualTo(2);
    }
  }

  @Nested
  @DisplayName("Retry and parking")
  class RetryTests {

    @Test
    @DisplayName("a failing subscriber does not hold back the others")
    void failureIsolated() {
      grants.failuresLeft.set(1);
      publish("user-1");
      relay.routeNew();

      relay.deliverDue();

      assertThat(grants.received).isEmpty();
      assertThat(audit.received).hasSize(1);
      assertThat(eventRepository.countDeliveries(DeliveryStatus.PENDING.name())).isEqualTo(1);
    }

    @Test
    @DisplayName("a failed delivery is retried after its backoff")
    void retriedAfterBackoff() {
      grants.failuresLeft.set(1);
      publish("user-1");
      relay.routeNew();
      relay.deliverDue();

      assertThat(relay.deliverDue()).isZero();

      clock.advance(Duration.ofSeconds(2));
      assertThat(relay.deliverDue()).isEqualTo(1);
      assertThat(grants.received).hasSize(1);
    }

    @Test
    @DisplayName("a delivery is parked after the maximum number of attempts")
    void parkedAfterMaxAttempts() {
      grants.failuresLeft.set(100);
      publish("user-1");
      relay.routeNew();

      for (int i = 0; i < 5; i++) {
        relay.deliverDue();
        clock.advance(Duration.ofMinutes(10));
      }

      assertThat(grants.received).isEmpty();
      assertThat(eventRepository.countDeliveries(DeliveryStatus.PARKED.name())).isEqualTo(1);
      assertThat(eventRepository.countDeliveries(DeliveryStatus.DELIVERED.name())).isEqualTo(1);
    }

    @Test
    @DisplayName("backoff doubles per attempt and is capped")
    void backoffGrowth() {
      assertThat(relay.backoffMillis(1)).isEqualTo(2_000);
      assertThat(relay.backoffMillis(2)).isEqualTo(4_000);
      assertThat(relay.backoffMillis(3)).isEqualTo(8_000);
      assertThat(relay.backoffMillis(20)).isEqualTo(config.getMaxBackoffMillis());
    }

    @Test
    @DisplayName("backoff stays positive and capped for very high attempt counts")
    void backoffDoesNotOverflow() {
      assertThat(relay.backoffMillis(64)).isEqualTo(config.getMaxBackoffMillis());
      assertThat(relay.backoffMillis(Integer.MAX_VALUE)).isEqualTo(config.getMaxBackoffMillis());

      config.setMaxBackoff(Duration.ofDays(365 * 100));
      EventDeliveryRelay uncapped = new EventDeliveryRelay(eventRepository, new EventRouter(), config, clock);
      assertThat(uncapped.backoffMillis(1_000)).isPositive().isEqualTo((1L << 30) * 1000L);
    }

    @Test
    @DisplayName("a delivery rejected as invalid is parked without retry")
    void invalidDetailParkedImmediately() {
      grants.rejectAsInvalid = true;
      publish("user-1");
      relay.routeNew();

      relay.deliverDue();

      assertThat(eventRepository.countDeliveries(DeliveryStatus.PARKED.name())).isEqualTo(1);
      assertThat(eventRepository.countDeliveries(DeliveryStatus.PENDING.name())).isZero();
      assertThat(audit.received).hasSize(1);

      clock.advance(Duration.ofHours(1));
      assertThat(relay.deliverDue()).isZero();
      assertThat(grants.received).isEmpty();
    }

    @Test
    @DisplayName("deliveries stuck in progress are recovered after the claim timeout")
    void recoversStuckDeliveries() {
      publish("user-1");
      relay.routeNew();
      assertThat(eventRepository.claimDue(10, clock.instant())).hasSize(2);

      clock.advance(config.getClaimTimeout().plusSeconds(1));
      relay.tick();

      assertThat(grants.received).hasSize(1);
      assertThat(audit.received).hasSize(1);
    }
  }
}
