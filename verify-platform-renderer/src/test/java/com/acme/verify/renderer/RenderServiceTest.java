package com.acme.verify.renderer;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.acme.verify.config.RendererConfig;
import com.acme.verify.core.ConcurrencyLimiter;
import com.acme.verify.core.FailureReason;
import com.acme.verify.core.InvalidInputException;
import com.acme.verify.core.OverloadedException;
import com.acme.verify.core.RenderException;
import com.acme.verify.render.RenderRequest;
import com.acme.verify.render.RenderedArtifact;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class RenderServiceTest {

  private final List<RenderService> services = new ArrayList<>();

  @AfterEach
  void closeServices() {
    services.forEach(RenderService::close);
  }

  private RenderService service(QrCodeEncoder encoder, int concurrency, Duration timeout, Duration admissionWait) {
    RendererConfig config = new RendererConfig();
    config.setConcurrency(concurrency);
    config.setTimeout(timeout);
    config.setAdmissionWait(admissionWait);
    RenderService service =
        new RenderService(encoder, new ConcurrencyLimiter("renderer", concurrency), config);
    services.add(service);
    return service;
  }

  /** Encoder that blocks until released, tracking how many encodes run at once. */
  static class GatedEncoder extends QrCodeEncoder {
    final CountDownLatch gate;
    final AtomicInteger running = new AtomicInteger();
    final AtomicInteger peak = new AtomicInteger();
    final CountDownLatch started;

    GatedEncoder(CountDownLatch gate, int expectedStarts) {
      super(100);
      this.gate = gate;
      this.started = new CountDownLatch(expectedStarts);
    }

    @Override
    public byte[] encode(String payload) {
      int now = running.incrementAndGet();
      peak.accumulateAndGet(now, Math::max);
      started.countDown();
      try {
        gate.await(5, TimeUnit.SECONDS);
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
      } finally {
        running.decrementAndGet();
      }
      return new byte[] {1, 2, 3};
    }
  }

  private static void awaitAvailable(ConcurrencyLimiter limiter, int expected) throws InterruptedException {
    long deadline = System.currentTimeMillis() + 5000;
    while (limiter.available() != expected && System.currentTimeMillis() < deadline) {
      Thread.sleep(10);
    }
  }

  @Nested
  @DisplayName("Rendering")
  class RenderingTests {

    @Test
    @DisplayName("renders PNG bytes and is idempotent")
    void rendersIdempotently() {
      RenderService service =
          service(new QrCodeEncoder(200), 4, Duration.ofSeconds(10), Duration.ofMillis(100));

      RenderedArtifact first = service.render(new RenderRequest("verify:u1:join"));
      RenderedArtifact second = service.render(new RenderRequest("verify:u1:join"));

      assertThat(first.contentType()).isEqualTo(RenderedArtifact.PNG);
      assertThat(first.bytes()).isEqualTo(second.bytes());
      assertThat(first).isEqualTo(second);
      assertThat(service.limiter().available()).isEqualTo(4);
    }

    @Test
    @DisplayName("blank payloads are rejected without taking a permit")
    void rejectsBlank() {
      RenderService service =
          service(new QrCodeEncoder(200), 1, Duration.ofSeconds(1), Duration.ofMillis(10));

      assertThatThrownBy(() -> service.render(new RenderRequest(" ")))
          .isInstanceOf(InvalidInputException.class);
      assertThatThrownBy(() -> service.render(new RenderRequest(null)))
          .isInstanceOf(InvalidInputException.class);
      assertThatThrownBy(
              () -> service.render(new RenderRequest("x".repeat(RenderRequest.MAX_PAYLOAD_LENGTH + 1))))
          .isInstanceOf(InvalidInputException.class);
      assertThat(service.limiter().peakInFlight()).isZero();
    }
  }

  @Nested
  @DisplayName("Admission control")
  class AdmissionTests {

    @Test
    @DisplayName("a render beyond the ceiling is rejected as overloaded")
    void overloaded() throws Exception {
      CountDownLatch gate = new CountDownLatch(1);
      GatedEncoder encoder = new GatedEncoder(gate, 1);
      RenderService service = service(encoder, 1, Duration.ofSeconds(5), Duration.ofMillis(50));
      ExecutorService callers = Executors.newSingleThreadExecutor();
      try {
        Future<RenderedArtifact> first = callers.submit(() -> service.render(new RenderRequest("a")));
        assertThat(encoder.started.await(5, TimeUnit.SECONDS)).isTrue();

        assertThatThrownBy(() -> service.render(new RenderRequest("b")))
            .isInstanceOf(OverloadedException.class)
            .extracting(e -> ((OverloadedException) e).getReason())
            .isEqualTo(FailureReason.OVERLOADED);

        gate.countDown();
        assertThat(first.get(5, TimeUnit.SECONDS).size()).isEqualTo(3);
      } finally {
        callers.shutdownNow();
      }
    }

    @Test
    @DisplayName("never more than R renders run at once; waiting callers all complete")
    void boundedConcurrency() throws Exception {
      int ceiling = 3;
      CountDownLatch gate = new CountDownLatch(1);
      GatedEncoder encoder = new GatedEncoder(gate, ceiling);
      RenderService service = service(encoder, ceiling, Duration.ofSeconds(10), Duration.ofSeconds(10));
      ExecutorService callers = Executors.newFixedThreadPool(10);
      try {
        List<Future<RenderedArtifact>> results = new ArrayList<>();
        for (int i = 0; i < 10; i++) {
          String payload = "p" + i;
          results.add(callers.submit(() -> service.render(new RenderRequest(payload))));
        }
        assertThat(encoder.started.await(5, TimeUnit.SECONDS)).isTrue();
        Thread.sleep(100);
        assertThat(encoder.running.get()).isEqualTo(ceiling);

        gate.countDown();
        for (Future<RenderedArtifact> result : results) {
          assertThat(result.get(10, TimeUnit.SECONDS)).isNotNull();
        }
        assertThat(encoder.peak.get()).isLessThanOrEqualTo(ceiling);
        assertThat(service.limiter().peakInFlight()).isLessThanOrEqualTo(ceiling);
      } finally {
        callers.shutdownNow();
      }
    }
  }

  @Nested
  @DisplayName("Deadline")
  class DeadlineTests {

    @Test
    @DisplayName("a render past its deadline fails with RenderException and frees its permit")
    void timesOut() throws Exception {
      CountDownLatch gate = new CountDownLatch(1);
      GatedEncoder encoder = new GatedEncoder(gate, 1);
      RenderService service = service(encoder, 1, Duration.ofMillis(100), Duration.ofMillis(10));

      assertThatThrownBy(() -> service.render(new RenderRequest("slow")))
          .isInstanceOf(RenderException.class)
          .hasMessageContaining("deadline");

      awaitAvailable(service.limiter(), 1);
      assertThat(service.limiter().available()).isEqualTo(1);
      assertThat(encoder.running.get()).isZero();
    }
  }
}
