package com.acme.verify.worker.config;

import com.acme.verify.config.EventsConfig;
import com.acme.verify.config.GrantConfig;
import com.acme.verify.config.QueueConfig;
import com.acme.verify.config.RendererConfig;
import com.acme.verify.config.SecretsConfig;
import com.acme.verify.config.VerifierConfig;
import com.acme.verify.config.WorkerConfig;
import com.acme.verify.core.ConcurrencyLimiter;
import com.acme.verify.events.EventRouter;
import com.acme.verify.events.EventSubscriber;
import io.micronaut.context.annotation.ConfigurationProperties;
import io.micronaut.context.annotation.Factory;
import jakarta.inject.Named;
import jakarta.inject.Singleton;
import java.time.Clock;
import java.util.List;

/**
 * Factory for creating core domain beans with framework-specific configuration.
 *
 * <p>The core module stays free of framework dependencies; this worker module does the DI wiring.
 */
@Factory
public class CoreBeansFactory {

  /** Creates QueueConfig bean populated from application.yml queue.* properties */
  @Singleton
  @ConfigurationProperties("queue")
  public QueueConfig queueConfig() {
    return new QueueConfig();
  }

  /** Creates WorkerConfig bean populated from application.yml worker.* properties */
  @Singleton
  @ConfigurationProperties("worker")
  public WorkerConfig workerConfig() {
    return new WorkerConfig();
  }

  @Singleton
  @ConfigurationProperties("renderer")
  public RendererConfig rendererConfig() {
    return new RendererConfig();
  }

  @Singleton
  @ConfigurationProperties("verifier")
  public VerifierConfig verifierConfig() {
    return new VerifierConfig();
  }

  @Singleton
  @ConfigurationProperties("events")
  public EventsConfig eventsConfig() {
    return new EventsConfig();
  }

  @Singleton
  @ConfigurationProperties("grant")
  public GrantConfig grantConfig() {
    return new GrantConfig();
  }

  @Singleton
  @ConfigurationProperties("secrets")
  public SecretsConfig secretsConfig() {
    return new SecretsConfig();
  }

  /** Routing table built from every subscriber bean in the context. */
  @Singleton
  public EventRouter eventRouter(List<EventSubscriber> subscribers) {
    return new EventRouter(subscribers);
  }

  /** Worker permits; one per concurrent verification. */
  @Singleton
  @Named("worker")
  public ConcurrencyLimiter workerLimiter(WorkerConfig workerConfig) {
    return new ConcurrencyLimiter("worker", workerConfig.getConcurrency());
  }

  @Singleton
  public Clock clock() {
    return Clock.systemUTC();
  }
}
