package com.acme.verify.worker.config;

import com.acme.verify.config.EventsConfig;
import com.acme.verify.config.GrantConfig;
import com.acme.verify.config.QueueConfig;
import com.acme.verify.config.RendererConfig;
import com.acme.verify.config.VerifierConfig;
import com.acme.verify.config.WorkerConfig;
import com.acme.verify.events.EventRouter;
import io.micronaut.context.annotation.Property;
import io.micronaut.context.annotation.Requires;
import io.micronaut.context.event.ApplicationEventListener;
import io.micronaut.runtime.server.event.ServerStartupEvent;
import jakarta.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Logs effective configuration on application startup for visibility and troubleshooting.
 * Disabled in test environment to avoid configuration errors.
 */
@Singleton
@Requires(notEnv = "test")
public class ConfigurationLogger implements ApplicationEventListener<ServerStartupEvent> {

  private static final Logger LOG = LoggerFactory.getLogger(ConfigurationLogger.class);

  private final QueueConfig queueConfig;
  private final WorkerConfig workerConfig;
  private final RendererConfig rendererConfig;
  private final VerifierConfig verifierConfig;
  private final EventsConfig eventsConfig;
  private final GrantConfig grantConfig;
  private final EventRouter eventRouter;

  @Property(name = "micronaut.server.port")
  private int serverPort;

  @Property(name = "datasources.default.url")
  private String datasourceUrl;

  @Property(name = "datasources.default.maximum-pool-size")
  private int maxPoolSize;

  @Property(name = "db.dialect")
  private String dialect;

  public ConfigurationLogger(
      QueueConfig queueConfig,
      WorkerConfig workerConfig,
      RendererConfig rendererConfig,
      VerifierConfig verifierConfig,
      EventsConfig eventsConfig,
      GrantConfig grantConfig,
      EventRouter eventRouter) {
    this.queueConfig = queueConfig;
    this.workerConfig = workerConfig;
    this.rendererConfig = rendererConfig;
    this.verifierConfig = verifierConfig;
    this.eventsConfig = eventsConfig;
    this.grantConfig = grantConfig;
    this.eventRouter = eventRouter;
  }

  @Override
  public void onApplicationEvent(ServerStartupEvent event) {
    LOG.info("═══════════════════════════════════════════════════════════════════════════════");
    LOG.info("                         EFFECTIVE CONFIGURATION                                ");
    LOG.info("═══════════════════════════════════════════════════════════════════════════════");
    LOG.info("");

    LOG.info("━━━ Server & Database ━━━");
    LOG.info("  Port:               {} (operator and enqueue endpoints)", serverPort);
    LOG.info("  Dialect:            {}", dialect);
    LOG.info("  JDBC URL:           {}", datasourceUrl);
    LOG.info("  Max Pool Size:      {} (HikariCP maximum connections)", maxPoolSize);
    LOG.info("");

    LOG.info("━━━ Queue ━━━");
    LOG.info("  Visibility Window:  {} (unacknowledged messages are dead-lettered after this)", queueConfig.getVisibilityWindow());
    LOG.info("  Max Receive Count:  {} (no automatic redelivery)", QueueConfig.MAX_RECEIVE_COUNT);
    LOG.info("  DLQ Retention:      {}", queueConfig.getDlqRetention());
    LOG.info("  Redrive Interval:   {}", queueConfig.getRedriveInterval());
    LOG.info("");

    LOG.info("━━━ Worker ━━━");
    LOG.info("  Concurrency:        {} (reserved worker permits)", workerConfig.getConcurrency());
    LOG.info("  Timeout:            {} (per verification attempt)", workerConfig.getTimeout());
    LOG.info("  Render Artifact:    {}", workerConfig.isRenderArtifact() ? "ENABLED" : "DISABLED");
    LOG.info("  Renderer URL:       {} (call timeout {})", rendererConfig.getUrl(), rendererConfig.getTimeout());
    LOG.info("  Verifier URL:       {} (call timeout {})", verifierConfig.getUrl(), verifierConfig.getTimeout());
    LOG.info("  Verifier Action:    {} / {}", verifierConfig.getAppName(), verifierConfig.getActionId());
    LOG.info("");

    LOG.info("━━━ Event Channel ━━━");
    LOG.info("  Bus:                {} (source {})", eventsConfig.getBusName(), eventsConfig.getSource());
    LOG.info("  Max Attempts:       {} (per subscriber, then parked)", eventsConfig.getMaxAttempts());
    LOG.info("  Max Backoff:        {}", eventsConfig.getMaxBackoff());
    LOG.info("  Kafka Forwarding:   {}", eventsConfig.getKafka().isEnabled() ? eventsConfig.getKafka().getTopic() : "DISABLED");
    eventRouter.rules().forEach(rule -> LOG.info("  Rule:               {} -> {}", rule.pattern(), rule.target()));
    LOG.info("  Granted Roles:      {}", grantConfig.getRoles().isEmpty() ? "(none)" : grantConfig.getRoles());
    LOG.info("");

    LOG.info("═══════════════════════════════════════════════════════════════════════════════");
    LOG.info("                      APPLICATION READY FOR TRAFFIC                             ");
    LOG.info("═══════════════════════════════════════════════════════════════════════════════");
    LOG.info("");
  }
}
