package com.acme.verify.worker.support;

import com.acme.verify.config.QueueConfig;
import com.acme.verify.persistence.jdbc.dlq.H2DeadLetterRepository;
import com.acme.verify.persistence.jdbc.event.H2EventRepository;
import com.acme.verify.persistence.jdbc.queue.H2QueueRepository;
import com.acme.verify.worker.queue.DeadLetterService;
import com.acme.verify.worker.queue.IngressQueueService;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import java.sql.Connection;
import java.sql.Statement;
import java.time.Instant;
import org.flywaydb.core.Flyway;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.TestInstance;

/**
 * Wires the real H2 repositories and queue services over a per-class in-memory database. Tables are
 * emptied and the clock reset before every test.
 */
@TestInstance(TestInstance.Lifecycle.PER_CLASS)
public abstract class H2PipelineTestBase {

  protected static final Instant T0 = Instant.parse("2026-01-01T10:00:00Z");

  protected HikariDataSource dataSource;
  protected H2QueueRepository queueRepository;
  protected H2DeadLetterRepository deadLetterRepository;
  protected H2EventRepository eventRepository;

  protected MutableClock clock;
  protected QueueConfig queueConfig;
  protected IngressQueueService queue;
  protected DeadLetterService deadLetters;

  @BeforeAll
  protected void setupSchema() {
    HikariConfig config = new HikariConfig();
    config.setJdbcUrl(
        "jdbc:h2:mem:" + getClass().getSimpleName() + ";DB_CLOSE_DELAY=-1;DB_CLOSE_ON_EXIT=FALSE");
    config.setDriverClassName("org.h2.Driver");
    config.setUsername("sa");
    config.setPassword("");
    config.setMaximumPoolSize(20);

    dataSource = new HikariDataSource(config);

    Flyway.configure()
        .dataSource(dataSource)
        .locations("classpath:db/migration/h2")
        .load()
        .migrate();

    queueRepository = new H2QueueRepository(dataSource);
    deadLetterRepository = new H2DeadLetterRepository(dataSource);
    eventRepository = new H2EventRepository(dataSource);
  }

  @BeforeEach
  protected void resetState() throws Exception {
    truncate("verification_queue", "verification_dlq", "event_delivery", "event_store");
    clock = new MutableClock(T0);
    queueConfig = new QueueConfig();
    queue = new IngressQueueService(queueRepository, queueConfig, clock);
    deadLetters = new DeadLetterService(queueRepository, deadLetterRepository, queue, queueConfig, clock);
  }

  @AfterAll
  void tearDown() {
    if (dataSource != null) {
      dataSource.close();
    }
  }

  protected void truncate(String... tables) throws Exception {
    try (Connection conn = dataSource.getConnection();
        Statement st = conn.createStatement()) {
      for (String table : tables) {
        st.execute("DELETE FROM " + table);
      }
    }
  }
}
