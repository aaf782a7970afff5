package com.acme.verify.config;

import java.time.Duration;

/**
 * Ingress queue and dead-letter policy. Pure POJO - no framework dependencies.
 *
 * <p>The receive count is fixed at one: a message that is not acknowledged within its visibility
 * window goes to the dead-letter queue, it is never made visible again.
 */
public class QueueConfig {

  public static final int MAX_RECEIVE_COUNT = 1;
  public static final Duration MIN_DLQ_RETENTION = Duration.ofDays(14);

  private Duration visibilityWindow = Duration.ofMinutes(15);
  private Duration dlqRetention = Duration.ofDays(14);
  private Duration redriveInterval = Duration.ofSeconds(5);
  private Duration dlqPurgeInterval = Duration.ofHours(1);
  private int redriveBatchSize = 500;

  public Duration getVisibilityWindow() {
    return visibilityWindow;
  }

  public void setVisibilityWindow(Duration visibilityWindow) {
    this.visibilityWindow = visibilityWindow;
  }

  public Duration getDlqRetention() {
    return dlqRetention;
  }

  public void setDlqRetention(Duration dlqRetention) {
    this.dlqRetention = dlqRetention;
  }

  public Duration getRedriveInterval() {
    return redriveInterval;
  }

  public void setRedriveInterval(Duration redriveInterval) {
    this.redriveInterval = redriveInterval;
  }

  public Duration getDlqPurgeInterval() {
    return dlqPurgeInterval;
  }

  public void setDlqPurgeInterval(Duration dlqPurgeInterval) {
    this.dlqPurgeInterval = dlqPurgeInterval;
  }

  public int getRedriveBatchSize() {
    return redriveBatchSize;
  }

  public void setRedriveBatchSize(int redriveBatchSize) {
    this.redriveBatchSize = redriveBatchSize;
  }
}
