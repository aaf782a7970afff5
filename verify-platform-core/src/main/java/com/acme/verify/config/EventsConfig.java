package com.acme.verify.config;

import com.acme.verify.events.EventTypeConstants;

import java.time.Duration;

/**
 * Event channel settings, including the retry and parking policy applied to each subscriber
 * independently. Pure POJO - no framework dependencies.
 */
public class EventsConfig {

  private String busName = "verification-events";
  private String source = EventTypeConstants.WORLD_ID_SOURCE;
  private Duration relayInterval = Duration.ofSeconds(1);
  private int batchSize = 100;
  private int maxAttempts = 5;
  private Duration maxBackoff = Duration.ofMinutes(5);
  private Duration claimTimeout = Duration.ofMinutes(1);
  private Kafka kafka = new Kafka();

  public String getBusName() {
    return busName;
  }

  public void setBusName(String busName) {
    this.busName = busName;
  }

  public String getSource() {
    return source;
  }

  public void setSource(String source) {
    this.source = source;
  }

  public Duration getRelayInterval() {
    return relayInterval;
  }

  public void setRelayInterval(Duration relayInterval) {
    this.relayInterval = relayInterval;
  }

  public int getBatchSize() {
    return batchSize;
  }

  public void setBatchSize(int batchSize) {
    this.batchSize = batchSize;
  }

  public int getMaxAttempts() {
    return maxAttempts;
  }

  public void setMaxAttempts(int maxAttempts) {
    this.maxAttempts = maxAttempts;
  }

  public Duration getMaxBackoff() {
    return maxBackoff;
  }

  public void setMaxBackoff(Duration maxBackoff) {
    this.maxBackoff = maxBackoff;
  }

  public long getMaxBackoffMillis() {
    return maxBackoff.toMillis();
  }

  public Duration getClaimTimeout() {
    return claimTimeout;
  }

  public void setClaimTimeout(Duration claimTimeout) {
    this.claimTimeout = claimTimeout;
  }

  public Kafka getKafka() {
    return kafka;
  }

  public void setKafka(Kafka kafka) {
    this.kafka = kafka;
  }

  /** Optional subscriber that forwards verification details to a Kafka topic. */
  public static class Kafka {
    private boolean enabled = false;
    private String topic = "events.verification-succeeded";
    private Duration sendTimeout = Duration.ofSeconds(10);

    public boolean isEnabled() {
      return enabled;
    }

    public void setEnabled(boolean enabled) {
      this.enabled = enabled;
    }

    public String getTopic() {
      return topic;
    }

    public void setTopic(String topic) {
      this.topic = topic;
    }

    public Duration getSendTimeout() {
      return sendTimeout;
    }

    public void setSendTimeout(Duration sendTimeout) {
      this.sendTimeout = sendTimeout;
    }
  }
}
