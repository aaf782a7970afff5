package com.acme.verify.config;

import java.time.Duration;

/** Verification worker settings. Pure POJO - no framework dependencies. */
public class WorkerConfig {

  private int concurrency = 100; // reserved, independent of queue depth
  private Duration timeout = Duration.ofMinutes(15);
  private Duration pollInterval = Duration.ofSeconds(1);
  private boolean renderArtifact = true;
  private Duration shutdownGrace = Duration.ofSeconds(30);

  public int getConcurrency() {
    return concurrency;
  }

  public void setConcurrency(int concurrency) {
    this.concurrency = concurrency;
  }

  public Duration getTimeout() {
    return timeout;
  }

  public void setTimeout(Duration timeout) {
    this.timeout = timeout;
  }

  public Duration getPollInterval() {
    return pollInterval;
  }

  public void setPollInterval(Duration pollInterval) {
    this.pollInterval = pollInterval;
  }

  public boolean isRenderArtifact() {
    return renderArtifact;
  }

  public void setRenderArtifact(boolean renderArtifact) {
    this.renderArtifact = renderArtifact;
  }

  public Duration getShutdownGrace() {
    return shutdownGrace;
  }

  public void setShutdownGrace(Duration shutdownGrace) {
    this.shutdownGrace = shutdownGrace;
  }
}
