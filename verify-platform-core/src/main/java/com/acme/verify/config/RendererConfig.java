package com.acme.verify.config;

import java.time.Duration;

/**
 * Artifact renderer settings, shared by the render service and the worker's client. Pure POJO - no
 * framework dependencies.
 */
public class RendererConfig {

  private String url = "http://localhost:8081";
  private int concurrency = 100;
  private Duration timeout = Duration.ofSeconds(10);
  private Duration admissionWait = Duration.ofMillis(250);
  private Duration cacheMaxAge = Duration.ofDays(1);
  private int imageSize = 300;

  public String getUrl() {
    return url;
  }

  public void setUrl(String url) {
    this.url = url;
  }

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

  public Duration getAdmissionWait() {
    return admissionWait;
  }

  public void setAdmissionWait(Duration admissionWait) {
    this.admissionWait = admissionWait;
  }

  public Duration getCacheMaxAge() {
    return cacheMaxAge;
  }

  public void setCacheMaxAge(Duration cacheMaxAge) {
    this.cacheMaxAge = cacheMaxAge;
  }

  public int getImageSize() {
    return imageSize;
  }

  public void setImageSize(int imageSize) {
    this.imageSize = imageSize;
  }
}
