package com.acme.verify.config;

import java.time.Duration;

/** Parameters of the external proof system. Pure POJO - no framework dependencies. */
public class VerifierConfig {

  private String url = "http://localhost:8082";
  private String appName;
  private String actionId;
  private String signal;
  private String signalDescription;
  private String linkBaseUrl = "https://id.worldcoin.org/verify";
  private Duration timeout = Duration.ofMinutes(10);

  public String getUrl() {
    return url;
  }

  public void setUrl(String url) {
    this.url = url;
  }

  public String getAppName() {
    return appName;
  }

  public void setAppName(String appName) {
    this.appName = appName;
  }

  public String getActionId() {
    return actionId;
  }

  public void setActionId(String actionId) {
    this.actionId = actionId;
  }

  public String getSignal() {
    return signal;
  }

  public void setSignal(String signal) {
    this.signal = signal;
  }

  public String getSignalDescription() {
    return signalDescription;
  }

  public void setSignalDescription(String signalDescription) {
    this.signalDescription = signalDescription;
  }

  public String getLinkBaseUrl() {
    return linkBaseUrl;
  }

  public void setLinkBaseUrl(String linkBaseUrl) {
    this.linkBaseUrl = linkBaseUrl;
  }

  public Duration getTimeout() {
    return timeout;
  }

  public void setTimeout(Duration timeout) {
    this.timeout = timeout;
  }
}
