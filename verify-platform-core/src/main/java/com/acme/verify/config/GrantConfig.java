package com.acme.verify.config;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/** Roles granted to verified subjects and the grant API they are granted through. */
public class GrantConfig {

  private List<String> roles = new ArrayList<>();
  private String apiUrl = "https://discord.com/api/v10/guilds/0";
  private String authScheme = "Bot";
  private Duration timeout = Duration.ofSeconds(20);

  /** Ordered list of role identifiers. */
  public List<String> getRoles() {
    return roles;
  }

  public void setRoles(List<String> roles) {
    this.roles = roles == null ? new ArrayList<>() : new ArrayList<>(roles);
  }

  public String getApiUrl() {
    return apiUrl;
  }

  public void setApiUrl(String apiUrl) {
    this.apiUrl = apiUrl;
  }

  public String getAuthScheme() {
    return authScheme;
  }

  public void setAuthScheme(String authScheme) {
    this.authScheme = authScheme;
  }

  public Duration getTimeout() {
    return timeout;
  }

  public void setTimeout(Duration timeout) {
    this.timeout = timeout;
  }
}
