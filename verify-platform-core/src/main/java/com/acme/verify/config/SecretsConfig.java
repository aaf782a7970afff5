package com.acme.verify.config;

import java.util.HashMap;
import java.util.Map;

/** Secret identifiers, plus statically configured secret values for local runs and tests. */
public class SecretsConfig {

  private String tokenSecretId = "verification/bot-token";
  private Map<String, String> values = new HashMap<>();

  public String getTokenSecretId() {
    return tokenSecretId;
  }

  public void setTokenSecretId(String tokenSecretId) {
    this.tokenSecretId = tokenSecretId;
  }

  public Map<String, String> getValues() {
    return values;
  }

  public void setValues(Map<String, String> values) {
    this.values = values == null ? new HashMap<>() : new HashMap<>(values);
  }
}
