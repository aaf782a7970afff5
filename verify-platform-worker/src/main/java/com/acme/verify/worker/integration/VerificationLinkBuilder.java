package com.acme.verify.worker.integration;

import com.acme.verify.config.VerifierConfig;
import com.acme.verify.core.InvalidInputException;
import com.acme.verify.domain.VerificationRequest;
import com.acme.verify.render.RenderRequest;
import jakarta.inject.Singleton;
import okhttp3.HttpUrl;

/**
 * Builds the link a subject opens (or scans) to prove personhood for one request. The request's
 * own signal takes precedence over the configured default.
 */
@Singleton
public class VerificationLinkBuilder {

  private final VerifierConfig config;

  public VerificationLinkBuilder(VerifierConfig config) {
    this.config = config;
  }

  public String link(VerificationRequest request) {
    HttpUrl base = HttpUrl.parse(config.getLinkBaseUrl());
    if (base == null) {
      throw new InvalidInputException("verifier.link-base-url is not a valid URL: " + config.getLinkBaseUrl());
    }
    HttpUrl.Builder url = base.newBuilder();
    addIfPresent(url, "app_name", config.getAppName());
    addIfPresent(url, "action_id", config.getActionId());
    addIfPresent(url, "signal", request.hasSignal() ? request.signal() : config.getSignal());
    addIfPresent(url, "signal_description", config.getSignalDescription());
    url.addQueryParameter("subject", request.subject());
    url.addQueryParameter("context", request.context());
    return url.build().toString();
  }

  public RenderRequest renderRequest(VerificationRequest request) {
    return new RenderRequest(link(request));
  }

  private static void addIfPresent(HttpUrl.Builder url, String name, String value) {
    if (value != null && !value.isBlank()) {
      url.addQueryParameter(name, value);
    }
  }
}
