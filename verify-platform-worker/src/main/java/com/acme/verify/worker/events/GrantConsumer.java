package com.acme.verify.worker.events;

import com.acme.verify.config.EventsConfig;
import com.acme.verify.config.GrantConfig;
import com.acme.verify.config.SecretsConfig;
import com.acme.verify.core.InvalidInputException;
import com.acme.verify.core.Jsons;
import com.acme.verify.events.EventPattern;
import com.acme.verify.events.EventSubscriber;
import com.acme.verify.events.EventTypeConstants;
import com.acme.verify.events.VerificationDetail;
import com.acme.verify.secret.InvocationCredential;
import com.acme.verify.spi.RoleGranter;
import com.acme.verify.spi.SecretStore;
import jakarta.inject.Singleton;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Grants the configured roles to every verified subject. */
@Singleton
public class GrantConsumer implements EventSubscriber {
  private static final Logger LOG = LoggerFactory.getLogger(GrantConsumer.class);

  public static final String NAME = "grant-roles";

  private final RoleGranter granter;
  private final SecretStore secrets;
  private final GrantConfig grantConfig;
  private final SecretsConfig secretsConfig;
  private final EventPattern pattern;

  public GrantConsumer(
      RoleGranter granter,
      SecretStore secrets,
      GrantConfig grantConfig,
      SecretsConfig secretsConfig,
      EventsConfig eventsConfig) {
    this.granter = granter;
    this.secrets = secrets;
    this.grantConfig = grantConfig;
    this.secretsConfig = secretsConfig;
    this.pattern = new EventPattern(eventsConfig.getSource(), EventTypeConstants.VERIFICATION_SUCCEEDED);
  }

  @Override
  public String name() {
    return NAME;
  }

  @Override
  public EventPattern pattern() {
    return pattern;
  }

  @Override
  public void deliver(String detailJson) {
    VerificationDetail detail;
    try {
      detail = Jsons.fromJson(detailJson, VerificationDetail.class);
    } catch (IllegalArgumentException e) {
      throw new InvalidInputException("unreadable verification detail: " + e.getMessage(), e);
    }
    if (detail.subject() == null || detail.subject().isBlank()) {
      throw new InvalidInputException("verification detail has no subject");
    }
    List<String> roles = grantConfig.getRoles();
    if (roles.isEmpty()) {
      LOG.info("No roles configured; nothing to grant to subject={}", detail.subject());
      return;
    }
    InvocationCredential credential = new InvocationCredential(secrets, secretsConfig.getTokenSecretId());
    for (String role : roles) {
      granter.grantRole(detail.subject(), role, credential.get());
    }
    LOG.info("Granted {} role(s) to subject={} for context={}", roles.size(), detail.subject(), detail.context());
  }
}
