package com.acme.verify.worker.integration;

import com.acme.verify.config.SecretsConfig;
import com.acme.verify.core.TransportException;
import com.acme.verify.secret.Credential;
import com.acme.verify.spi.SecretStore;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import java.util.Locale;
import java.util.function.UnaryOperator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Resolves secrets from {@code secrets.values.<id>} first, then from an environment variable named
 * after the id ({@code verification/bot-token} becomes {@code VERIFICATION_BOT_TOKEN}).
 */
@Singleton
public class ConfiguredSecretStore implements SecretStore {
  private static final Logger LOG = LoggerFactory.getLogger(ConfiguredSecretStore.class);

  private final SecretsConfig config;
  private final UnaryOperator<String> environment;

  @Inject
  public ConfiguredSecretStore(SecretsConfig config) {
    this(config, System::getenv);
  }

  ConfiguredSecretStore(SecretsConfig config, UnaryOperator<String> environment) {
    this.config = config;
    this.environment = environment;
  }

  @Override
  public Credential fetch(String secretId) {
    if (secretId == null || secretId.isBlank()) {
      throw new TransportException("secret id is required");
    }
    String value = config.getValues().get(secretId);
    if (value == null) {
      value = environment.apply(environmentName(secretId));
    }
    if (value == null || value.isEmpty()) {
      throw new TransportException("secret " + secretId + " is not available");
    }
    LOG.debug("Resolved secret {}", secretId);
    return new Credential(secretId, value);
  }

  static String environmentName(String secretId) {
    return secretId.replaceAll("[^A-Za-z0-9]", "_").toUpperCase(Locale.ROOT);
  }
}
