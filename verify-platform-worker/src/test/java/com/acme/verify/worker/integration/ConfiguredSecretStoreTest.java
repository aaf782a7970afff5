package com.acme.verify.worker.integration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.acme.verify.config.SecretsConfig;
import com.acme.verify.core.TransportException;
import com.acme.verify.secret.Credential;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class ConfiguredSecretStoreTest {

  @Test
  @DisplayName("configured values win over the environment")
  void configuredValue() {
    SecretsConfig config = new SecretsConfig();
    config.setValues(Map.of("verification/bot-token", "from-config"));
    ConfiguredSecretStore store = new ConfiguredSecretStore(config, name -> "from-env");

    assertThat(store.fetch("verification/bot-token").value()).isEqualTo("from-config");
  }

  @Test
  @DisplayName("falls back to an environment variable named after the secret id")
  void environmentFallback() {
    Map<String, String> env = Map.of("VERIFICATION_BOT_TOKEN", "from-env");
    ConfiguredSecretStore store = new ConfiguredSecretStore(new SecretsConfig(), env::get);

    Credential credential = store.fetch("verification/bot-token");

    assertThat(credential.value()).isEqualTo("from-env");
    assertThat(credential.toString()).doesNotContain("from-env");
  }

  @Test
  @DisplayName("a missing secret is a transport error")
  void missing() {
    ConfiguredSecretStore store = new ConfiguredSecretStore(new SecretsConfig(), name -> null);

    assertThatThrownBy(() -> store.fetch("arn:aws:secretsmanager:eu-west-1:1:secret:token"))
        .isInstanceOf(TransportException.class)
        .hasMessageContaining("not available");
  }

  @Test
  @DisplayName("environment names are upper-cased with separators replaced")
  void environmentName() {
    assertThat(ConfiguredSecretStore.environmentName("verification/bot-token")).isEqualTo("VERIFICATION_BOT_TOKEN");
  }
}
