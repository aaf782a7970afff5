package com.acme.verify.worker.integration;

import static org.assertj.core.api.Assertions.assertThat;

import com.acme.verify.config.VerifierConfig;
import com.acme.verify.domain.VerificationRequest;
import okhttp3.HttpUrl;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class VerificationLinkBuilderTest {

  private VerifierConfig config() {
    VerifierConfig config = new VerifierConfig();
    config.setAppName("app_123");
    config.setActionId("join-guild");
    config.setSignal("default");
    config.setSignalDescription("Join the guild");
    return config;
  }

  @Test
  @DisplayName("link carries the verifier settings and the request's subject and context")
  void link() {
    HttpUrl url = HttpUrl.parse(new VerificationLinkBuilder(config()).link(new VerificationRequest("u 1", "g1", null)));

    assertThat(url).isNotNull();
    assertThat(url.host()).isEqualTo("id.worldcoin.org");
    assertThat(url.queryParameter("app_name")).isEqualTo("app_123");
    assertThat(url.queryParameter("action_id")).isEqualTo("join-guild");
    assertThat(url.queryParameter("signal")).isEqualTo("default");
    assertThat(url.queryParameter("signal_description")).isEqualTo("Join the guild");
    assertThat(url.queryParameter("subject")).isEqualTo("u 1");
    assertThat(url.queryParameter("context")).isEqualTo("g1");
  }

  @Test
  @DisplayName("the request's signal replaces the configured one")
  void requestSignal() {
    HttpUrl url = HttpUrl.parse(new VerificationLinkBuilder(config()).link(new VerificationRequest("u1", "g1", "custom")));

    assertThat(url.queryParameter("signal")).isEqualTo("custom");
  }

  @Test
  @DisplayName("the same request always yields the same link")
  void deterministic() {
    VerificationLinkBuilder builder = new VerificationLinkBuilder(config());
    VerificationRequest request = new VerificationRequest("u1", "g1", null);

    assertThat(builder.renderRequest(request)).isEqualTo(builder.renderRequest(request));
  }

  @Test
  @DisplayName("unset settings are left out")
  void omitsBlankSettings() {
    HttpUrl url = HttpUrl.parse(new VerificationLinkBuilder(new VerifierConfig()).link(new VerificationRequest("u1", "g1", null)));

    assertThat(url.queryParameterNames()).containsExactlyInAnyOrder("subject", "context");
  }
}
