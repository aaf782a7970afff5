package com.acme.verify.worker.integration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.acme.verify.config.GrantConfig;
import com.acme.verify.core.InvalidInputException;
import com.acme.verify.core.TransportException;
import com.acme.verify.secret.Credential;
import okhttp3.OkHttpClient;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class HttpRoleGranterTest {

  private static final Credential TOKEN = new Credential("verification/bot-token", "abc");

  private MockWebServer server;
  private HttpRoleGranter granter;

  @BeforeEach
  void setUp() throws Exception {
    server = new MockWebServer();
    server.start();
    GrantConfig config = new GrantConfig();
    config.setApiUrl(server.url("/api/v10/guilds/42").toString());
    granter = new HttpRoleGranter(new OkHttpClient(), config);
  }

  @AfterEach
  void tearDown() throws Exception {
    server.shutdown();
  }

  @Test
  @DisplayName("PUTs the role on the member with the bot authorization header")
  void putsRole() throws Exception {
    server.enqueue(new MockResponse().setResponseCode(204));

    granter.grantRole("1234", "role-9", TOKEN);

    RecordedRequest recorded = server.takeRequest();
    assertThat(recorded.getMethod()).isEqualTo("PUT");
    assertThat(recorded.getPath()).isEqualTo("/api/v10/guilds/42/members/1234/roles/role-9");
    assertThat(recorded.getHeader("Authorization")).isEqualTo("Bot abc");
  }

  @Test
  @DisplayName("granting the same role twice issues the same idempotent request")
  void repeatGrant() throws Exception {
    server.enqueue(new MockResponse().setResponseCode(204));
    server.enqueue(new MockResponse().setResponseCode(204));

    granter.grantRole("1234", "role-9", TOKEN);
    granter.grantRole("1234", "role-9", TOKEN);

    assertThat(server.takeRequest().getPath()).isEqualTo(server.takeRequest().getPath());
  }

  @Test
  @DisplayName("rate limiting and server errors are transport errors")
  void retriableFailures() {
    server.enqueue(new MockResponse().setResponseCode(429));
    server.enqueue(new MockResponse().setResponseCode(500));

    assertThatThrownBy(() -> granter.grantRole("1234", "r", TOKEN)).isInstanceOf(TransportException.class);
    assertThatThrownBy(() -> granter.grantRole("1234", "r", TOKEN)).isInstanceOf(TransportException.class);
  }

  @Test
  @DisplayName("a refused grant is invalid input")
  void refused() {
    server.enqueue(new MockResponse().setResponseCode(404));

    assertThatThrownBy(() -> granter.grantRole("1234", "r", TOKEN))
        .isInstanceOf(InvalidInputException.class)
        .hasMessageContaining("404");
  }
}
