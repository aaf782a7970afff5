package com.acme.verify.worker.integration;

import com.acme.verify.config.GrantConfig;
import com.acme.verify.core.InvalidInputException;
import com.acme.verify.core.TransportException;
import com.acme.verify.secret.Credential;
import com.acme.verify.spi.RoleGranter;
import jakarta.inject.Named;
import jakarta.inject.Singleton;
import java.io.IOException;
import okhttp3.HttpUrl;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Grants roles through the community platform's REST API:
 * {@code PUT {api-url}/members/{subject}/roles/{role}}. PUT of a role already held is a no-op.
 */
@Singleton
public class HttpRoleGranter implements RoleGranter {
  private static final Logger LOG = LoggerFactory.getLogger(HttpRoleGranter.class);

  private final OkHttpClient client;
  private final GrantConfig config;

  public HttpRoleGranter(@Named("grant") OkHttpClient client, GrantConfig config) {
    this.client = client;
    this.config = config;
  }

  @Override
  public void grantRole(String subject, String roleId, Credential credential) {
    HttpUrl base = HttpUrl.parse(config.getApiUrl());
    if (base == null) {
      throw new InvalidInputException("grant.api-url is not a valid URL: " + config.getApiUrl());
    }
    HttpUrl url =
        base.newBuilder()
            .addPathSegment("members")
            .addPathSegment(subject)
            .addPathSegment("roles")
            .addPathSegment(roleId)
            .build();
    Request request =
        new Request.Builder()
            .url(url)
            .put(RequestBody.create(new byte[0], null))
            .addHeader("Authorization", config.getAuthScheme() + " " + credential.value())
            .build();

    try (Response response = client.newCall(request).execute()) {
      int code = response.code();
      if (response.isSuccessful()) {
        LOG.info("Granted role {} to subject={}", roleId, subject);
        return;
      }
      if (code == 429 || code >= 500) {
        throw new TransportException("grant API returned HTTP " + code + " for role " + roleId);
      }
      throw new InvalidInputException("grant API refused role " + roleId + " for subject " + subject + " (HTTP " + code + ")");
    } catch (IOException e) {
      throw new TransportException("grant API unreachable: " + e.getMessage(), e);
    }
  }
}
