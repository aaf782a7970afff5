package com.acme.verify.worker.integration;

import com.acme.verify.config.VerifierConfig;
import com.acme.verify.core.FailureReason;
import com.acme.verify.core.Jsons;
import com.acme.verify.core.VerifierException;
import com.acme.verify.domain.VerificationOutcome;
import com.acme.verify.domain.VerificationRequest;
import com.acme.verify.render.RenderedArtifact;
import com.acme.verify.secret.Credential;
import com.acme.verify.spi.ProofVerifier;
import com.fasterxml.jackson.databind.JsonNode;
import jakarta.inject.Named;
import jakarta.inject.Singleton;
import java.io.IOException;
import java.io.InterruptedIOException;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import okhttp3.HttpUrl;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs the proof-of-personhood check through the proof system's HTTP API. The call blocks until the
 * proof system answers with {@code {"verified": bool, "reason": "..."}}.
 */
@Singleton
public class HttpProofVerifier implements ProofVerifier {
  private static final Logger LOG = LoggerFactory.getLogger(HttpProofVerifier.class);
  private static final MediaType JSON = MediaType.get("application/json; charset=utf-8");

  private final OkHttpClient client;
  private final VerifierConfig config;
  private final VerificationLinkBuilder links;

  public HttpProofVerifier(
      @Named("verifier") OkHttpClient client, VerifierConfig config, VerificationLinkBuilder links) {
    this.client = client;
    this.config = config;
    this.links = links;
  }

  @Override
  public VerificationOutcome verify(
      VerificationRequest request, Credential credential, Optional<RenderedArtifact> artifact) {
    HttpUrl base = HttpUrl.parse(config.getUrl());
    if (base == null) {
      throw new VerifierException("verifier.url is not a valid URL: " + config.getUrl());
    }
    Request httpRequest =
        new Request.Builder()
            .url(base.newBuilder().addPathSegment("verify").build())
            .post(RequestBody.create(Jsons.toJson(body(request, artifact)), JSON))
            .addHeader("Authorization", "Bearer " + credential.value())
            .build();

    try (Response response = client.newCall(httpRequest).execute()) {
      if (!response.isSuccessful()) {
        throw new VerifierException("proof system returned HTTP " + response.code());
      }
      ResponseBody responseBody = response.body();
      JsonNode json = Jsons.mapper().readTree(responseBody == null ? "" : responseBody.string());
      if (json == null || !json.has("verified")) {
        throw new VerifierException("proof system response has no verdict");
      }
      if (json.get("verified").asBoolean()) {
        LOG.info("Proof accepted for subject={}", request.subject());
        return VerificationOutcome.succeeded(request.subject(), request.context());
      }
      String reason = json.hasNonNull("reason") ? json.get("reason").asText() : "proof rejected";
      LOG.info("Proof rejected for subject={}: {}", request.subject(), reason);
      return VerificationOutcome.failed(FailureReason.VERIFIER_ERROR, reason);
    } catch (InterruptedIOException e) {
      throw new VerifierException("proof system call exceeded " + config.getTimeout(), e);
    } catch (IOException e) {
      throw new VerifierException("proof system unreachable: " + e.getMessage(), e);
    }
  }

  private Map<String, Object> body(VerificationRequest request, Optional<RenderedArtifact> artifact) {
    Map<String, Object> body = new LinkedHashMap<>();
    body.put("app_name", config.getAppName());
    body.put("action_id", config.getActionId());
    body.put("signal", request.hasSignal() ? request.signal() : config.getSignal());
    body.put("signal_description", config.getSignalDescription());
    body.put("subject", request.subject());
    body.put("context", request.context());
    body.put("verification_link", links.link(request));
    artifact.ifPresent(a -> {
      body.put("artifact_content_type", a.contentType());
      body.put("artifact_base64", Base64.getEncoder().encodeToString(a.bytes()));
    });
    return body;
  }
}
