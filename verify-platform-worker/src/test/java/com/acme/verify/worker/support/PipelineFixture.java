package com.acme.verify.worker.support;

import com.acme.verify.config.EventsConfig;
import com.acme.verify.config.SecretsConfig;
import com.acme.verify.config.VerifierConfig;
import com.acme.verify.config.WorkerConfig;
import com.acme.verify.render.RenderedArtifact;
import com.acme.verify.secret.Credential;
import com.acme.verify.spi.ArtifactRenderer;
import com.acme.verify.spi.EventPublisher;
import com.acme.verify.spi.ProofVerifier;
import com.acme.verify.spi.SecretStore;
import com.acme.verify.spi.VerificationQueue;
import com.acme.verify.worker.integration.VerificationLinkBuilder;
import com.acme.verify.worker.processing.OutcomeCommitter;
import com.acme.verify.worker.processing.VerificationWorker;
import java.time.Clock;
import java.util.concurrent.atomic.AtomicInteger;

/** Builds a {@link VerificationWorker} around test doubles, counting calls to each dependency. */
public final class PipelineFixture {

  public static final Credential TOKEN = new Credential("verification/bot-token", "bot-token");
  public static final RenderedArtifact PNG = new RenderedArtifact(new byte[] {(byte) 0x89, 'P', 'N', 'G'}, RenderedArtifact.PNG);

  public final AtomicInteger renderCalls = new AtomicInteger();
  public final AtomicInteger verifierCalls = new AtomicInteger();
  public final AtomicInteger secretFetches = new AtomicInteger();

  public final SecretStore secrets =
      secretId -> {
        secretFetches.incrementAndGet();
        return TOKEN;
      };

  public ArtifactRenderer renderer =
      request -> {
        renderCalls.incrementAndGet();
        return PNG;
      };

  public final WorkerConfig workerConfig = new WorkerConfig();
  public final EventsConfig eventsConfig = new EventsConfig();

  public VerificationWorker worker(
      VerificationQueue queue, ProofVerifier verifier, EventPublisher publisher, Clock clock) {
    ProofVerifier counting =
        (request, credential, artifact) -> {
          verifierCalls.incrementAndGet();
          return verifier.verify(request, credential, artifact);
        };
    return new VerificationWorker(
        secrets,
        renderer,
        counting,
        new OutcomeCommitter(queue, publisher),
        new VerificationLinkBuilder(new VerifierConfig()),
        workerConfig,
        new SecretsConfig(),
        eventsConfig,
        clock);
  }
}
