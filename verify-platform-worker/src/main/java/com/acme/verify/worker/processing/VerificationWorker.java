package com.acme.verify.worker.processing;

import com.acme.verify.config.EventsConfig;
import com.acme.verify.config.SecretsConfig;
import com.acme.verify.config.WorkerConfig;
import com.acme.verify.core.FailureReason;
import com.acme.verify.core.PipelineException;
import com.acme.verify.core.PublishException;
import com.acme.verify.domain.QueuedMessage;
import com.acme.verify.domain.VerificationOutcome;
import com.acme.verify.domain.VerificationRequest;
import com.acme.verify.events.VerifiedEvent;
import com.acme.verify.render.RenderedArtifact;
import com.acme.verify.secret.Credential;
import com.acme.verify.secret.InvocationCredential;
import com.acme.verify.spi.ArtifactRenderer;
import com.acme.verify.spi.ProofVerifier;
import com.acme.verify.spi.SecretStore;
import com.acme.verify.worker.integration.VerificationLinkBuilder;
import jakarta.inject.Singleton;
import java.time.Clock;
import java.time.Instant;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * Processes one queued verification request per invocation: validate, read the credential, render
 * the artifact, verify, then acknowledge and publish together. Steps run strictly in order and none
 * is retried; a failed invocation leaves its message unacknowledged so it ages into the dead-letter
 * queue.
 */
@Singleton
public class VerificationWorker {
  private static final Logger LOG = LoggerFactory.getLogger(VerificationWorker.class);

  static final String MDC_MESSAGE_ID = "messageId";

  private final SecretStore secrets;
  private final ArtifactRenderer renderer;
  private final ProofVerifier verifier;
  private final OutcomeCommitter committer;
  private final VerificationLinkBuilder links;
  private final WorkerConfig workerConfig;
  private final SecretsConfig secretsConfig;
  private final String eventSource;
  private final Clock clock;

  public VerificationWorker(
      SecretStore secrets,
      ArtifactRenderer renderer,
      ProofVerifier verifier,
      OutcomeCommitter committer,
      VerificationLinkBuilder links,
      WorkerConfig workerConfig,
      SecretsConfig secretsConfig,
      EventsConfig eventsConfig,
      Clock clock) {
    this.secrets = secrets;
    this.renderer = renderer;
    this.verifier = verifier;
    this.committer = committer;
    this.links = links;
    this.workerConfig = workerConfig;
    this.secretsConfig = secretsConfig;
    this.eventSource = eventsConfig.getSource();
    this.clock = clock;
  }

  /**
   * @param deadline instant after which the attempt is abandoned without publishing; no later than
   *     the end of the message's visibility window
   * @return the outcome; succeeded only if the event was published and the message acknowledged
   */
  public VerificationOutcome process(QueuedMessage message, Instant deadline) {
    MDC.put(MDC_MESSAGE_ID, message.messageId().toString());
    try {
      VerificationOutcome outcome = verify(message.request());
      if (outcome.isSuccess()) {
        outcome = publishAndAck(message, outcome, deadline);
      }
      if (outcome.isFailure()) {
        LOG.warn("Verification failed ({}): {}; message left unacknowledged", outcome.reason(), outcome.message());
      }
      return outcome;
    } finally {
      MDC.remove(MDC_MESSAGE_ID);
    }
  }

  VerificationOutcome verify(VerificationRequest request) {
    Optional<String> problem = request == null ? Optional.of("request is missing") : request.validationProblem();
    if (problem.isPresent()) {
      return VerificationOutcome.failed(FailureReason.INVALID_INPUT, problem.get());
    }

    Credential credential;
    try {
      credential = new InvocationCredential(secrets, secretsConfig.getTokenSecretId()).get();
    } catch (PipelineException e) {
      return VerificationOutcome.failed(FailureReason.TRANSPORT_ERROR, e.getMessage());
    }

    Optional<RenderedArtifact> artifact = Optional.empty();
    if (workerConfig.isRenderArtifact()) {
      try {
        artifact = Optional.of(renderer.render(links.renderRequest(request)));
      } catch (RuntimeException e) {
        return VerificationOutcome.failed(FailureReason.RENDER_ERROR, e.getMessage());
      }
    }
    if (Thread.currentThread().isInterrupted()) {
      return VerificationOutcome.failed(FailureReason.DEADLINE_EXCEEDED, "abandoned before verification");
    }

    try {
      VerificationOutcome outcome = verifier.verify(request, credential, artifact);
      if (outcome == null) {
        return VerificationOutcome.failed(FailureReason.VERIFIER_ERROR, "proof system returned no outcome");
      }
      return outcome;
    } catch (RuntimeException e) {
      return VerificationOutcome.failed(FailureReason.VERIFIER_ERROR, e.getMessage());
    }
  }

  private VerificationOutcome publishAndAck(QueuedMessage message, VerificationOutcome outcome, Instant deadline) {
    if (Thread.currentThread().isInterrupted() || clock.instant().isAfter(deadline)) {
      return VerificationOutcome.failed(FailureReason.DEADLINE_EXCEEDED, "deadline " + deadline + " passed before publishing");
    }
    VerificationRequest request = message.request();
    VerifiedEvent event = VerifiedEvent.of(eventSource, request.subject(), request.context(), clock.instant());
    boolean committed;
    try {
      committed = committer.ackAndPublish(message, event);
    } catch (PublishException e) {
      return VerificationOutcome.failed(FailureReason.PUBLISH_ERROR, e.getMessage());
    } catch (RuntimeException e) {
      return VerificationOutcome.failed(FailureReason.TRANSPORT_ERROR, "acknowledgment failed: " + e.getMessage());
    }
    if (!committed) {
      return VerificationOutcome.failed(
          FailureReason.DEADLINE_EXCEEDED, "visibility window ended before acknowledgment; nothing published");
    }
    LOG.info("Verified subject={} context={}", request.subject(), request.context());
    return outcome;
  }
}
