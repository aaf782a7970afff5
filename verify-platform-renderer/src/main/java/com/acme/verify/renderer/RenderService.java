package com.acme.verify.renderer;

import com.acme.verify.config.RendererConfig;
import com.acme.verify.core.ConcurrencyLimiter;
import com.acme.verify.core.InvalidInputException;
import com.acme.verify.core.OverloadedException;
import com.acme.verify.core.PipelineException;
import com.acme.verify.core.RenderException;
import com.acme.verify.render.RenderRequest;
import com.acme.verify.render.RenderedArtifact;
import com.acme.verify.spi.ArtifactRenderer;
import jakarta.annotation.PreDestroy;
import jakarta.inject.Named;
import jakarta.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Renders QR artifacts under a concurrency ceiling and a hard per-render deadline.
 *
 * <p>A permit is held for as long as an encode actually runs, including one the caller stopped
 * waiting for, so the number of simultaneous encodes never exceeds the ceiling.
 */
@Singleton
public class RenderService implements ArtifactRenderer {

    private static final Logger LOG = LoggerFactory.getLogger(RenderService.class);

    private final QrCodeEncoder encoder;
    private final ConcurrencyLimiter limiter;
    private final Duration timeout;
    private final Duration admissionWait;
    private final ExecutorService executor;

    public RenderService(
            QrCodeEncoder encoder, @Named("render") ConcurrencyLimiter limiter, RendererConfig config) {
        this.encoder = encoder;
        this.limiter = limiter;
        this.timeout = config.getTimeout();
        this.admissionWait = config.getAdmissionWait();
        AtomicInteger threadIds = new AtomicInteger();
        this.executor = Executors.newFixedThreadPool(limiter.limit(), r -> {
            Thread t = new Thread(r, "qr-render-" + threadIds.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    @Override
    public RenderedArtifact render(RenderRequest request) {
        String payload = validate(request);
        limiter.acquire(admissionWait);

        AtomicBoolean owned = new AtomicBoolean();
        Future<byte[]> future;
        try {
            future = executor.submit(() -> {
                if (!owned.compareAndSet(false, true)) {
                    return null; // caller gave up before this encode started
                }
                try {
                    return encoder.encode(payload);
                } finally {
                    limiter.release();
                }
            });
        } catch (RejectedExecutionException e) {
            limiter.release();
            throw new OverloadedException("renderer is shutting down", e);
        }

        try {
            byte[] png = future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            LOG.debug("Rendered QR: payloadLength={}, bytes={}", payload.length(), png.length);
            return new RenderedArtifact(png, RenderedArtifact.PNG);
        } catch (TimeoutException e) {
            abandon(future, owned);
            throw new RenderException("render exceeded " + timeout.toMillis() + "ms deadline", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            abandon(future, owned);
            throw new RenderException("render interrupted", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof PipelineException) {
                throw (PipelineException) cause;
            }
            throw new RenderException("render failed: " + cause, cause);
        }
    }

    private void abandon(Future<byte[]> future, AtomicBoolean owned) {
        future.cancel(true);
        if (owned.compareAndSet(false, true)) {
            limiter.release();
        }
    }

    private static String validate(RenderRequest request) {
        if (request == null || request.payload() == null || request.payload().isBlank()) {
            throw new InvalidInputException("payload must not be blank");
        }
        if (request.payload().length() > RenderRequest.MAX_PAYLOAD_LENGTH) {
            throw new InvalidInputException(
                    "payload exceeds " + RenderRequest.MAX_PAYLOAD_LENGTH + " characters");
        }
        return request.payload();
    }

    public ConcurrencyLimiter limiter() {
        return limiter;
    }

    @PreDestroy
    public void close() {
        executor.shutdownNow();
    }
}
