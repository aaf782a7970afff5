package com.acme.verify.worker.processing;

import com.acme.verify.config.WorkerConfig;
import com.acme.verify.core.ConcurrencyLimiter;
import com.acme.verify.domain.QueuedMessage;
import com.acme.verify.spi.VerificationQueue;
import io.micronaut.scheduling.annotation.Scheduled;
import jakarta.annotation.PreDestroy;
import jakarta.inject.Named;
import jakarta.inject.Singleton;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Feeds the worker pool from the ingress queue. Only as many messages are claimed as there are free
 * worker permits, so surplus requests stay AVAILABLE in the queue and their visibility window does
 * not start. Each invocation is cancelled once it runs past its deadline: the worker timeout, or the
 * end of the message's visibility window less a commit margin, whichever comes first.
 */
@Singleton
public class VerificationDispatcher {
  private static final Logger LOG = LoggerFactory.getLogger(VerificationDispatcher.class);

  static final Duration COMMIT_MARGIN = Duration.ofSeconds(5);

  private final VerificationQueue queue;
  private final VerificationWorker worker;
  private final ConcurrencyLimiter limiter;
  private final Duration timeout;
  private final Duration shutdownGrace;
  private final Clock clock;
  private final ExecutorService pool;
  private final ScheduledThreadPoolExecutor watchdog;
  private final AtomicBoolean running = new AtomicBoolean(true);

  public VerificationDispatcher(
      VerificationQueue queue,
      VerificationWorker worker,
      @Named("worker") ConcurrencyLimiter limiter,
      WorkerConfig config,
      Clock clock) {
    this.queue = queue;
    this.worker = worker;
    this.limiter = limiter;
    this.timeout = config.getTimeout();
    this.shutdownGrace = config.getShutdownGrace();
    this.clock = clock;
    this.pool = Executors.newFixedThreadPool(limiter.limit(), threads("verification-worker-"));
    this.watchdog = new ScheduledThreadPoolExecutor(1, threads("verification-watchdog-"));
    this.watchdog.setRemoveOnCancelPolicy(true);
  }

  @Scheduled(fixedDelay = "${worker.poll-interval:1s}")
  public void poll() {
    try {
      dispatchAvailable();
    } catch (Exception e) {
      LOG.error("Error in VerificationDispatcher poll: {}", e.getMessage(), e);
    }
  }

  /**
   * Claims messages for every free worker permit and hands them to the pool.
   *
   * @return number of messages dispatched
   */
  public int dispatchAvailable() {
    if (!running.get()) {
      return 0;
    }
    int reserved = 0;
    while (limiter.tryAcquire()) {
      reserved++;
    }
    if (reserved == 0) {
      return 0;
    }

    List<QueuedMessage> messages;
    try {
      messages = queue.receive(reserved);
    } catch (RuntimeException e) {
      releaseUnused(reserved);
      throw e;
    }
    releaseUnused(reserved - messages.size());

    for (QueuedMessage message : messages) {
      submit(message);
    }
    if (!messages.isEmpty()) {
      LOG.debug("Dispatched {} message(s), {} worker permit(s) in use", messages.size(), limiter.inFlight());
    }
    return messages.size();
  }

  private void submit(QueuedMessage message) {
    Instant deadline = deadline(message, clock.instant());
    // Whoever flips this releases the permit: the task once it starts, or the dispatcher if it never does.
    AtomicBoolean owned = new AtomicBoolean(false);
    AtomicReference<ScheduledFuture<?>> watch = new AtomicReference<>();
    AtomicBoolean finished = new AtomicBoolean(false);
    Future<?> future;
    try {
      future =
          pool.submit(
              () -> {
                if (!owned.compareAndSet(false, true)) {
                  return;
                }
                try {
                  worker.process(message, deadline);
                } catch (RuntimeException e) {
                  LOG.error("Unexpected failure processing messageId={}", message.messageId(), e);
                } finally {
                  limiter.release();
                  finished.set(true);
                  cancel(watch.get());
                }
              });
    } catch (RejectedExecutionException e) {
      limiter.release();
      LOG.error("Worker pool rejected messageId={}; it will be dead-lettered when its window ends", message.messageId());
      return;
    }
    long delayMillis = Math.max(0, Duration.between(clock.instant(), deadline).toMillis());
    watch.set(
        watchdog.schedule(
            () -> {
              if (!future.isDone()) {
                LOG.warn("messageId={} passed its deadline {}; abandoning attempt", message.messageId(), deadline);
                future.cancel(true);
                if (owned.compareAndSet(false, true)) {
                  limiter.release();
                }
              }
            },
            delayMillis,
            TimeUnit.MILLISECONDS));
    if (finished.get()) {
      cancel(watch.get());
    }
  }

  /** Earlier of the worker timeout and the end of the visibility window less {@link #COMMIT_MARGIN}. */
  Instant deadline(QueuedMessage message, Instant now) {
    Instant byTimeout = now.plus(timeout);
    if (message.visibleUntil() == null) {
      return byTimeout;
    }
    Instant byWindow = message.visibleUntil().minus(COMMIT_MARGIN);
    return byWindow.isBefore(byTimeout) ? byWindow : byTimeout;
  }

  private static void cancel(ScheduledFuture<?> watch) {
    if (watch != null) {
      watch.cancel(false);
    }
  }

  /** Watchdog tasks still waiting to fire. */
  int pendingWatchdogs() {
    return watchdog.getQueue().size();
  }

  private void releaseUnused(int count) {
    for (int i = 0; i < count; i++) {
      limiter.release();
    }
  }

  public int inFlight() {
    return limiter.inFlight();
  }

  @PreDestroy
  public void close() {
    running.set(false);
    pool.shutdown();
    try {
      if (!pool.awaitTermination(shutdownGrace.toMillis(), TimeUnit.MILLISECONDS)) {
        LOG.warn("Worker pool did not drain within {}; interrupting remaining attempts", shutdownGrace);
        pool.shutdownNow();
      }
    } catch (InterruptedException e) {
      pool.shutdownNow();
      Thread.currentThread().interrupt();
    } finally {
      watchdog.shutdownNow();
    }
  }

  private static ThreadFactory threads(String prefix) {
    AtomicInteger counter = new AtomicInteger();
    return r -> {
      Thread t = new Thread(r, prefix + counter.incrementAndGet());
      t.setDaemon(true);
      return t;
    };
  }
}
