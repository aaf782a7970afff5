package com.acme.verify.config;

/** Cross-checks between configuration sections that no single section can enforce alone. */
public final class ConfigValidation {

  private ConfigValidation() {
    // Utility class - no instantiation
  }

  /**
   * @throws IllegalStateException if the settings would let a slow but succeeding attempt lose its
   *     message to the dead-letter queue, or if the dead-letter retention is too short
   */
  public static void validate(QueueConfig queue, WorkerConfig worker, VerifierConfig verifier) {
    if (worker.getConcurrency() < 1) {
      throw new IllegalStateException("worker.concurrency must be at least 1");
    }
    if (queue.getVisibilityWindow().compareTo(worker.getTimeout()) < 0) {
      throw new IllegalStateException(
          "queue.visibility-window ("
              + queue.getVisibilityWindow()
              + ") must not be shorter than worker.timeout ("
              + worker.getTimeout()
              + ")");
    }
    if (verifier.getTimeout().compareTo(worker.getTimeout()) > 0) {
      throw new IllegalStateException(
          "verifier.timeout (" + verifier.getTimeout() + ") exceeds worker.timeout (" + worker.getTimeout() + ")");
    }
    if (queue.getDlqRetention().compareTo(QueueConfig.MIN_DLQ_RETENTION) < 0) {
      throw new IllegalStateException(
          "queue.dlq-retention must be at least " + QueueConfig.MIN_DLQ_RETENTION.toDays() + " days");
    }
  }
}
