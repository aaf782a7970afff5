package com.acme.verify.worker.config;

import com.acme.verify.config.ConfigValidation;
import com.acme.verify.config.QueueConfig;
import com.acme.verify.config.VerifierConfig;
import com.acme.verify.config.WorkerConfig;
import io.micronaut.context.annotation.Context;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Fails context startup when queue, worker and verifier settings contradict each other. */
@Context
public class StartupConfigurationCheck {

  private static final Logger LOG = LoggerFactory.getLogger(StartupConfigurationCheck.class);

  public StartupConfigurationCheck(
      QueueConfig queueConfig, WorkerConfig workerConfig, VerifierConfig verifierConfig) {
    try {
      ConfigValidation.validate(queueConfig, workerConfig, verifierConfig);
    } catch (IllegalStateException e) {
      LOG.error("Refusing to start: {}", e.getMessage());
      throw e;
    }
    LOG.debug(
        "Configuration accepted: window={}, workerTimeout={}, concurrency={}",
        queueConfig.getVisibilityWindow(),
        workerConfig.getTimeout(),
        workerConfig.getConcurrency());
  }
}
