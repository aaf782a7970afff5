package com.acme.verify.renderer.config;

import com.acme.verify.config.RendererConfig;
import com.acme.verify.core.ConcurrencyLimiter;
import com.acme.verify.renderer.QrCodeEncoder;
import io.micronaut.context.annotation.ConfigurationProperties;
import io.micronaut.context.annotation.Factory;
import jakarta.inject.Named;
import jakarta.inject.Singleton;

/**
 * Wires the framework-free renderer pieces from core into the Micronaut context.
 */
@Factory
public class RendererBeansFactory {

  /** Creates RendererConfig bean populated from application.yml renderer.* properties */
  @Singleton
  @ConfigurationProperties("renderer")
  public RendererConfig rendererConfig() {
    return new RendererConfig();
  }

  /** Ceiling on simultaneous renders across this instance */
  @Singleton
  @Named("render")
  public ConcurrencyLimiter renderLimiter(RendererConfig config) {
    return new ConcurrencyLimiter("renderer", config.getConcurrency());
  }

  @Singleton
  public QrCodeEncoder qrCodeEncoder(RendererConfig config) {
    return new QrCodeEncoder(config.getImageSize());
  }
}
