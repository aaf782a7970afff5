package com.acme.verify.worker.integration;

import com.acme.verify.config.GrantConfig;
import com.acme.verify.config.RendererConfig;
import com.acme.verify.config.VerifierConfig;
import io.micronaut.context.annotation.Bean;
import io.micronaut.context.annotation.Factory;
import jakarta.inject.Named;
import jakarta.inject.Singleton;
import java.time.Duration;
import okhttp3.OkHttpClient;

/**
 * OkHttp clients for the outbound dependencies. All share one connection pool and dispatcher;
 * each carries the call timeout of the dependency it talks to.
 */
@Factory
public class HttpClientFactory {

  @Singleton
  @Bean(preDestroy = "close")
  public SharedHttpClient sharedHttpClient() {
    return new SharedHttpClient(
        new OkHttpClient.Builder()
            .connectTimeout(Duration.ofSeconds(5))
            .retryOnConnectionFailure(false)
            .build());
  }

  @Singleton
  @Named("renderer")
  public OkHttpClient rendererHttpClient(SharedHttpClient shared, RendererConfig config) {
    return shared.withCallTimeout(config.getTimeout());
  }

  @Singleton
  @Named("verifier")
  public OkHttpClient verifierHttpClient(SharedHttpClient shared, VerifierConfig config) {
    return shared.withCallTimeout(config.getTimeout());
  }

  @Singleton
  @Named("grant")
  public OkHttpClient grantHttpClient(SharedHttpClient shared, GrantConfig config) {
    return shared.withCallTimeout(config.getTimeout());
  }

  /** Owner of the shared OkHttp resources; shuts them down with the context. */
  public static final class SharedHttpClient implements AutoCloseable {
    private final OkHttpClient client;

    SharedHttpClient(OkHttpClient client) {
      this.client = client;
    }

    OkHttpClient withCallTimeout(Duration callTimeout) {
      // read timeout follows the call timeout: the verifier may hold a response for minutes
      return client.newBuilder().callTimeout(callTimeout).readTimeout(callTimeout).build();
    }

    @Override
    public void close() {
      client.dispatcher().executorService().shutdown();
      client.connectionPool().evictAll();
    }
  }
}
