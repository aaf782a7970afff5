package com.acme.verify.worker.integration;

import com.acme.verify.config.RendererConfig;
import com.acme.verify.core.OverloadedException;
import com.acme.verify.core.RenderException;
import com.acme.verify.render.RenderRequest;
import com.acme.verify.render.RenderedArtifact;
import com.acme.verify.spi.ArtifactRenderer;
import jakarta.inject.Named;
import jakarta.inject.Singleton;
import java.io.IOException;
import java.io.InterruptedIOException;
import okhttp3.HttpUrl;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Client of the renderer service's {@code GET /qr} endpoint. */
@Singleton
public class HttpArtifactRenderer implements ArtifactRenderer {
  private static final Logger LOG = LoggerFactory.getLogger(HttpArtifactRenderer.class);

  private final OkHttpClient client;
  private final RendererConfig config;

  public HttpArtifactRenderer(@Named("renderer") OkHttpClient client, RendererConfig config) {
    this.client = client;
    this.config = config;
  }

  @Override
  public RenderedArtifact render(RenderRequest request) {
    HttpUrl base = HttpUrl.parse(config.getUrl());
    if (base == null) {
      throw new RenderException("renderer.url is not a valid URL: " + config.getUrl());
    }
    HttpUrl url =
        base.newBuilder().addPathSegment("qr").addQueryParameter("data", request.payload()).build();
    Request httpRequest = new Request.Builder().url(url).get().addHeader("Accept", RenderedArtifact.PNG).build();

    try (Response response = client.newCall(httpRequest).execute()) {
      int code = response.code();
      if (code == 429 || code == 503) {
        throw new OverloadedException("renderer at capacity (HTTP " + code + ")");
      }
      if (!response.isSuccessful()) {
        throw new RenderException("renderer returned HTTP " + code);
      }
      ResponseBody body = response.body();
      byte[] bytes = body == null ? new byte[0] : body.bytes();
      if (bytes.length == 0) {
        throw new RenderException("renderer returned an empty image");
      }
      String contentType = response.header("Content-Type", RenderedArtifact.PNG);
      LOG.debug("Rendered artifact of {} bytes", bytes.length);
      return new RenderedArtifact(bytes, contentType);
    } catch (InterruptedIOException e) {
      throw new RenderException("render call exceeded " + config.getTimeout(), e);
    } catch (IOException e) {
      throw new RenderException("renderer unreachable: " + e.getMessage(), e);
    }
  }
}
