package com.acme.verify.renderer.web;

import com.acme.verify.config.RendererConfig;
import com.acme.verify.render.RenderRequest;
import com.acme.verify.render.RenderedArtifact;
import com.acme.verify.spi.ArtifactRenderer;
import io.micronaut.core.annotation.Nullable;
import io.micronaut.http.HttpHeaders;
import io.micronaut.http.HttpResponse;
import io.micronaut.http.MediaType;
import io.micronaut.http.annotation.Body;
import io.micronaut.http.annotation.Controller;
import io.micronaut.http.annotation.Get;
import io.micronaut.http.annotation.Post;
import io.micronaut.http.annotation.QueryValue;
import io.micronaut.scheduling.TaskExecutors;
import io.micronaut.scheduling.annotation.ExecuteOn;

/**
 * Public QR endpoint. Responses are cacheable since rendering is a pure function of the payload.
 */
@Controller("/qr")
@ExecuteOn(TaskExecutors.IO)
public class QrCodeController {

  private final ArtifactRenderer renderer;
  private final String cacheControl;

  public QrCodeController(ArtifactRenderer renderer, RendererConfig config) {
    this.renderer = renderer;
    this.cacheControl = "public, max-age=" + config.getCacheMaxAge().toSeconds();
  }

  @Get(produces = "image/png")
  public HttpResponse<byte[]> render(@QueryValue("data") @Nullable String data) {
    return toResponse(renderer.render(new RenderRequest(data)));
  }

  @Post(consumes = MediaType.APPLICATION_JSON, produces = "image/png")
  public HttpResponse<byte[]> renderBody(@Body QrRequest request) {
    return toResponse(renderer.render(new RenderRequest(request == null ? null : request.data())));
  }

  private HttpResponse<byte[]> toResponse(RenderedArtifact artifact) {
    return HttpResponse.ok(artifact.bytes())
        .contentType(artifact.contentType())
        .header(HttpHeaders.CACHE_CONTROL, cacheControl);
  }
}
