package com.acme.verify.renderer.web;

import com.acme.verify.core.PipelineException;
import com.acme.verify.web.ErrorResponse;
import io.micronaut.http.HttpHeaders;
import io.micronaut.http.HttpRequest;
import io.micronaut.http.HttpResponse;
import io.micronaut.http.HttpStatus;
import io.micronaut.http.annotation.Produces;
import io.micronaut.http.server.exceptions.ExceptionHandler;
import jakarta.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Maps render failures to HTTP status codes:
 * invalid payload -> 400, concurrency ceiling reached -> 429 with Retry-After, otherwise 500.
 */
@Produces
@Singleton
public class RenderExceptionHandler
    implements ExceptionHandler<PipelineException, HttpResponse<ErrorResponse>> {

  private static final Logger LOG = LoggerFactory.getLogger(RenderExceptionHandler.class);

  @Override
  public HttpResponse<ErrorResponse> handle(HttpRequest request, PipelineException exception) {
    HttpStatus status = switch (exception.getReason()) {
      case INVALID_INPUT -> HttpStatus.BAD_REQUEST;
      case OVERLOADED -> HttpStatus.TOO_MANY_REQUESTS;
      default -> HttpStatus.INTERNAL_SERVER_ERROR;
    };
    if (status == HttpStatus.INTERNAL_SERVER_ERROR) {
      LOG.warn("Render failed: {}", exception.getMessage());
    }
    ErrorResponse body =
        new ErrorResponse(exception.getMessage(), exception.getReason().name(), status.getCode());
    if (status == HttpStatus.TOO_MANY_REQUESTS) {
      return HttpResponse.<ErrorResponse>status(status).header(HttpHeaders.RETRY_AFTER, "1").body(body);
    }
    return HttpResponse.<ErrorResponse>status(status).body(body);
  }
}
