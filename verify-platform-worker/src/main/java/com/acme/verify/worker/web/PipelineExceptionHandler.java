package com.acme.verify.worker.web;

import com.acme.verify.core.PipelineException;
import com.acme.verify.web.ErrorResponse;
import io.micronaut.http.HttpRequest;
import io.micronaut.http.HttpResponse;
import io.micronaut.http.HttpStatus;
import io.micronaut.http.annotation.Produces;
import io.micronaut.http.server.exceptions.ExceptionHandler;
import jakarta.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Global exception handler for pipeline failures raised while serving a request.
 *
 * <p>Invalid input -> 400, overloaded -> 429, queue or store unreachable -> 503, anything else -> 500.
 */
@Produces
@Singleton
public class PipelineExceptionHandler
    implements ExceptionHandler<PipelineException, HttpResponse<ErrorResponse>> {

  private static final Logger LOG = LoggerFactory.getLogger(PipelineExceptionHandler.class);

  @Override
  public HttpResponse<ErrorResponse> handle(HttpRequest request, PipelineException exception) {
    HttpStatus status = switch (exception.getReason()) {
      case INVALID_INPUT -> HttpStatus.BAD_REQUEST;
      case OVERLOADED -> HttpStatus.TOO_MANY_REQUESTS;
      case TRANSPORT_ERROR -> HttpStatus.SERVICE_UNAVAILABLE;
      default -> HttpStatus.INTERNAL_SERVER_ERROR;
    };
    if (status.getCode() >= 500) {
      LOG.warn("{} {} failed with {}: {}", request.getMethodName(), request.getPath(), exception.getReason(), exception.getMessage());
    }
    return HttpResponse.<ErrorResponse>status(status)
        .body(new ErrorResponse(exception.getMessage(), exception.getReason().name(), status.getCode()));
  }
}
