package com.acme.verify.worker.web;

import com.acme.verify.worker.processing.VerificationDispatcher;
import io.micronaut.http.HttpResponse;
import io.micronaut.http.annotation.Controller;
import io.micronaut.http.annotation.Get;
import java.util.Map;

@Controller
public class HealthController {

  private final VerificationDispatcher dispatcher;

  public HealthController(VerificationDispatcher dispatcher) {
    this.dispatcher = dispatcher;
  }

  @Get("/health")
  public HttpResponse<Map<String, Object>> health() {
    return HttpResponse.ok(Map.of("status", "UP", "workersBusy", dispatcher.inFlight()));
  }
}
