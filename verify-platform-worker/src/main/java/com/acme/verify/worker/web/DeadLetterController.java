package com.acme.verify.worker.web;

import com.acme.verify.domain.DeadLetter;
import com.acme.verify.domain.QueueStats;
import com.acme.verify.worker.queue.DeadLetterService;
import io.micronaut.http.HttpResponse;
import io.micronaut.http.annotation.Controller;
import io.micronaut.http.annotation.Get;
import io.micronaut.http.annotation.PathVariable;
import io.micronaut.http.annotation.Post;
import io.micronaut.http.annotation.QueryValue;
import io.micronaut.scheduling.TaskExecutors;
import io.micronaut.scheduling.annotation.ExecuteOn;
import java.util.List;
import java.util.UUID;

/** Operator view of the queue: dead-letter inspection, manual replay and depth counters. */
@Controller
@ExecuteOn(TaskExecutors.IO)
public class DeadLetterController {

  static final int MAX_LIMIT = 500;

  private final DeadLetterService deadLetters;

  public DeadLetterController(DeadLetterService deadLetters) {
    this.deadLetters = deadLetters;
  }

  @Get("/dead-letters")
  public List<DeadLetter> list(@QueryValue(defaultValue = "50") int limit) {
    return deadLetters.list(Math.max(1, Math.min(limit, MAX_LIMIT)));
  }

  @Get("/dead-letters/{id}")
  public HttpResponse<DeadLetter> find(@PathVariable UUID id) {
    return deadLetters.find(id)
        .map(HttpResponse::ok)
        .orElseGet(HttpResponse::notFound);
  }

  @Post("/dead-letters/{id}/replay")
  public HttpResponse<EnqueueResponse> replay(@PathVariable UUID id) {
    return deadLetters.replay(id)
        .map(messageId -> HttpResponse.accepted().body(new EnqueueResponse(messageId.toString())))
        .orElseGet(HttpResponse::notFound);
  }

  @Get("/queue/stats")
  public QueueStats stats() {
    return deadLetters.stats();
  }
}
