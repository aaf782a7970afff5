package com.acme.verify.worker.web;

import com.acme.verify.core.InvalidInputException;
import com.acme.verify.domain.VerificationRequest;
import com.acme.verify.spi.VerificationQueue;
import io.micronaut.core.annotation.Nullable;
import io.micronaut.http.HttpResponse;
import io.micronaut.http.annotation.Body;
import io.micronaut.http.annotation.Controller;
import io.micronaut.http.annotation.Post;
import io.micronaut.scheduling.TaskExecutors;
import io.micronaut.scheduling.annotation.ExecuteOn;
import java.util.UUID;

/**
 * Entry point of the pipeline. Requests are queued as received; their content is validated by the
 * worker, so a malformed request still gets a message id and ends up in the dead-letter queue.
 */
@Controller("/verifications")
@ExecuteOn(TaskExecutors.IO)
public class VerificationController {

  private final VerificationQueue queue;

  public VerificationController(VerificationQueue queue) {
    this.queue = queue;
  }

  @Post
  public HttpResponse<EnqueueResponse> enqueue(@Body @Nullable VerificationRequest request) {
    if (request == null) {
      throw new InvalidInputException("request body is required");
    }
    UUID messageId = queue.enqueue(request);
    return HttpResponse.accepted().body(new EnqueueResponse(messageId.toString()));
  }
}
