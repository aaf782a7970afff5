package com.acme.verify.worker.queue;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.acme.verify.core.InvalidInputException;
import com.acme.verify.domain.QueueStatus;
import com.acme.verify.domain.QueuedMessage;
import com.acme.verify.domain.VerificationRequest;
import com.acme.verify.worker.support.H2PipelineTestBase;
import java.time.Duration;
import java.util.List;
import java.util.UUID;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class IngressQueueServiceTest extends H2PipelineTestBase {

  private static final VerificationRequest REQUEST = new VerificationRequest("user-1", "guild-join", null);

  @Test
  @DisplayName("enqueued messages stay available until received")
  void enqueueKeepsMessageAvailable() {
    UUID id = queue.enqueue(REQUEST);

    assertThat(id).isNotNull();
    assertThat(queueRepository.countByStatus(QueueStatus.AVAILABLE)).isEqualTo(1);
    assertThat(queueRepository.countByStatus(QueueStatus.IN_FLIGHT)).isZero();
  }

  @Test
  @DisplayName("a null request is rejected")
  void nullRequestRejected() {
    assertThatThrownBy(() -> queue.enqueue(null)).isInstanceOf(InvalidInputException.class);
  }

  @Test
  @DisplayName("receive starts the visibility window under a fresh receipt handle")
  void receiveStartsWindow() {
    UUID id = queue.enqueue(REQUEST);

    List<QueuedMessage> received = queue.receive(10);

    assertThat(received).hasSize(1);
    QueuedMessage message = received.get(0);
    assertThat(message.messageId()).isEqualTo(id);
    assertThat(message.receiveCount()).isEqualTo(1);
    assertThat(message.receiptHandle()).isNotBlank();
    assertThat(message.visibleUntil()).isEqualTo(T0.plus(Duration.ofMinutes(15)));
    assertThat(message.request()).isEqualTo(REQUEST);
  }

  @Test
  @DisplayName("receive claims at most the requested number of messages")
  void receiveHonoursMax() {
    for (int i = 0; i < 5; i++) {
      queue.enqueue(new VerificationRequest("user-" + i, "ctx", null));
    }

    assertThat(queue.receive(3)).hasSize(3);
    assertThat(queue.receive(0)).isEmpty();
    assertThat(queueRepository.countByStatus(QueueStatus.AVAILABLE)).isEqualTo(2);
  }

  @Test
  @DisplayName("a received message is never handed out again")
  void noSecondDelivery() {
    queue.enqueue(REQUEST);

    assertThat(queue.receive(10)).hasSize(1);
    clock.advance(Duration.ofHours(1));
    assertThat(queue.receive(10)).isEmpty();
  }

  @Test
  @DisplayName("ack deletes the in-flight message")
  void ackDeletes() {
    queue.enqueue(REQUEST);
    QueuedMessage message = queue.receive(1).get(0);

    assertThat(queue.ack(message)).isTrue();
    assertThat(queueRepository.findById(message.messageId())).isEmpty();
    assertThat(queue.ack(message)).isFalse();
  }

  @Test
  @DisplayName("ack with a stale receipt handle is rejected")
  void ackWithWrongHandle() {
    queue.enqueue(REQUEST);
    QueuedMessage message = queue.receive(1).get(0);
    QueuedMessage forged =
        new QueuedMessage(
            message.messageId(), "other-handle", message.request(), 1, message.enqueuedAt(), message.visibleUntil());

    assertThat(queue.ack(forged)).isFalse();
    assertThat(queueRepository.countByStatus(QueueStatus.IN_FLIGHT)).isEqualTo(1);
  }
}
