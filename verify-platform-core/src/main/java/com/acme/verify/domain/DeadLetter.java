package com.acme.verify.domain;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.Instant;
import java.util.UUID;

/**
 * A verification request whose single delivery attempt was not acknowledged in time. Kept for
 * manual inspection and replay; nothing processes it automatically.
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
public class DeadLetter {

    private UUID messageId;
    private String subject;
    private String context;
    private String signal;
    private int receiveCount;
    private Instant enqueuedAt;
    private Instant deadLetteredAt;
    private String reason;

    public VerificationRequest toRequest() {
        return new VerificationRequest(subject, context, signal);
    }
}
