package com.acme.verify.domain;

import com.acme.verify.core.FailureReason;

/** Result of one verification attempt. Only a succeeded outcome leads to an event. */
public record VerificationOutcome(
        Status status,
        String subject,
        String context,
        FailureReason reason,
        String message) {

    public enum Status {
        SUCCEEDED,
        FAILED
    }

    public static VerificationOutcome succeeded(String subject, String context) {
        return new VerificationOutcome(Status.SUCCEEDED, subject, context, null, null);
    }

    public static VerificationOutcome failed(FailureReason reason, String message) {
        if (reason == null) {
            throw new IllegalArgumentException("a failed outcome needs a reason");
        }
        return new VerificationOutcome(Status.FAILED, null, null, reason, message);
    }

    public boolean isSuccess() {
        return status == Status.SUCCEEDED;
    }

    public boolean isFailure() {
        return status == Status.FAILED;
    }
}
