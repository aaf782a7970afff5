package com.acme.verify.core;

/** Base type of every failure raised inside the pipeline; carries its {@link FailureReason}. */
public class PipelineException extends RuntimeException {
    private final FailureReason reason;

    public PipelineException(FailureReason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public PipelineException(FailureReason reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
    }

    public FailureReason getReason() {
        return reason;
    }
}
