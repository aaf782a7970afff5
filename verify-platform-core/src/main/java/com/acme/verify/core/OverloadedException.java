package com.acme.verify.core;

public class OverloadedException extends PipelineException {
    public OverloadedException(String message) {
        super(FailureReason.OVERLOADED, message);
    }

    public OverloadedException(String message, Throwable cause) {
        super(FailureReason.OVERLOADED, message, cause);
    }
}
