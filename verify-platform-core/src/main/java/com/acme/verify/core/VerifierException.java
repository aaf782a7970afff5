package com.acme.verify.core;

public class VerifierException extends PipelineException {
    public VerifierException(String message) {
        super(FailureReason.VERIFIER_ERROR, message);
    }

    public VerifierException(String message, Throwable cause) {
        super(FailureReason.VERIFIER_ERROR, message, cause);
    }
}
