package com.acme.verify.core;

public class InvalidInputException extends PipelineException {
    public InvalidInputException(String message) {
        super(FailureReason.INVALID_INPUT, message);
    }

    public InvalidInputException(String message, Throwable cause) {
        super(FailureReason.INVALID_INPUT, message, cause);
    }
}
