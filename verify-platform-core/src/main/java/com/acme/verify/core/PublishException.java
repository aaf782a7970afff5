package com.acme.verify.core;

public class PublishException extends PipelineException {
    public PublishException(String message) {
        super(FailureReason.PUBLISH_ERROR, message);
    }

    public PublishException(String message, Throwable cause) {
        super(FailureReason.PUBLISH_ERROR, message, cause);
    }
}
