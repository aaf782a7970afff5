package com.acme.verify.core;

public class TransportException extends PipelineException {
    public TransportException(String message) {
        super(FailureReason.TRANSPORT_ERROR, message);
    }

    public TransportException(String message, Throwable cause) {
        super(FailureReason.TRANSPORT_ERROR, message, cause);
    }
}
