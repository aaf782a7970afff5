package com.acme.verify.core;

public class RenderException extends PipelineException {
    public RenderException(String message) {
        super(FailureReason.RENDER_ERROR, message);
    }

    public RenderException(String message, Throwable cause) {
        super(FailureReason.RENDER_ERROR, message, cause);
    }
}
