package com.acme.verify.events;

import java.util.Objects;

/** Exact-match routing key of an event rule. */
public record EventPattern(String source, String detailType) {

    public EventPattern {
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(detailType, "detailType");
    }

    public boolean matches(String eventSource, String eventDetailType) {
        return source.equals(eventSource) && detailType.equals(eventDetailType);
    }
}
