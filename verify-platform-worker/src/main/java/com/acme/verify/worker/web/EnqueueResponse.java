package com.acme.verify.worker.web;

import io.micronaut.core.annotation.Introspected;

@Introspected
public record EnqueueResponse(String messageId) {}
