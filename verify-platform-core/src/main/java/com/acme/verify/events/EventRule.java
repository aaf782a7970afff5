package com.acme.verify.events;

/** Forwards the detail of events matching {@code pattern} to the subscriber named {@code target}. */
public record EventRule(String target, EventPattern pattern) {}
