package com.acme.verify.domain;

public record QueueStats(long available, long inFlight, long deadLettered) {}
