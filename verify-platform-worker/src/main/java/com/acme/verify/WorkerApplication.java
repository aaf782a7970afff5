package com.acme.verify;

import io.micronaut.runtime.Micronaut;

/**
 * Worker Application - drains the verification queue. Dispatches requests to a bounded worker pool,
 * publishes success events, dead-letters unacknowledged messages and relays events to subscribers.
 */
public class WorkerApplication {
    public static void main(String[] args) {
        Micronaut.run(WorkerApplication.class, args);
    }
}
