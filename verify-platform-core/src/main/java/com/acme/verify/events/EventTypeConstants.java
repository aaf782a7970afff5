package com.acme.verify.events;

/** Source and detail-type strings of the events this pipeline emits. */
public final class EventTypeConstants {

    public static final String WORLD_ID_SOURCE = "world-id";
    public static final String VERIFICATION_SUCCEEDED = "verification.succeeded";

    private EventTypeConstants() {
        // Utility class - prevent instantiation
    }
}
