package com.acme.verify.events;

/**
 * A consumer attached to the event channel. Subscribers declare the events they want through
 * {@link #pattern()} and receive only the event detail, never the envelope.
 *
 * <p>Delivery is at-least-once; implementations must tolerate seeing the same detail twice. Throwing
 * from {@link #deliver(String)} fails this delivery only, other subscribers are unaffected.
 */
public interface EventSubscriber {

    /** Unique subscription name; also the key of its delivery records. */
    String name();

    EventPattern pattern();

    /**
     * @param detailJson the event's detail payload as JSON
     */
    void deliver(String detailJson);
}
