package com.acme.verify.events;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Routing table of the event channel: maps {@code (source, detail-type)} to the subscribers that
 * asked for it. Pure POJO - no framework dependencies.
 */
public class EventRouter {
    private static final Logger log = LoggerFactory.getLogger(EventRouter.class);

    private final Map<String, EventSubscriber> subscribers = new LinkedHashMap<>();

    public EventRouter() {
    }

    public EventRouter(Collection<? extends EventSubscriber> initial) {
        initial.forEach(this::register);
    }

    /**
     * @throws IllegalStateException if a subscriber with the same name is already registered
     */
    public synchronized void register(EventSubscriber subscriber) {
        String name = subscriber.name();
        if (subscribers.containsKey(name)) {
            String error = "Subscriber already registered: " + name;
            log.error(error);
            throw new IllegalStateException(error);
        }
        log.info("Registering subscriber {} for {}", name, subscriber.pattern());
        subscribers.put(name, subscriber);
    }

    /** Rules whose pattern matches exactly, in registration order. */
    public synchronized List<EventRule> route(String source, String detailType) {
        List<EventRule> matched = new ArrayList<>();
        for (EventSubscriber s : subscribers.values()) {
            if (s.pattern().matches(source, detailType)) {
                matched.add(new EventRule(s.name(), s.pattern()));
            }
        }
        return matched;
    }

    public synchronized Optional<EventSubscriber> subscriber(String name) {
        return Optional.ofNullable(subscribers.get(name));
    }

    public synchronized List<EventRule> rules() {
        return subscribers.values().stream()
                .map(s -> new EventRule(s.name(), s.pattern()))
                .toList();
    }
}
