package com.acme.verify.worker.events;

import com.acme.verify.core.InvalidInputException;
import com.acme.verify.core.TransportException;
import com.acme.verify.events.EventPattern;
import com.acme.verify.events.EventSubscriber;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

/** Subscriber double that records every detail it is handed and can be told to fail. */
class RecordingSubscriber implements EventSubscriber {
  private final String name;
  private final EventPattern pattern;
  final List<String> received = new CopyOnWriteArrayList<>();
  final AtomicInteger failuresLeft = new AtomicInteger();
  volatile boolean rejectAsInvalid;

  RecordingSubscriber(String name, EventPattern pattern) {
    this.name = name;
    this.pattern = pattern;
  }

  @Override
  public String name() {
    return name;
  }

  @Override
  public EventPattern pattern() {
    return pattern;
  }

  @Override
  public void deliver(String detailJson) {
    if (rejectAsInvalid) {
      throw new InvalidInputException(name + " cannot use this detail");
    }
    if (failuresLeft.getAndUpdate(n -> Math.max(0, n - 1)) > 0) {
      throw new TransportException(name + " unavailable");
    }
    received.add(detailJson);
  }
}
