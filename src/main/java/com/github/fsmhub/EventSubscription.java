package com.github.fsmhub;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Optional;
import java.util.Set;
import java.util.function.Predicate;

/**
 * Registered listener for one or more event types, with an optional payload filter and an optional
 * fire-once flag.
 */
public final class EventSubscription<E extends Enum<E>> {
  private final String id;
  private final Set<E> events;
  private final EventListener<E> listener;
  private final Predicate<Object> filter;
  private final boolean once;

  EventSubscription(final String id, final Set<E> events, final EventListener<E> listener,
      final Predicate<Object> filter, final boolean once) {
    this.id = id;
    this.events = Collections.unmodifiableSet(EnumSet.copyOf(events));
    this.listener = listener;
    this.filter = filter;
    this.once = once;
  }

  public String getId() {
    return id;
  }

  public Set<E> getEvents() {
    return events;
  }

  public boolean isOnce() {
    return once;
  }

  boolean matches(final QueuedEvent<E> event) {
    if (!events.contains(event.getType())) {
      return false;
    }
    return filter == null || filter.test(event.getPayload());
  }

  void deliver(final QueuedEvent<E> event, final Optional<String> failure) throws Exception {
    listener.onEvent(event, failure);
  }

  @Override
  public String toString() {
    return "EventSubscription [id=" + id + ", events=" + events + ", filtered=" + (filter != null)
        + ", once=" + once + "]";
  }
}
