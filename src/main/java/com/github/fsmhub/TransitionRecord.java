package com.github.fsmhub;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable ledger entry describing one attempted transition of one machine instance.
 */
public final class TransitionRecord<S extends Enum<S>, E extends Enum<E>> {
  private final S from;
  private final S to;
  private final E event;
  private final long timestamp;
  private final long durationMillis;
  private final boolean success;
  private final String error;
  private final Map<String, Object> contextSnapshot;

  public TransitionRecord(final S from, final S to, final E event, final long timestamp,
      final long durationMillis, final boolean success, final String error,
      final Map<String, Object> contextSnapshot) {
    this.from = from;
    this.to = to;
    this.event = event;
    this.timestamp = timestamp;
    this.durationMillis = durationMillis;
    this.success = success;
    this.error = error;
    this.contextSnapshot = contextSnapshot == null ? null
        : Collections.unmodifiableMap(new LinkedHashMap<>(contextSnapshot));
  }

  public S getFrom() {
    return from;
  }

  public S getTo() {
    return to;
  }

  public E getEvent() {
    return event;
  }

  public long getTimestamp() {
    return timestamp;
  }

  public long getDurationMillis() {
    return durationMillis;
  }

  public boolean isSuccess() {
    return success;
  }

  public Optional<String> getError() {
    return Optional.ofNullable(error);
  }

  public Optional<Map<String, Object>> getContextSnapshot() {
    return Optional.ofNullable(contextSnapshot);
  }

  /**
   * Same record minus the context snapshot, used by history queries that don't ask for context.
   */
  public TransitionRecord<S, E> withoutContext() {
    if (contextSnapshot == null) {
      return this;
    }
    return new TransitionRecord<>(from, to, event, timestamp, durationMillis, success, error, null);
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (!(obj instanceof TransitionRecord)) {
      return false;
    }
    final TransitionRecord<?, ?> other = (TransitionRecord<?, ?>) obj;
    return timestamp == other.timestamp && durationMillis == other.durationMillis
        && success == other.success && Objects.equals(from, other.from)
        && Objects.equals(to, other.to) && Objects.equals(event, other.event)
        && Objects.equals(error, other.error)
        && Objects.equals(contextSnapshot, other.contextSnapshot);
  }

  @Override
  public int hashCode() {
    return Objects.hash(from, to, event, timestamp, durationMillis, success, error);
  }

  @Override
  public String toString() {
    return "TransitionRecord [from=" + from + ", to=" + to + ", event=" + event + ", timestamp="
        + timestamp + ", durationMillis=" + durationMillis + ", success=" + success + ", error="
        + error + "]";
  }
}
