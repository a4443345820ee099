package com.github.fsmhub;

import java.util.Optional;

/**
 * Immutable ledger entry for one processed event: which event, in which state, how long it took and
 * whether it went through.
 */
public final class EventRecord<S extends Enum<S>, E extends Enum<E>> {
  private final E event;
  private final S state;
  private final long timestamp;
  private final long durationMillis;
  private final boolean success;
  private final String error;

  public EventRecord(final E event, final S state, final long timestamp, final long durationMillis,
      final boolean success, final String error) {
    this.event = event;
    this.state = state;
    this.timestamp = timestamp;
    this.durationMillis = durationMillis;
    this.success = success;
    this.error = error;
  }

  public E getEvent() {
    return event;
  }

  public S getState() {
    return state;
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

  @Override
  public String toString() {
    return "EventRecord [event=" + event + ", state=" + state + ", timestamp=" + timestamp
        + ", durationMillis=" + durationMillis + ", success=" + success + ", error=" + error + "]";
  }
}
