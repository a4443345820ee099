package com.github.fsmhub;

import java.util.Optional;

/**
 * Entry of the dispatch history, written for every dispatch attempt whether it succeeded or not.
 */
public final class DispatchRecord<E extends Enum<E>> {
  private final E eventType;
  private final int priority;
  private final long enqueuedAt;
  private final long processedAt;
  private final long durationMillis;
  private final boolean immediate;
  private final boolean success;
  private final int listenersNotified;
  private final String error;

  DispatchRecord(final QueuedEvent<E> event, final long processedAt, final long durationMillis,
      final boolean immediate, final boolean success, final int listenersNotified,
      final String error) {
    this.eventType = event.getType();
    this.priority = event.getPriority();
    this.enqueuedAt = event.getEnqueuedAt();
    this.processedAt = processedAt;
    this.durationMillis = durationMillis;
    this.immediate = immediate;
    this.success = success;
    this.listenersNotified = listenersNotified;
    this.error = error;
  }

  public E getEventType() {
    return eventType;
  }

  public int getPriority() {
    return priority;
  }

  public long getEnqueuedAt() {
    return enqueuedAt;
  }

  public long getProcessedAt() {
    return processedAt;
  }

  public long getWaitMillis() {
    return Math.max(0L, processedAt - enqueuedAt);
  }

  public long getDurationMillis() {
    return durationMillis;
  }

  public boolean isImmediate() {
    return immediate;
  }

  public boolean isSuccess() {
    return success;
  }

  public int getListenersNotified() {
    return listenersNotified;
  }

  public Optional<String> getError() {
    return Optional.ofNullable(error);
  }

  @Override
  public String toString() {
    return "DispatchRecord [eventType=" + eventType + ", priority=" + priority + ", immediate="
        + immediate + ", success=" + success + ", waitMillis=" + getWaitMillis()
        + ", durationMillis=" + durationMillis + ", listenersNotified=" + listenersNotified
        + ", error=" + error + "]";
  }
}
