package com.github.fsmhub;

import java.util.Comparator;
import java.util.Optional;

/**
 * Event waiting in (or taken from) a dispatcher queue. Lower priority values are served first;
 * ties go to the lower sequence number, i.e. the earlier enqueue.
 */
public final class QueuedEvent<E extends Enum<E>> {
  static final long UNTAGGED = -1L;

  private final E type;
  private final Object payload;
  private final int priority;
  private final long enqueuedAt;
  private final long sequence;
  private final long entrySequence;

  QueuedEvent(final E type, final Object payload, final int priority, final long enqueuedAt,
      final long sequence, final long entrySequence) {
    this.type = type;
    this.payload = payload;
    this.priority = priority;
    this.enqueuedAt = enqueuedAt;
    this.sequence = sequence;
    this.entrySequence = entrySequence;
  }

  /**
   * Free-standing event that never went through a queue, e.g. for driving an executor directly.
   */
  public static <E extends Enum<E>> QueuedEvent<E> of(final E type, final Object payload) {
    return new QueuedEvent<>(type, payload, MachineConfiguration.DEFAULT_PRIORITY,
        System.currentTimeMillis(), 0L, UNTAGGED);
  }

  static <E extends Enum<E>> Comparator<QueuedEvent<E>> servingOrder() {
    return new Comparator<QueuedEvent<E>>() {
      @Override
      public int compare(final QueuedEvent<E> left, final QueuedEvent<E> right) {
        final int byPriority = Integer.compare(left.priority, right.priority);
        return byPriority != 0 ? byPriority : Long.compare(left.sequence, right.sequence);
      }
    };
  }

  public E getType() {
    return type;
  }

  public Object getPayload() {
    return payload;
  }

  public <T> Optional<T> payload(final Class<T> payloadType) {
    return payloadType.isInstance(payload) ? Optional.of(payloadType.cast(payload))
        : Optional.<T>empty();
  }

  public int getPriority() {
    return priority;
  }

  public long getEnqueuedAt() {
    return enqueuedAt;
  }

  public long getSequence() {
    return sequence;
  }

  /**
   * Sequence of the state entry whose invoked service produced this event.
   */
  public Optional<Long> getEntrySequence() {
    return entrySequence == UNTAGGED ? Optional.<Long>empty() : Optional.of(entrySequence);
  }

  @Override
  public String toString() {
    return "QueuedEvent [type=" + type + ", priority=" + priority + ", sequence=" + sequence
        + ", enqueuedAt=" + enqueuedAt + (entrySequence == UNTAGGED ? ""
            : ", entrySequence=" + entrySequence)
        + "]";
  }
}
