package com.github.fsmhub;

/**
 * Immutable ledger entry for one committed state change.
 */
public final class StateChangeRecord<S extends Enum<S>> {
  private final S from;
  private final S to;
  private final long timestamp;

  public StateChangeRecord(final S from, final S to, final long timestamp) {
    this.from = from;
    this.to = to;
    this.timestamp = timestamp;
  }

  public S getFrom() {
    return from;
  }

  public S getTo() {
    return to;
  }

  public long getTimestamp() {
    return timestamp;
  }

  @Override
  public String toString() {
    return "StateChangeRecord [" + from + "->" + to + ", timestamp=" + timestamp + "]";
  }
}
