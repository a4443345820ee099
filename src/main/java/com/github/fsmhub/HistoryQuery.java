package com.github.fsmhub;

/**
 * Filter for {@link HistoryRecorder#query(HistoryQuery)}. Unset criteria match everything; the time
 * range is inclusive on both ends. Context snapshots are stripped unless asked for.
 */
public final class HistoryQuery<S extends Enum<S>, E extends Enum<E>> {
  private final S from;
  private final S to;
  private final E event;
  private final long sinceMillis;
  private final long untilMillis;
  private final int limit;
  private final boolean includeContext;

  private HistoryQuery(final Builder<S, E> builder) {
    this.from = builder.from;
    this.to = builder.to;
    this.event = builder.event;
    this.sinceMillis = builder.sinceMillis;
    this.untilMillis = builder.untilMillis;
    this.limit = builder.limit;
    this.includeContext = builder.includeContext;
  }

  public static <S extends Enum<S>, E extends Enum<E>> Builder<S, E> newBuilder() {
    return new Builder<>();
  }

  public static <S extends Enum<S>, E extends Enum<E>> HistoryQuery<S, E> all() {
    return new Builder<S, E>().build();
  }

  boolean matches(final TransitionRecord<S, E> record) {
    if (from != null && record.getFrom() != from) {
      return false;
    }
    if (to != null && record.getTo() != to) {
      return false;
    }
    if (event != null && record.getEvent() != event) {
      return false;
    }
    return record.getTimestamp() >= sinceMillis && record.getTimestamp() <= untilMillis;
  }

  public int getLimit() {
    return limit;
  }

  public boolean isIncludeContext() {
    return includeContext;
  }

  @Override
  public String toString() {
    return "HistoryQuery [from=" + from + ", to=" + to + ", event=" + event + ", sinceMillis="
        + sinceMillis + ", untilMillis=" + untilMillis + ", limit=" + limit + ", includeContext="
        + includeContext + "]";
  }

  public final static class Builder<S extends Enum<S>, E extends Enum<E>> {
    private S from;
    private S to;
    private E event;
    private long sinceMillis = Long.MIN_VALUE;
    private long untilMillis = Long.MAX_VALUE;
    private int limit = Integer.MAX_VALUE;
    private boolean includeContext;

    Builder() {}

    public Builder<S, E> from(final S from) {
      this.from = from;
      return this;
    }

    public Builder<S, E> to(final S to) {
      this.to = to;
      return this;
    }

    public Builder<S, E> event(final E event) {
      this.event = event;
      return this;
    }

    public Builder<S, E> since(final long sinceMillis) {
      this.sinceMillis = sinceMillis;
      return this;
    }

    public Builder<S, E> until(final long untilMillis) {
      this.untilMillis = untilMillis;
      return this;
    }

    public Builder<S, E> limit(final int limit) {
      if (limit <= 0) {
        throw new IllegalArgumentException("Query limit must be positive, but was: " + limit);
      }
      this.limit = limit;
      return this;
    }

    public Builder<S, E> includeContext() {
      this.includeContext = true;
      return this;
    }

    public HistoryQuery<S, E> build() {
      return new HistoryQuery<>(this);
    }
  }
}
