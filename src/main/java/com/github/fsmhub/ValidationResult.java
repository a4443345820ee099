package com.github.fsmhub;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Entry of the validation history: one allow/deny decision with the failing guards and a reason.
 */
public final class ValidationResult<S extends Enum<S>, E extends Enum<E>> {
  private final S from;
  private final S to;
  private final E event;
  private final boolean valid;
  private final boolean legal;
  private final List<String> failedGuards;
  private final String reason;
  private final long timestamp;

  ValidationResult(final S from, final S to, final E event, final boolean legal,
      final List<String> failedGuards, final String reason, final long timestamp) {
    this.from = from;
    this.to = to;
    this.event = event;
    this.legal = legal;
    this.failedGuards = Collections.unmodifiableList(new ArrayList<>(failedGuards));
    this.valid = legal && failedGuards.isEmpty();
    this.reason = reason;
    this.timestamp = timestamp;
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

  public boolean isValid() {
    return valid;
  }

  /**
   * False when the transition isn't in the table for the current state at all.
   */
  public boolean isLegal() {
    return legal;
  }

  public List<String> getFailedGuards() {
    return failedGuards;
  }

  public String getReason() {
    return reason;
  }

  public long getTimestamp() {
    return timestamp;
  }

  @Override
  public String toString() {
    return "ValidationResult [" + from + " --" + event + "--> " + to + ", valid=" + valid
        + ", failedGuards=" + failedGuards + ", reason=" + reason + "]";
  }
}
