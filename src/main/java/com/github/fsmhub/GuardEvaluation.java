package com.github.fsmhub;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Outcome of running an ordered guard list: valid only when no guard failed. Every guard is
 * evaluated, so the failure set is always complete.
 */
public final class GuardEvaluation {
  private final List<String> failedGuards;
  private final List<String> failureMessages;

  GuardEvaluation(final List<String> failedGuards, final List<String> failureMessages) {
    this.failedGuards = Collections.unmodifiableList(new ArrayList<>(failedGuards));
    this.failureMessages = Collections.unmodifiableList(new ArrayList<>(failureMessages));
  }

  public boolean isValid() {
    return failedGuards.isEmpty();
  }

  public List<String> getFailedGuards() {
    return failedGuards;
  }

  public List<String> getFailureMessages() {
    return failureMessages;
  }

  @Override
  public String toString() {
    return "GuardEvaluation [valid=" + isValid() + ", failedGuards=" + failedGuards + "]";
  }
}
