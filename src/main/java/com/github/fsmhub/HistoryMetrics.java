package com.github.fsmhub;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Running transition metrics of a recorder. Unlike the ledgers these counters are never evicted,
 * they only reset on {@link HistoryRecorder#clearHistory()}.
 */
public final class HistoryMetrics<S extends Enum<S>> {
  private final long totalTransitions;
  private final long successfulTransitions;
  private final long failedTransitions;
  private final long totalDurationMillis;
  private final long lastTransitionMillis;
  private final Map<S, StatePerformance<S>> statePerformance;

  public HistoryMetrics(final long totalTransitions, final long successfulTransitions,
      final long failedTransitions, final long totalDurationMillis,
      final long lastTransitionMillis, final Map<S, StatePerformance<S>> statePerformance) {
    this.totalTransitions = totalTransitions;
    this.successfulTransitions = successfulTransitions;
    this.failedTransitions = failedTransitions;
    this.totalDurationMillis = totalDurationMillis;
    this.lastTransitionMillis = lastTransitionMillis;
    this.statePerformance = Collections.unmodifiableMap(new LinkedHashMap<>(statePerformance));
  }

  public long getTotalTransitions() {
    return totalTransitions;
  }

  public long getSuccessfulTransitions() {
    return successfulTransitions;
  }

  public long getFailedTransitions() {
    return failedTransitions;
  }

  /**
   * Summed over successful transitions only.
   */
  public long getTotalDurationMillis() {
    return totalDurationMillis;
  }

  public double getAverageTransitionMillis() {
    return successfulTransitions == 0L ? 0.0d
        : (double) totalDurationMillis / successfulTransitions;
  }

  public double getErrorRate() {
    return totalTransitions == 0L ? 0.0d : (double) failedTransitions / totalTransitions;
  }

  public long getLastTransitionMillis() {
    return lastTransitionMillis;
  }

  /**
   * Keyed by source state.
   */
  public Map<S, StatePerformance<S>> getStatePerformance() {
    return statePerformance;
  }

  @Override
  public String toString() {
    return "HistoryMetrics [totalTransitions=" + totalTransitions + ", successfulTransitions="
        + successfulTransitions + ", failedTransitions=" + failedTransitions
        + ", averageTransitionMillis=" + getAverageTransitionMillis() + "]";
  }

  /**
   * Outbound transition counters of one source state.
   */
  public final static class StatePerformance<S extends Enum<S>> {
    private final S state;
    private final long outbound;
    private final long failed;
    private final long totalDurationMillis;

    public StatePerformance(final S state, final long outbound, final long failed,
        final long totalDurationMillis) {
      this.state = state;
      this.outbound = outbound;
      this.failed = failed;
      this.totalDurationMillis = totalDurationMillis;
    }

    public S getState() {
      return state;
    }

    public long getOutbound() {
      return outbound;
    }

    public long getFailed() {
      return failed;
    }

    public long getTotalDurationMillis() {
      return totalDurationMillis;
    }

    public double getAverageDurationMillis() {
      final long succeeded = outbound - failed;
      return succeeded <= 0L ? 0.0d : (double) totalDurationMillis / succeeded;
    }

    @Override
    public String toString() {
      return "StatePerformance [state=" + state + ", outbound=" + outbound + ", failed=" + failed
          + ", averageDurationMillis=" + getAverageDurationMillis() + "]";
    }
  }
}
