package com.github.fsmhub;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * On-demand analysis of the transition ledger of one recorder. Durations only count successful
 * transitions; the error rate counts all of them.
 */
public final class PerformanceAnalysis<S extends Enum<S>, E extends Enum<E>> {
  private final double averageTransitionMillis;
  private final List<TransitionRecord<S, E>> slowest;
  private final List<TransitionRecord<S, E>> fastest;
  private final double errorRate;
  private final Map<S, Long> stateDistribution;
  private final Map<E, Long> eventFrequency;
  private final Map<S, Long> timeInStates;
  private final List<Bottleneck<S>> bottlenecks;

  PerformanceAnalysis(final double averageTransitionMillis,
      final List<TransitionRecord<S, E>> slowest, final List<TransitionRecord<S, E>> fastest,
      final double errorRate, final Map<S, Long> stateDistribution,
      final Map<E, Long> eventFrequency, final Map<S, Long> timeInStates,
      final List<Bottleneck<S>> bottlenecks) {
    this.averageTransitionMillis = averageTransitionMillis;
    this.slowest = Collections.unmodifiableList(new ArrayList<>(slowest));
    this.fastest = Collections.unmodifiableList(new ArrayList<>(fastest));
    this.errorRate = errorRate;
    this.stateDistribution = Collections.unmodifiableMap(new LinkedHashMap<>(stateDistribution));
    this.eventFrequency = Collections.unmodifiableMap(new LinkedHashMap<>(eventFrequency));
    this.timeInStates = Collections.unmodifiableMap(new LinkedHashMap<>(timeInStates));
    this.bottlenecks = Collections.unmodifiableList(new ArrayList<>(bottlenecks));
  }

  public double getAverageTransitionMillis() {
    return averageTransitionMillis;
  }

  /**
   * Slowest first.
   */
  public List<TransitionRecord<S, E>> getSlowest() {
    return slowest;
  }

  /**
   * Fastest first.
   */
  public List<TransitionRecord<S, E>> getFastest() {
    return fastest;
  }

  public double getErrorRate() {
    return errorRate;
  }

  /**
   * How often each state shows up as either end of a recorded transition.
   */
  public Map<S, Long> getStateDistribution() {
    return stateDistribution;
  }

  public Map<E, Long> getEventFrequency() {
    return eventFrequency;
  }

  public Map<S, Long> getTimeInStates() {
    return timeInStates;
  }

  /**
   * Slowest first.
   */
  public List<Bottleneck<S>> getBottlenecks() {
    return bottlenecks;
  }

  @Override
  public String toString() {
    return "PerformanceAnalysis [averageTransitionMillis=" + averageTransitionMillis
        + ", errorRate=" + errorRate + ", stateDistribution=" + stateDistribution
        + ", eventFrequency=" + eventFrequency + ", bottlenecks=" + bottlenecks + "]";
  }

  /**
   * Source state whose average outbound duration is well above the global average.
   */
  public final static class Bottleneck<S extends Enum<S>> {
    private final S state;
    private final double averageDurationMillis;
    private final long transitions;

    Bottleneck(final S state, final double averageDurationMillis, final long transitions) {
      this.state = state;
      this.averageDurationMillis = averageDurationMillis;
      this.transitions = transitions;
    }

    public S getState() {
      return state;
    }

    public double getAverageDurationMillis() {
      return averageDurationMillis;
    }

    public long getTransitions() {
      return transitions;
    }

    @Override
    public String toString() {
      return "Bottleneck [state=" + state + ", averageDurationMillis=" + averageDurationMillis
          + ", transitions=" + transitions + "]";
    }
  }
}
