package com.github.fsmhub;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import com.github.fsmhub.HistoryMetrics.StatePerformance;
import com.github.fsmhub.PerformanceAlert.Severity;
import com.github.fsmhub.PerformanceAlert.Type;
import com.github.fsmhub.PerformanceAnalysis.Bottleneck;

/**
 * Append-only, size-bounded ledgers of transitions, events and state changes for one machine
 * instance, plus running metrics that outlive ledger eviction. All ledgers evict their oldest
 * entries first. Thread-safe: every public method is synchronized on the recorder.
 * 
 * Notes for users:<br>
 * 1. a successful transition slower than twice the configured average-time threshold raises a
 * slow-transition alert as it is recorded<br>
 * 2. error rate, average duration and event backlog are checked by {@link #evaluateAlerts(int)};
 * a condition that already has an active alert of the same severity is not raised again<br>
 * 3. alerts older than the configured retention are no longer active<br>
 */
public final class HistoryRecorder<S extends Enum<S>, E extends Enum<E>> {
  private static final int TOP_N = 5;
  private static final double BOTTLENECK_FACTOR = 1.5d;

  private final String machineId;
  private final Class<S> stateType;
  private final Class<E> eventType;
  private final MachineLogger logger;

  private final BoundedHistory<TransitionRecord<S, E>> transitions;
  private final BoundedHistory<EventRecord<S, E>> events;
  private final BoundedHistory<StateChangeRecord<S>> stateChanges;
  private final BoundedHistory<PerformanceAlert> alerts;

  private final long transitionTimeThreshold;
  private final double errorRateThreshold;
  private final int queueSizeThreshold;
  private final long alertRetentionMillis;

  private long totalTransitions;
  private long successfulTransitions;
  private long failedTransitions;
  private long totalDurationMillis;
  private long lastTransitionMillis;
  private final Map<S, long[]> stateCounters;

  public HistoryRecorder(final String machineId, final Class<S> stateType,
      final Class<E> eventType, final MachineConfiguration config, final MachineLogger logger) {
    this.machineId = machineId;
    this.stateType = stateType;
    this.eventType = eventType;
    this.logger = logger;
    this.transitions = new BoundedHistory<>(config.getTransitionHistoryCapacity());
    this.events = new BoundedHistory<>(config.getEventHistoryCapacity());
    this.stateChanges = new BoundedHistory<>(config.getTransitionHistoryCapacity());
    this.alerts = new BoundedHistory<>(config.getAlertHistoryCapacity());
    this.transitionTimeThreshold = config.getTransitionTimeThresholdMillis();
    this.errorRateThreshold = config.getErrorRateThreshold();
    this.queueSizeThreshold = config.getQueueSizeThreshold();
    this.alertRetentionMillis = config.getAlertRetentionMillis();
    this.stateCounters = new EnumMap<>(stateType);
  }

  /**
   * Successful transitions that actually change state are also logged as state changes.
   */
  public synchronized void recordTransition(final TransitionRecord<S, E> record) {
    transitions.add(record);
    totalTransitions++;
    lastTransitionMillis = record.getTimestamp();
    long[] counters = stateCounters.get(record.getFrom());
    if (counters == null) {
      // outbound, failed, duration
      counters = new long[3];
      stateCounters.put(record.getFrom(), counters);
    }
    counters[0]++;
    if (record.isSuccess()) {
      successfulTransitions++;
      totalDurationMillis += record.getDurationMillis();
      counters[2] += record.getDurationMillis();
      if (record.getFrom() != record.getTo()) {
        stateChanges.add(new StateChangeRecord<>(record.getFrom(), record.getTo(),
            record.getTimestamp() + record.getDurationMillis()));
      }
      if (record.getDurationMillis() > 2 * transitionTimeThreshold) {
        raise(new PerformanceAlert(machineId, Type.SLOW_TRANSITION, Severity.MEDIUM,
            String.format("Transition %s -[%s]-> %s took %d millis", record.getFrom(),
                record.getEvent(), record.getTo(), record.getDurationMillis()),
            record.getDurationMillis(), 2 * transitionTimeThreshold,
            System.currentTimeMillis()));
      }
    } else {
      failedTransitions++;
      counters[1]++;
    }
  }

  public synchronized EventRecord<S, E> recordEvent(final E event, final S state,
      final long durationMillis, final boolean success, final String error) {
    final EventRecord<S, E> record = new EventRecord<>(event, state, System.currentTimeMillis(),
        durationMillis, success, error);
    events.add(record);
    return record;
  }

  public synchronized void recordStateChange(final S from, final S to) {
    stateChanges.add(new StateChangeRecord<>(from, to, System.currentTimeMillis()));
  }

  /**
   * Matching transitions, newest first; records with equal timestamps keep newest-appended first.
   */
  public synchronized List<TransitionRecord<S, E>> query(final HistoryQuery<S, E> query) {
    final List<TransitionRecord<S, E>> all = transitions.toList();
    final List<TransitionRecord<S, E>> matches = new ArrayList<>();
    for (int i = all.size() - 1; i >= 0; i--) {
      final TransitionRecord<S, E> record = all.get(i);
      if (query.matches(record)) {
        matches.add(query.isIncludeContext() ? record : record.withoutContext());
      }
    }
    Collections.sort(matches, new Comparator<TransitionRecord<S, E>>() {
      @Override
      public int compare(final TransitionRecord<S, E> left, final TransitionRecord<S, E> right) {
        return Long.compare(right.getTimestamp(), left.getTimestamp());
      }
    });
    return matches.size() > query.getLimit()
        ? new ArrayList<>(matches.subList(0, query.getLimit())) : matches;
  }

  public HistoryQuery.Builder<S, E> newQuery() {
    return HistoryQuery.newBuilder();
  }

  public synchronized List<TransitionRecord<S, E>> getIncomingTransitions(final S state) {
    final List<TransitionRecord<S, E>> incoming = new ArrayList<>();
    for (final TransitionRecord<S, E> record : transitions.toList()) {
      if (record.getTo() == state) {
        incoming.add(record);
      }
    }
    return incoming;
  }

  public synchronized List<TransitionRecord<S, E>> getOutgoingTransitions(final S state) {
    final List<TransitionRecord<S, E>> outgoing = new ArrayList<>();
    for (final TransitionRecord<S, E> record : transitions.toList()) {
      if (record.getFrom() == state) {
        outgoing.add(record);
      }
    }
    return outgoing;
  }

  /**
   * Oldest first.
   */
  public synchronized List<TransitionRecord<S, E>> getTransitions() {
    return transitions.toList();
  }

  public synchronized List<EventRecord<S, E>> getEvents() {
    return events.toList();
  }

  public synchronized List<StateChangeRecord<S>> getStateChanges() {
    return stateChanges.toList();
  }

  public synchronized PerformanceAnalysis<S, E> analyzePerformance() {
    final List<TransitionRecord<S, E>> all = transitions.toList();
    final List<TransitionRecord<S, E>> successful = new ArrayList<>();
    final Map<S, Long> stateDistribution = new EnumMap<>(stateType);
    final Map<E, Long> eventFrequency = new EnumMap<>(eventType);
    final Map<S, long[]> outbound = new EnumMap<>(stateType);
    long successfulDuration = 0L;
    for (final TransitionRecord<S, E> record : all) {
      increment(stateDistribution, record.getFrom());
      increment(stateDistribution, record.getTo());
      increment(eventFrequency, record.getEvent());
      if (record.isSuccess()) {
        successful.add(record);
        successfulDuration += record.getDurationMillis();
        long[] perState = outbound.get(record.getFrom());
        if (perState == null) {
          perState = new long[2];
          outbound.put(record.getFrom(), perState);
        }
        perState[0]++;
        perState[1] += record.getDurationMillis();
      }
    }
    final double average =
        successful.isEmpty() ? 0.0d : (double) successfulDuration / successful.size();

    final List<TransitionRecord<S, E>> byDuration = new ArrayList<>(successful);
    Collections.sort(byDuration, new Comparator<TransitionRecord<S, E>>() {
      @Override
      public int compare(final TransitionRecord<S, E> left, final TransitionRecord<S, E> right) {
        return Long.compare(right.getDurationMillis(), left.getDurationMillis());
      }
    });
    final List<TransitionRecord<S, E>> slowest =
        byDuration.subList(0, Math.min(TOP_N, byDuration.size()));
    final List<TransitionRecord<S, E>> fastest = new ArrayList<>(byDuration);
    Collections.reverse(fastest);

    final List<Bottleneck<S>> bottlenecks = new ArrayList<>();
    if (average > 0.0d) {
      for (final Map.Entry<S, long[]> entry : outbound.entrySet()) {
        final double stateAverage = (double) entry.getValue()[1] / entry.getValue()[0];
        if (stateAverage > average * BOTTLENECK_FACTOR) {
          bottlenecks.add(new Bottleneck<>(entry.getKey(), stateAverage, entry.getValue()[0]));
        }
      }
      Collections.sort(bottlenecks, new Comparator<Bottleneck<S>>() {
        @Override
        public int compare(final Bottleneck<S> left, final Bottleneck<S> right) {
          return Double.compare(right.getAverageDurationMillis(), left.getAverageDurationMillis());
        }
      });
    }

    final double errorRate =
        all.isEmpty() ? 0.0d : (double) (all.size() - successful.size()) / all.size();
    return new PerformanceAnalysis<>(average, slowest,
        fastest.subList(0, Math.min(TOP_N, fastest.size())), errorRate, stateDistribution,
        eventFrequency, computeTimeInStates(),
        bottlenecks.subList(0, Math.min(TOP_N, bottlenecks.size())));
  }

  public synchronized HistoryMetrics<S> getMetrics() {
    final Map<S, StatePerformance<S>> performance = new EnumMap<>(stateType);
    for (final Map.Entry<S, long[]> entry : stateCounters.entrySet()) {
      performance.put(entry.getKey(), new StatePerformance<>(entry.getKey(), entry.getValue()[0],
          entry.getValue()[1], entry.getValue()[2]));
    }
    return new HistoryMetrics<>(totalTransitions, successfulTransitions, failedTransitions,
        totalDurationMillis, lastTransitionMillis, performance);
  }

  public synchronized HistoryStatistics getHistoryStatistics() {
    final List<TransitionRecord<S, E>> all = transitions.toList();
    long oldest = 0L;
    long newest = 0L;
    if (!all.isEmpty()) {
      oldest = Long.MAX_VALUE;
      newest = Long.MIN_VALUE;
      for (final TransitionRecord<S, E> record : all) {
        oldest = Math.min(oldest, record.getTimestamp());
        newest = Math.max(newest, record.getTimestamp());
      }
    }
    return new HistoryStatistics(all.size(), events.size(), stateChanges.size(),
        transitions.totalAppended(), oldest, newest);
  }

  /**
   * Checks the running error rate and average duration, and the given event backlog, against the
   * configured thresholds.
   *
   * @return the alerts newly raised by this check
   */
  public synchronized List<PerformanceAlert> evaluateAlerts(final int pendingEvents) {
    final List<PerformanceAlert> raised = new ArrayList<>();
    final long now = System.currentTimeMillis();
    if (totalTransitions > 0L) {
      final double errorRate = (double) failedTransitions / totalTransitions;
      if (errorRate > errorRateThreshold) {
        final Severity severity =
            errorRate > 2 * errorRateThreshold ? Severity.CRITICAL : Severity.HIGH;
        raiseOnce(raised, new PerformanceAlert(machineId, Type.HIGH_ERROR_RATE, severity,
            String.format("Error rate %.3f over %d transitions", errorRate, totalTransitions),
            errorRate, errorRateThreshold, now));
      }
    }
    if (successfulTransitions > 0L) {
      final double average = (double) totalDurationMillis / successfulTransitions;
      if (average > transitionTimeThreshold) {
        final Severity severity =
            average > 2 * transitionTimeThreshold ? Severity.CRITICAL : Severity.MEDIUM;
        raiseOnce(raised, new PerformanceAlert(machineId, Type.SLOW_AVERAGE, severity,
            String.format("Average transition time %.1f millis", average), average,
            transitionTimeThreshold, now));
      }
    }
    if (pendingEvents > queueSizeThreshold) {
      final Severity severity =
          pendingEvents > 5 * queueSizeThreshold ? Severity.CRITICAL : Severity.HIGH;
      raiseOnce(raised, new PerformanceAlert(machineId, Type.QUEUE_BACKLOG, severity,
          String.format("%d events pending", pendingEvents), pendingEvents, queueSizeThreshold,
          now));
    }
    return raised;
  }

  /**
   * Alerts raised within the retention window, oldest first.
   */
  public synchronized List<PerformanceAlert> getActiveAlerts() {
    final long cutoff = System.currentTimeMillis() - alertRetentionMillis;
    final List<PerformanceAlert> active = new ArrayList<>();
    for (final PerformanceAlert alert : alerts.toList()) {
      if (alert.getTimestamp() >= cutoff) {
        active.add(alert);
      }
    }
    return active;
  }

  public synchronized boolean hasCriticalAlert() {
    for (final PerformanceAlert alert : getActiveAlerts()) {
      if (alert.isCritical()) {
        return true;
      }
    }
    return false;
  }

  public synchronized void clearHistory() {
    transitions.clear();
    events.clear();
    stateChanges.clear();
    alerts.clear();
    resetMetrics();
    logger.info("Cleared history");
  }

  public synchronized HistorySnapshot<S, E> exportHistory() {
    return new HistorySnapshot<>(machineId, System.currentTimeMillis(), transitions.toList(),
        events.toList(), stateChanges.toList(), getMetrics());
  }

  /**
   * Replaces the ledgers and running metrics with the snapshot's. Entries beyond this recorder's
   * capacities are evicted oldest first, as on append.
   */
  public synchronized void importHistory(final HistorySnapshot<S, E> snapshot) {
    transitions.clear();
    events.clear();
    stateChanges.clear();
    transitions.addAll(snapshot.getTransitions());
    events.addAll(snapshot.getEvents());
    stateChanges.addAll(snapshot.getStateChanges());
    resetMetrics();
    final HistoryMetrics<S> metrics = snapshot.getMetrics();
    if (metrics != null) {
      totalTransitions = metrics.getTotalTransitions();
      successfulTransitions = metrics.getSuccessfulTransitions();
      failedTransitions = metrics.getFailedTransitions();
      totalDurationMillis = metrics.getTotalDurationMillis();
      lastTransitionMillis = metrics.getLastTransitionMillis();
      for (final StatePerformance<S> performance : metrics.getStatePerformance().values()) {
        stateCounters.put(performance.getState(), new long[] {performance.getOutbound(),
            performance.getFailed(), performance.getTotalDurationMillis()});
      }
    }
    logger.info(String.format("Imported history of %s exported at %d: %d transitions",
        snapshot.getMachineId(), snapshot.getExportedAt(), snapshot.getTransitions().size()));
  }

  private void raiseOnce(final List<PerformanceAlert> raised, final PerformanceAlert alert) {
    for (final PerformanceAlert active : getActiveAlerts()) {
      if (active.getType() == alert.getType() && active.getSeverity() == alert.getSeverity()) {
        return;
      }
    }
    raise(alert);
    raised.add(alert);
  }

  private void raise(final PerformanceAlert alert) {
    alerts.add(alert);
    logger.warn(String.format("%s alert %s: %s", alert.getSeverity(), alert.getType(),
        alert.getMessage()));
  }

  private void resetMetrics() {
    totalTransitions = 0L;
    successfulTransitions = 0L;
    failedTransitions = 0L;
    totalDurationMillis = 0L;
    lastTransitionMillis = 0L;
    stateCounters.clear();
  }

  private Map<S, Long> computeTimeInStates() {
    final Map<S, Long> timeInStates = new EnumMap<>(stateType);
    final List<StateChangeRecord<S>> changes = stateChanges.toList();
    final long now = System.currentTimeMillis();
    for (int i = 0; i < changes.size(); i++) {
      final StateChangeRecord<S> change = changes.get(i);
      final long leftAt = i + 1 < changes.size() ? changes.get(i + 1).getTimestamp() : now;
      final Long soFar = timeInStates.get(change.getTo());
      timeInStates.put(change.getTo(),
          (soFar == null ? 0L : soFar) + Math.max(0L, leftAt - change.getTimestamp()));
    }
    return timeInStates;
  }

  private static <K> void increment(final Map<K, Long> counts, final K key) {
    final Long count = counts.get(key);
    counts.put(key, count == null ? 1L : count + 1L);
  }

  /**
   * Ledger sizes and the time span covered by the transitions still held.
   */
  public final static class HistoryStatistics {
    private final int transitionCount;
    private final int eventCount;
    private final int stateChangeCount;
    private final long totalRecorded;
    private final long oldestMillis;
    private final long newestMillis;

    private HistoryStatistics(final int transitionCount, final int eventCount,
        final int stateChangeCount, final long totalRecorded, final long oldestMillis,
        final long newestMillis) {
      this.transitionCount = transitionCount;
      this.eventCount = eventCount;
      this.stateChangeCount = stateChangeCount;
      this.totalRecorded = totalRecorded;
      this.oldestMillis = oldestMillis;
      this.newestMillis = newestMillis;
    }

    public int getTransitionCount() {
      return transitionCount;
    }

    public int getEventCount() {
      return eventCount;
    }

    public int getStateChangeCount() {
      return stateChangeCount;
    }

    /**
     * Transitions ever recorded, including evicted ones.
     */
    public long getTotalRecorded() {
      return totalRecorded;
    }

    public long getOldestMillis() {
      return oldestMillis;
    }

    public long getNewestMillis() {
      return newestMillis;
    }

    public long getTimeSpanMillis() {
      return newestMillis - oldestMillis;
    }

    @Override
    public String toString() {
      return "HistoryStatistics [transitionCount=" + transitionCount + ", eventCount="
          + eventCount + ", stateChangeCount=" + stateChangeCount + ", totalRecorded="
          + totalRecorded + ", timeSpanMillis=" + getTimeSpanMillis() + "]";
    }
  }
}
