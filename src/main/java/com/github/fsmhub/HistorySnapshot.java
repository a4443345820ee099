package com.github.fsmhub;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Exported ledgers and running metrics of one recorder, in the shape
 * {@code {transitions, events, stateChanges, metrics}}. Serialization is left to the caller.
 */
public final class HistorySnapshot<S extends Enum<S>, E extends Enum<E>> {
  private final String machineId;
  private final long exportedAt;
  private final List<TransitionRecord<S, E>> transitions;
  private final List<EventRecord<S, E>> events;
  private final List<StateChangeRecord<S>> stateChanges;
  private final HistoryMetrics<S> metrics;

  public HistorySnapshot(final String machineId, final long exportedAt,
      final List<TransitionRecord<S, E>> transitions, final List<EventRecord<S, E>> events,
      final List<StateChangeRecord<S>> stateChanges, final HistoryMetrics<S> metrics) {
    this.machineId = machineId;
    this.exportedAt = exportedAt;
    this.transitions = Collections.unmodifiableList(new ArrayList<>(transitions));
    this.events = Collections.unmodifiableList(new ArrayList<>(events));
    this.stateChanges = Collections.unmodifiableList(new ArrayList<>(stateChanges));
    this.metrics = metrics;
  }

  public String getMachineId() {
    return machineId;
  }

  public long getExportedAt() {
    return exportedAt;
  }

  /**
   * Oldest first.
   */
  public List<TransitionRecord<S, E>> getTransitions() {
    return transitions;
  }

  public List<EventRecord<S, E>> getEvents() {
    return events;
  }

  public List<StateChangeRecord<S>> getStateChanges() {
    return stateChanges;
  }

  public HistoryMetrics<S> getMetrics() {
    return metrics;
  }

  @Override
  public String toString() {
    return "HistorySnapshot [machineId=" + machineId + ", exportedAt=" + exportedAt
        + ", transitions=" + transitions.size() + ", events=" + events.size() + ", stateChanges="
        + stateChanges.size() + ", metrics=" + metrics + "]";
  }
}
