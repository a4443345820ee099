package com.github.fsmhub;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import com.github.fsmhub.MachineException.Code;

/**
 * Immutable, validated description of a machine: its state set (every constant of the state enum),
 * its initial state, its per-state definitions and its deterministic transition table with at most
 * one transition per (state, event). Definitions are stateless and can back any number of
 * instances. Use {@link #newBuilder(String, Class, Class)} to put one together.
 */
public final class MachineDefinition<S extends Enum<S>, E extends Enum<E>> {
  private final String name;
  private final Class<S> stateType;
  private final Class<E> eventType;
  private final S initialState;
  private final E failureEvent;
  private final Map<S, StateDefinition<S, E>> states;
  private final Map<S, Map<E, TransitionDefinition<S, E>>> table;
  private final Map<E, List<TransitionGuard<S, E>>> eventGuards;

  private MachineDefinition(final Builder<S, E> builder) {
    this.name = builder.name;
    this.stateType = builder.stateType;
    this.eventType = builder.eventType;
    this.initialState = builder.initialState;
    this.failureEvent = builder.failureEvent;
    this.states = new EnumMap<>(stateType);
    for (final S state : stateType.getEnumConstants()) {
      final StateDefinition<S, E> declared = builder.states.get(state);
      states.put(state, declared != null ? declared : StateDefinition.<S, E>plain(state));
    }
    this.table = new EnumMap<>(stateType);
    for (final TransitionDefinition<S, E> transition : builder.transitions) {
      Map<E, TransitionDefinition<S, E>> row = table.get(transition.getFrom());
      if (row == null) {
        row = new EnumMap<>(eventType);
        table.put(transition.getFrom(), row);
      }
      row.put(transition.getEvent(), transition);
    }
    this.eventGuards = new EnumMap<>(eventType);
    for (final Map.Entry<E, List<TransitionGuard<S, E>>> entry : builder.eventGuards.entrySet()) {
      eventGuards.put(entry.getKey(),
          Collections.unmodifiableList(new ArrayList<>(entry.getValue())));
    }
  }

  public static <S extends Enum<S>, E extends Enum<E>> Builder<S, E> newBuilder(final String name,
      final Class<S> stateType, final Class<E> eventType) {
    return new Builder<>(name, stateType, eventType);
  }

  public String getName() {
    return name;
  }

  public Class<S> getStateType() {
    return stateType;
  }

  public Class<E> getEventType() {
    return eventType;
  }

  public S getInitialState() {
    return initialState;
  }

  /**
   * Event posted after a transition fails its destination invariants, if any.
   */
  public Optional<E> getFailureEvent() {
    return Optional.ofNullable(failureEvent);
  }

  public StateDefinition<S, E> getStateDefinition(final S state) {
    return states.get(state);
  }

  public List<S> getStates() {
    return new ArrayList<>(states.keySet());
  }

  public Optional<TransitionDefinition<S, E>> findTransition(final S from, final E event) {
    final Map<E, TransitionDefinition<S, E>> row = table.get(from);
    return row == null ? Optional.empty() : Optional.ofNullable(row.get(event));
  }

  public List<TransitionDefinition<S, E>> getTransitionsFrom(final S from) {
    final Map<E, TransitionDefinition<S, E>> row = table.get(from);
    return row == null ? Collections.emptyList() : new ArrayList<>(row.values());
  }

  public List<TransitionDefinition<S, E>> getTransitions() {
    final List<TransitionDefinition<S, E>> transitions = new ArrayList<>();
    for (final Map<E, TransitionDefinition<S, E>> row : table.values()) {
      transitions.addAll(row.values());
    }
    return transitions;
  }

  /**
   * Guards applied to every transition triggered by {@code event}, on top of its own guards.
   */
  public List<TransitionGuard<S, E>> getEventGuards(final E event) {
    final List<TransitionGuard<S, E>> guards = eventGuards.get(event);
    return guards == null ? Collections.emptyList() : guards;
  }

  @Override
  public String toString() {
    return "MachineDefinition [name=" + name + ", initialState=" + initialState + ", states="
        + states.size() + ", transitions=" + getTransitions().size() + "]";
  }

  public final static class Builder<S extends Enum<S>, E extends Enum<E>> {
    private final String name;
    private final Class<S> stateType;
    private final Class<E> eventType;
    private S initialState;
    private E failureEvent;
    private final Map<S, StateDefinition<S, E>> states;
    private final List<TransitionDefinition<S, E>> transitions = new ArrayList<>();
    private final Map<E, List<TransitionGuard<S, E>>> eventGuards;
    private final StringBuilder problems = new StringBuilder();

    private Builder(final String name, final Class<S> stateType, final Class<E> eventType) {
      if (stateType == null || eventType == null) {
        throw new IllegalArgumentException("State and event types cannot be null");
      }
      this.name = name;
      this.stateType = stateType;
      this.eventType = eventType;
      this.states = new EnumMap<>(stateType);
      this.eventGuards = new EnumMap<>(eventType);
    }

    public Builder<S, E> initialState(final S initialState) {
      this.initialState = initialState;
      return this;
    }

    public Builder<S, E> failureEvent(final E failureEvent) {
      this.failureEvent = failureEvent;
      return this;
    }

    public StateDefinition.Builder<S, E> state(final S state) {
      return new StateDefinition.Builder<>(this, state);
    }

    public TransitionDefinition.Builder<S, E> transition(final S from, final E event, final S to) {
      return new TransitionDefinition.Builder<>(this, from, event, to);
    }

    /**
     * Self-transition that only runs its actions; hooks don't fire and the state's service keeps
     * running.
     */
    public TransitionDefinition.Builder<S, E> internalTransition(final S state, final E event) {
      return new TransitionDefinition.Builder<>(this, state, event, state).internal();
    }

    public Builder<S, E> eventGuard(final E event, final TransitionGuard<S, E> guard) {
      List<TransitionGuard<S, E>> guards = eventGuards.get(event);
      if (guards == null) {
        guards = new ArrayList<>();
        eventGuards.put(event, guards);
      }
      guards.add(guard);
      return this;
    }

    void addState(final StateDefinition<S, E> definition) {
      if (definition.getState() == null) {
        problems.append("State definition without a state. ");
      } else if (states.containsKey(definition.getState())) {
        problems.append("Duplicate state definition for ").append(definition.getState())
            .append(". ");
      } else {
        states.put(definition.getState(), definition);
      }
    }

    void addTransition(final TransitionDefinition<S, E> transition) {
      if (transition.getFrom() == null || transition.getTo() == null
          || transition.getEvent() == null) {
        problems.append("Transition requires from, event and to: ").append(transition)
            .append(". ");
        return;
      }
      for (final TransitionDefinition<S, E> existing : transitions) {
        if (existing.getFrom() == transition.getFrom()
            && existing.getEvent() == transition.getEvent()) {
          problems.append("Non-deterministic transitions for (").append(transition.getFrom())
              .append(", ").append(transition.getEvent()).append("). ");
          return;
        }
      }
      transitions.add(transition);
    }

    public MachineDefinition<S, E> build() throws MachineException {
      validate();
      return new MachineDefinition<>(this);
    }

    private void validate() throws MachineException {
      final StringBuilder messages = new StringBuilder(problems);
      if (name == null || name.trim().isEmpty()) {
        messages.append("Machine name cannot be null or blank. ");
      }
      if (initialState == null) {
        messages.append("Initial state cannot be null. ");
      }
      if (transitions.isEmpty()) {
        messages.append("Transition table cannot be empty. ");
      }
      for (final TransitionDefinition<S, E> transition : transitions) {
        final StateDefinition<S, E> source = states.get(transition.getFrom());
        if (source != null && source.isTerminal()) {
          messages.append("Terminal state ").append(transition.getFrom())
              .append(" cannot have outbound transition on ").append(transition.getEvent())
              .append(". ");
        }
      }
      for (final StateDefinition<S, E> state : states.values()) {
        if (state.getService().isPresent() != (state.getServiceName() != null)) {
          messages.append("Invoked service of ").append(state.getState())
              .append(" needs both a name and an implementation. ");
        }
        checkRoutable(messages, state, state.getDoneEvent().orElse(null), "done");
        checkRoutable(messages, state, state.getErrorEvent().orElse(null), "error");
        if (state.getTimeoutMillis() > 0L || state.getTimeoutEvent().isPresent()) {
          if (state.getTimeoutMillis() <= 0L || !state.getTimeoutEvent().isPresent()) {
            messages.append("Timeout of ").append(state.getState())
                .append(" needs a positive duration and a fallback event. ");
          } else {
            checkRoutable(messages, state, state.getTimeoutEvent().get(), "timeout");
          }
        }
      }
      if (messages.length() > 0) {
        throw new MachineException(Code.INVALID_MACHINE_DEFINITION, messages.toString());
      }
    }

    private void checkRoutable(final StringBuilder messages, final StateDefinition<S, E> state,
        final E event, final String kind) {
      if (event == null) {
        return;
      }
      for (final TransitionDefinition<S, E> transition : transitions) {
        if (transition.getFrom() == state.getState() && transition.getEvent() == event) {
          return;
        }
      }
      messages.append("The ").append(kind).append(" event ").append(event).append(" of ")
          .append(state.getState()).append(" has no transition out of it. ");
    }
  }
}
