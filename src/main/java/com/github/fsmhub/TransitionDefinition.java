package com.github.fsmhub;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.function.Predicate;

/**
 * One row of the static transition table: {@code from --event--> to}, its ordered guards and its
 * ordered actions. An internal transition stays in {@code from}, skips the exit and entry hooks and
 * leaves the invoked service of the state running.
 */
public final class TransitionDefinition<S extends Enum<S>, E extends Enum<E>> {
  private final S from;
  private final S to;
  private final E event;
  private final List<TransitionGuard<S, E>> guards;
  private final List<TransitionAction<S, E>> actions;
  private final boolean internal;

  private TransitionDefinition(final Builder<S, E> builder) {
    this.from = builder.from;
    this.to = builder.to;
    this.event = builder.event;
    this.guards = Collections.unmodifiableList(new ArrayList<>(builder.guards));
    this.actions = Collections.unmodifiableList(new ArrayList<>(builder.actions));
    this.internal = builder.internal;
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

  public List<TransitionGuard<S, E>> getGuards() {
    return guards;
  }

  public List<TransitionAction<S, E>> getActions() {
    return actions;
  }

  public boolean isInternal() {
    return internal;
  }

  @Override
  public String toString() {
    return "TransitionDefinition [" + from + " --" + event + "--> " + to + ", guards="
        + guards.size() + ", actions=" + actions.size() + ", internal=" + internal + "]";
  }

  public final static class Builder<S extends Enum<S>, E extends Enum<E>> {
    private final MachineDefinition.Builder<S, E> parent;
    private final S from;
    private final S to;
    private final E event;
    private final List<TransitionGuard<S, E>> guards = new ArrayList<>();
    private final List<TransitionAction<S, E>> actions = new ArrayList<>();
    private boolean internal;

    Builder(final MachineDefinition.Builder<S, E> parent, final S from, final E event,
        final S to) {
      this.parent = parent;
      this.from = from;
      this.event = event;
      this.to = to;
    }

    public Builder<S, E> guard(final TransitionGuard<S, E> guard) {
      guards.add(guard);
      return this;
    }

    public Builder<S, E> guard(final String name, final String failureMessage,
        final Predicate<MachineContext<S, E>> predicate) {
      guards.add(TransitionGuard.of(name, failureMessage, predicate));
      return this;
    }

    public Builder<S, E> action(final TransitionAction<S, E> action) {
      actions.add(action);
      return this;
    }

    Builder<S, E> internal() {
      this.internal = true;
      return this;
    }

    public MachineDefinition.Builder<S, E> add() {
      parent.addTransition(new TransitionDefinition<>(this));
      return parent;
    }
  }
}
