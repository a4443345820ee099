package com.github.fsmhub;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * Static description of one state: entry/exit hooks, invariants, an optional invoked service with
 * its done/error events, an optional timeout with its fallback event, and whether the state is
 * terminal or counts as unhealthy. Built through {@link MachineDefinition.Builder#state(Enum)}.
 */
public final class StateDefinition<S extends Enum<S>, E extends Enum<E>> {
  private final S state;
  private final StateHook<S, E> entry;
  private final StateHook<S, E> exit;
  private final List<StateInvariant<S, E>> invariants;
  private final String serviceName;
  private final InvokedService<S, E> service;
  private final E doneEvent;
  private final E errorEvent;
  private final long timeoutMillis;
  private final E timeoutEvent;
  private final boolean terminal;
  private final boolean healthy;

  private StateDefinition(final Builder<S, E> builder) {
    this.state = builder.state;
    this.entry = builder.entry;
    this.exit = builder.exit;
    this.invariants = Collections.unmodifiableList(new ArrayList<>(builder.invariants));
    this.serviceName = builder.serviceName;
    this.service = builder.service;
    this.doneEvent = builder.doneEvent;
    this.errorEvent = builder.errorEvent;
    this.timeoutMillis = builder.timeoutMillis;
    this.timeoutEvent = builder.timeoutEvent;
    this.terminal = builder.terminal;
    this.healthy = builder.healthy;
  }

  static <S extends Enum<S>, E extends Enum<E>> StateDefinition<S, E> plain(final S state) {
    return new Builder<S, E>(null, state).build();
  }

  public S getState() {
    return state;
  }

  public Optional<StateHook<S, E>> getEntry() {
    return Optional.ofNullable(entry);
  }

  public Optional<StateHook<S, E>> getExit() {
    return Optional.ofNullable(exit);
  }

  public List<StateInvariant<S, E>> getInvariants() {
    return invariants;
  }

  public Optional<InvokedService<S, E>> getService() {
    return Optional.ofNullable(service);
  }

  public String getServiceName() {
    return serviceName;
  }

  public Optional<E> getDoneEvent() {
    return Optional.ofNullable(doneEvent);
  }

  public Optional<E> getErrorEvent() {
    return Optional.ofNullable(errorEvent);
  }

  public long getTimeoutMillis() {
    return timeoutMillis;
  }

  public Optional<E> getTimeoutEvent() {
    return Optional.ofNullable(timeoutEvent);
  }

  public boolean hasTimeout() {
    return timeoutMillis > 0L && timeoutEvent != null;
  }

  public boolean isTerminal() {
    return terminal;
  }

  public boolean isHealthy() {
    return healthy;
  }

  @Override
  public String toString() {
    return "StateDefinition [state=" + state + ", service=" + serviceName + ", doneEvent="
        + doneEvent + ", errorEvent=" + errorEvent + ", timeoutMillis=" + timeoutMillis
        + ", timeoutEvent=" + timeoutEvent + ", terminal=" + terminal + ", healthy=" + healthy
        + "]";
  }

  public final static class Builder<S extends Enum<S>, E extends Enum<E>> {
    private final MachineDefinition.Builder<S, E> parent;
    private final S state;
    private StateHook<S, E> entry;
    private StateHook<S, E> exit;
    private final List<StateInvariant<S, E>> invariants = new ArrayList<>();
    private String serviceName;
    private InvokedService<S, E> service;
    private E doneEvent;
    private E errorEvent;
    private long timeoutMillis;
    private E timeoutEvent;
    private boolean terminal;
    private boolean healthy = true;

    Builder(final MachineDefinition.Builder<S, E> parent, final S state) {
      this.parent = parent;
      this.state = state;
    }

    public Builder<S, E> onEntry(final StateHook<S, E> entry) {
      this.entry = entry;
      return this;
    }

    public Builder<S, E> onExit(final StateHook<S, E> exit) {
      this.exit = exit;
      return this;
    }

    public Builder<S, E> invariant(final String name,
        final Predicate<MachineContext<S, E>> predicate) {
      invariants.add(StateInvariant.of(name, predicate));
      return this;
    }

    /**
     * Starts {@code service} on entry; its result is posted as {@code doneEvent} and its failure as
     * {@code errorEvent}. Either event may be null, in which case that outcome is only logged.
     */
    public Builder<S, E> invoke(final String name, final InvokedService<S, E> service,
        final E doneEvent, final E errorEvent) {
      this.serviceName = name;
      this.service = service;
      this.doneEvent = doneEvent;
      this.errorEvent = errorEvent;
      return this;
    }

    public Builder<S, E> timeout(final long timeoutMillis, final E fallbackEvent) {
      this.timeoutMillis = timeoutMillis;
      this.timeoutEvent = fallbackEvent;
      return this;
    }

    public Builder<S, E> terminal() {
      this.terminal = true;
      return this;
    }

    public Builder<S, E> unhealthy() {
      this.healthy = false;
      return this;
    }

    public MachineDefinition.Builder<S, E> add() {
      parent.addState(build());
      return parent;
    }

    StateDefinition<S, E> build() {
      return new StateDefinition<>(this);
    }
  }
}
