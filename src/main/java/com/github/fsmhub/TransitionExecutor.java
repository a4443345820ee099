package com.github.fsmhub;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

import com.github.fsmhub.MachineException.Code;

/**
 * Applies one transition to one context in a strict order: guards, exit hook, actions, commit,
 * entry hook, invariants. Every step can abort the transition. Only one execution can be in flight
 * per executor; a concurrent call is turned away with {@link Code#TRANSITION_IN_PROGRESS} rather
 * than queued.
 * 
 * With {@link InvariantMode#ATOMIC} the exit hook, actions, commit, entry hook and invariants all
 * run against a staged copy of the context, and the live context only takes the staged values
 * once everything passed. With {@link InvariantMode#COMMIT_THEN_CHECK} they run against the live
 * context and nothing is rolled back.
 */
public final class TransitionExecutor<S extends Enum<S>, E extends Enum<E>> {
  private final MachineDefinition<S, E> definition;
  private final TransitionValidator<S, E> validator;
  private final InvariantMode invariantMode;
  private final MachineLogger logger;

  private final AtomicBoolean inFlight = new AtomicBoolean();
  private final ExecutorMetrics metrics = new ExecutorMetrics();

  public TransitionExecutor(final MachineDefinition<S, E> definition,
      final TransitionValidator<S, E> validator, final InvariantMode invariantMode,
      final MachineLogger logger) {
    this.definition = definition;
    this.validator = validator;
    this.invariantMode = invariantMode;
    this.logger = logger;
  }

  public TransitionExecutionResult<S, E> execute(final TransitionDefinition<S, E> transition,
      final MachineContext<S, E> context, final QueuedEvent<E> event) {
    final long startMillis = System.currentTimeMillis();
    final S from = context.getCurrentState();
    if (!inFlight.compareAndSet(false, true)) {
      logger.warn(String.format("Rejected %s while another transition is executing", transition));
      final TransitionRecord<S, E> record = new TransitionRecord<>(from, transition.getTo(),
          transition.getEvent(), startMillis, 0L, false,
          Code.TRANSITION_IN_PROGRESS.getDescription(), null);
      metrics.rejected.incrementAndGet();
      return new TransitionExecutionResult<>(record, 0, false, Code.TRANSITION_IN_PROGRESS);
    }
    try {
      return executeExclusively(transition, context, event, from, startMillis);
    } finally {
      inFlight.set(false);
    }
  }

  public boolean isInFlight() {
    return inFlight.get();
  }

  public InvariantMode getInvariantMode() {
    return invariantMode;
  }

  public ExecutorMetrics getMetrics() {
    return metrics;
  }

  private TransitionExecutionResult<S, E> executeExclusively(
      final TransitionDefinition<S, E> transition, final MachineContext<S, E> context,
      final QueuedEvent<E> event, final S from, final long startMillis) {
    int actionsRun = 0;
    boolean committed = false;
    Code errorCode = null;
    String error = null;

    // 1. guards
    final ValidationResult<S, E> validation = validator.validate(transition, context);
    if (!validation.isValid()) {
      errorCode = validation.isLegal() ? Code.GUARD_FAILURE : Code.INVALID_EVENT;
      error = validation.isLegal()
          ? String.format("Guards %s failed: %s", validation.getFailedGuards(),
              validation.getReason())
          : validation.getReason();
      return finish(transition, context, from, startMillis, actionsRun, false, errorCode, error);
    }

    final MachineContext<S, E> target =
        invariantMode == InvariantMode.ATOMIC ? context.copy() : context;
    final StateDefinition<S, E> source = definition.getStateDefinition(from);
    final StateDefinition<S, E> destination = definition.getStateDefinition(transition.getTo());
    try {
      // 2. exit hook
      if (!transition.isInternal() && source.getExit().isPresent()) {
        errorCode = Code.HOOK_FAILURE;
        source.getExit().get().apply(target);
      }
      // 3. actions
      errorCode = Code.ACTION_FAILURE;
      for (final TransitionAction<S, E> action : transition.getActions()) {
        action.execute(target, event);
        actionsRun++;
      }
      // 4. commit
      errorCode = null;
      if (transition.isInternal()) {
        target.touch(System.currentTimeMillis());
      } else {
        target.commit(transition.getTo(), System.currentTimeMillis());
        committed = target == context;
      }
      // 5. entry hook
      if (!transition.isInternal() && destination.getEntry().isPresent()) {
        errorCode = Code.HOOK_FAILURE;
        destination.getEntry().get().apply(target);
      }
      errorCode = null;
    } catch (Exception exception) {
      final Code failure = errorCode == null ? Code.UNKNOWN_FAILURE : errorCode;
      error = String.format("%s during %s: %s", failure, transition, exception.getMessage());
      logger.error(error, exception);
      return finish(transition, context, from, startMillis, actionsRun, committed, failure,
          error);
    }

    // 6. invariants
    final List<String> violated = new ArrayList<>();
    for (final StateInvariant<S, E> invariant : destination.getInvariants()) {
      if (!invariant.holds(target)) {
        violated.add(invariant.getName());
      }
    }
    if (!violated.isEmpty()) {
      error = String.format("Invariants %s of %s violated", violated, transition.getTo());
      logger.warn(error + (committed ? ", state stays committed" : ", transition discarded"));
      return finish(transition, context, from, startMillis, actionsRun, committed,
          Code.INVARIANT_VIOLATION, error);
    }

    if (target != context) {
      context.restoreFrom(target);
    }
    return finish(transition, context, from, startMillis, actionsRun,
        !transition.isInternal(), null, null);
  }

  private TransitionExecutionResult<S, E> finish(final TransitionDefinition<S, E> transition,
      final MachineContext<S, E> context, final S from, final long startMillis,
      final int actionsRun, final boolean committed, final Code errorCode, final String error) {
    final long durationMillis = System.currentTimeMillis() - startMillis;
    final boolean success = errorCode == null;
    final TransitionRecord<S, E> record = new TransitionRecord<>(from, transition.getTo(),
        transition.getEvent(), startMillis, durationMillis, success, error,
        context.snapshotData());
    context.appendRecord(record);
    metrics.record(success, durationMillis);
    if (success) {
      logger.info(String.format("Successfully transitioned %s --%s--> %s in %d millis", from,
          transition.getEvent(), transition.getTo(), durationMillis));
    } else {
      logger.info(String.format("Failed to transition %s --%s--> %s, %s", from,
          transition.getEvent(), transition.getTo(), errorCode));
    }
    return new TransitionExecutionResult<>(record, actionsRun, committed, errorCode);
  }

  /**
   * Running executor counters.
   */
  public final static class ExecutorMetrics {
    private final AtomicLong executions = new AtomicLong();
    private final AtomicLong successes = new AtomicLong();
    private final AtomicLong failures = new AtomicLong();
    private final AtomicLong rejected = new AtomicLong();
    private final AtomicLong totalDurationMillis = new AtomicLong();
    private volatile long lastExecutionMillis;

    private void record(final boolean success, final long durationMillis) {
      executions.incrementAndGet();
      if (success) {
        successes.incrementAndGet();
      } else {
        failures.incrementAndGet();
      }
      totalDurationMillis.addAndGet(durationMillis);
      lastExecutionMillis = System.currentTimeMillis();
    }

    public long getExecutions() {
      return executions.get();
    }

    public long getSuccesses() {
      return successes.get();
    }

    public long getFailures() {
      return failures.get();
    }

    /**
     * Calls turned away because another transition was in flight.
     */
    public long getRejected() {
      return rejected.get();
    }

    public double getAverageDurationMillis() {
      final long count = executions.get();
      return count == 0L ? 0.0d : (double) totalDurationMillis.get() / count;
    }

    public long getLastExecutionMillis() {
      return lastExecutionMillis;
    }

    @Override
    public String toString() {
      return "ExecutorMetrics [executions=" + executions + ", successes=" + successes
          + ", failures=" + failures + ", rejected=" + rejected + ", averageDurationMillis="
          + getAverageDurationMillis() + "]";
    }
  }
}
