package com.github.fsmhub;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Decides whether a transition may fire. Table lookups need no context; guard evaluation runs every
 * guard in order against the pre-transition context and collects all failures. Apart from the
 * bounded validation history kept for diagnostics, nothing here has side effects.
 */
public final class TransitionValidator<S extends Enum<S>, E extends Enum<E>> {
  private static final int TOP_FAILURE_REASONS = 5;

  private final MachineDefinition<S, E> definition;
  private final MachineLogger logger;
  private final BoundedHistory<ValidationResult<S, E>> validationHistory;

  // K=event, V=guards applied to every transition on that event
  private final ConcurrentMap<E, List<TransitionGuard<S, E>>> registeredGuards =
      new ConcurrentHashMap<>();

  private final AtomicLong validations = new AtomicLong();
  private final AtomicLong rejections = new AtomicLong();

  public TransitionValidator(final MachineDefinition<S, E> definition,
      final int validationHistoryCapacity, final MachineLogger logger) {
    this.definition = definition;
    this.logger = logger;
    this.validationHistory = new BoundedHistory<>(validationHistoryCapacity);
    for (final TransitionDefinition<S, E> transition : definition.getTransitions()) {
      for (final TransitionGuard<S, E> guard : definition.getEventGuards(transition.getEvent())) {
        registerGuard(transition.getEvent(), guard);
      }
    }
  }

  /**
   * Pure table check, no context involved.
   */
  public boolean isValidTransition(final S from, final S to, final E event) {
    return definition.findTransition(from, event).map(t -> t.getTo() == to).orElse(false);
  }

  /**
   * Whether {@code event} is legal in {@code currentState} regardless of guard outcomes.
   */
  public boolean validateEvent(final S currentState, final E event) {
    if (currentState == null || event == null) {
      return false;
    }
    if (definition.getStateDefinition(currentState).isTerminal()) {
      return false;
    }
    return definition.findTransition(currentState, event).isPresent();
  }

  public GuardEvaluation evaluateGuards(final List<TransitionGuard<S, E>> guards,
      final MachineContext<S, E> context) {
    final List<String> failed = new ArrayList<>();
    final List<String> messages = new ArrayList<>();
    for (final TransitionGuard<S, E> guard : guards) {
      boolean passed;
      try {
        passed = guard.test(context);
      } catch (RuntimeException exception) {
        logger.warn(String.format("Guard %s threw, treating it as failed: %s", guard.getName(),
            exception.getMessage()));
        passed = false;
      }
      if (!passed) {
        failed.add(guard.getName());
        messages.add(guard.getFailureMessage());
      }
    }
    return new GuardEvaluation(failed, messages);
  }

  /**
   * Full decision for one transition against the live context, recorded in the validation history.
   */
  public ValidationResult<S, E> validate(final TransitionDefinition<S, E> transition,
      final MachineContext<S, E> context) {
    final S current = context.getCurrentState();
    final ValidationResult<S, E> result;
    if (current != transition.getFrom()
        || !isValidTransition(transition.getFrom(), transition.getTo(), transition.getEvent())) {
      result = new ValidationResult<>(current, transition.getTo(), transition.getEvent(), false,
          Collections.<String>emptyList(), String.format("No transition %s --%s--> %s", current,
              transition.getEvent(), transition.getTo()),
          System.currentTimeMillis());
    } else {
      final List<TransitionGuard<S, E>> guards =
          new ArrayList<>(getRegisteredGuards(transition.getEvent()));
      guards.addAll(transition.getGuards());
      final GuardEvaluation evaluation = evaluateGuards(guards, context);
      final String reason = evaluation.isValid() ? "Transition allowed"
          : String.join("; ", evaluation.getFailureMessages());
      result = new ValidationResult<>(current, transition.getTo(), transition.getEvent(), true,
          evaluation.getFailedGuards(), reason, System.currentTimeMillis());
    }
    return record(result);
  }

  /**
   * Looks up the declared {@code from --event--> to} transition and validates it against the
   * context. An undeclared transition is recorded as illegal.
   */
  public ValidationResult<S, E> validateTransition(final S from, final S to, final E event,
      final MachineContext<S, E> context) {
    final Optional<TransitionDefinition<S, E>> transition = from == null || event == null
        ? Optional.<TransitionDefinition<S, E>>empty()
        : definition.findTransition(from, event).filter(t -> t.getTo() == to);
    if (transition.isPresent()) {
      return validate(transition.get(), context);
    }
    return record(new ValidationResult<>(from, to, event, false, Collections.<String>emptyList(),
        String.format("No transition %s --%s--> %s", from, event, to),
        System.currentTimeMillis()));
  }

  private ValidationResult<S, E> record(final ValidationResult<S, E> result) {
    validations.incrementAndGet();
    if (!result.isValid()) {
      rejections.incrementAndGet();
      logger.debug("Rejected " + result);
    }
    validationHistory.add(result);
    return result;
  }

  public void registerGuard(final E event, final TransitionGuard<S, E> guard) {
    if (event == null || guard == null) {
      throw new IllegalArgumentException("Event and guard cannot be null");
    }
    List<TransitionGuard<S, E>> guards = registeredGuards.get(event);
    if (guards == null) {
      registeredGuards.putIfAbsent(event, new CopyOnWriteArrayList<TransitionGuard<S, E>>());
      guards = registeredGuards.get(event);
    }
    for (final TransitionGuard<S, E> existing : guards) {
      if (existing.getName().equals(guard.getName())) {
        guards.remove(existing);
      }
    }
    guards.add(guard);
  }

  public boolean removeGuard(final E event, final String guardName) {
    final List<TransitionGuard<S, E>> guards = registeredGuards.get(event);
    if (guards == null) {
      return false;
    }
    for (final TransitionGuard<S, E> existing : guards) {
      if (existing.getName().equals(guardName)) {
        return guards.remove(existing);
      }
    }
    return false;
  }

  public List<TransitionGuard<S, E>> getRegisteredGuards(final E event) {
    final List<TransitionGuard<S, E>> guards = registeredGuards.get(event);
    return guards == null ? Collections.<TransitionGuard<S, E>>emptyList()
        : new ArrayList<>(guards);
  }

  /**
   * Oldest first.
   */
  public List<ValidationResult<S, E>> getValidationHistory() {
    return validationHistory.toList();
  }

  public void clearHistory() {
    validationHistory.clear();
  }

  public ValidationStatistics getStatistics() {
    final Map<String, Long> reasonCounts = new HashMap<>();
    for (final ValidationResult<S, E> result : validationHistory.toList()) {
      if (!result.isValid()) {
        Long count = reasonCounts.get(result.getReason());
        reasonCounts.put(result.getReason(), count == null ? 1L : count + 1L);
      }
    }
    final List<FailureCount> topReasons = new ArrayList<>();
    for (final Map.Entry<String, Long> entry : reasonCounts.entrySet()) {
      topReasons.add(new FailureCount(entry.getKey(), entry.getValue()));
    }
    Collections.sort(topReasons, (left, right) -> {
      final int byCount = Long.compare(right.count, left.count);
      return byCount != 0 ? byCount : left.reason.compareTo(right.reason);
    });
    final long total = validations.get();
    final long failed = rejections.get();
    return new ValidationStatistics(total, total - failed, failed,
        topReasons.subList(0, Math.min(TOP_FAILURE_REASONS, topReasons.size())));
  }

  /**
   * Running validation counters plus the most frequent rejection reasons still in history.
   */
  public final static class ValidationStatistics {
    private final long total;
    private final long successes;
    private final long failures;
    private final List<FailureCount> topFailureReasons;

    private ValidationStatistics(final long total, final long successes, final long failures,
        final List<FailureCount> topFailureReasons) {
      this.total = total;
      this.successes = successes;
      this.failures = failures;
      this.topFailureReasons = Collections.unmodifiableList(new ArrayList<>(topFailureReasons));
    }

    public long getTotal() {
      return total;
    }

    public long getSuccesses() {
      return successes;
    }

    public long getFailures() {
      return failures;
    }

    public double getSuccessRate() {
      return total == 0L ? 0.0d : (double) successes / total;
    }

    public double getFailureRate() {
      return total == 0L ? 0.0d : (double) failures / total;
    }

    public List<FailureCount> getTopFailureReasons() {
      return topFailureReasons;
    }

    @Override
    public String toString() {
      return "ValidationStatistics [total=" + total + ", successes=" + successes + ", failures="
          + failures + ", failureRate=" + getFailureRate() + ", topFailureReasons="
          + topFailureReasons + "]";
    }
  }

  public final static class FailureCount {
    private final String reason;
    private final long count;

    private FailureCount(final String reason, final long count) {
      this.reason = reason;
      this.count = count;
    }

    public String getReason() {
      return reason;
    }

    public long getCount() {
      return count;
    }

    @Override
    public String toString() {
      return reason + "=" + count;
    }
  }
}
