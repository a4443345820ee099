package com.github.fsmhub;

import java.util.function.Predicate;

/**
 * Named, side-effect-free predicate over the pre-transition context that gates a legal transition.
 * Guards must be deterministic: evaluating the same context twice yields the same answer.
 */
public final class TransitionGuard<S extends Enum<S>, E extends Enum<E>> {
  private final String name;
  private final String failureMessage;
  private final Predicate<MachineContext<S, E>> predicate;

  private TransitionGuard(final String name, final String failureMessage,
      final Predicate<MachineContext<S, E>> predicate) {
    this.name = name;
    this.failureMessage = failureMessage;
    this.predicate = predicate;
  }

  public static <S extends Enum<S>, E extends Enum<E>> TransitionGuard<S, E> of(final String name,
      final String failureMessage, final Predicate<MachineContext<S, E>> predicate) {
    if (name == null || name.trim().isEmpty()) {
      throw new IllegalArgumentException("Guard name cannot be null or blank");
    }
    if (predicate == null) {
      throw new IllegalArgumentException("Guard predicate cannot be null");
    }
    return new TransitionGuard<>(name, failureMessage == null ? name + " failed" : failureMessage,
        predicate);
  }

  public String getName() {
    return name;
  }

  public String getFailureMessage() {
    return failureMessage;
  }

  public boolean test(final MachineContext<S, E> context) {
    return predicate.test(context);
  }

  @Override
  public String toString() {
    return "TransitionGuard [name=" + name + "]";
  }
}
