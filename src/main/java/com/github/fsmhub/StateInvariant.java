package com.github.fsmhub;

import java.util.function.Predicate;

/**
 * Named predicate that must hold right after a state is entered.
 */
public final class StateInvariant<S extends Enum<S>, E extends Enum<E>> {
  private final String name;
  private final Predicate<MachineContext<S, E>> predicate;

  private StateInvariant(final String name, final Predicate<MachineContext<S, E>> predicate) {
    this.name = name;
    this.predicate = predicate;
  }

  public static <S extends Enum<S>, E extends Enum<E>> StateInvariant<S, E> of(final String name,
      final Predicate<MachineContext<S, E>> predicate) {
    if (name == null || name.trim().isEmpty()) {
      throw new IllegalArgumentException("Invariant name cannot be null or blank");
    }
    if (predicate == null) {
      throw new IllegalArgumentException("Invariant predicate cannot be null");
    }
    return new StateInvariant<>(name, predicate);
  }

  public String getName() {
    return name;
  }

  /**
   * A predicate that throws counts as a violation.
   */
  public boolean holds(final MachineContext<S, E> context) {
    try {
      return predicate.test(context);
    } catch (RuntimeException exception) {
      return false;
    }
  }

  @Override
  public String toString() {
    return "StateInvariant [name=" + name + "]";
  }
}
