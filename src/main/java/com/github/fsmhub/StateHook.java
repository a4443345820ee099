package com.github.fsmhub;

/**
 * Entry or exit side effect of a state. Hooks run while the instance's write lock is held, so they
 * must be fast and must not block.
 */
@FunctionalInterface
public interface StateHook<S extends Enum<S>, E extends Enum<E>> {

  void apply(MachineContext<S, E> context) throws Exception;

}
