package com.github.fsmhub;

/**
 * Side effect run as part of a transition, after the exit hook of the source state and before the
 * new state is committed. Actions of a transition run in their declared order.
 */
@FunctionalInterface
public interface TransitionAction<S extends Enum<S>, E extends Enum<E>> {

  void execute(MachineContext<S, E> context, QueuedEvent<E> event) throws Exception;

}
