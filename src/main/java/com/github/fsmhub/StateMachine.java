package com.github.fsmhub;

import java.util.Set;
import java.util.concurrent.TimeUnit;
import java.util.function.Predicate;

/**
 * A live machine instance: one static definition bound to one context.
 * 
 * Notes for users:<br>
 * 1. events that aren't legal in the current state are refused synchronously; guard failures
 * never throw out of the send methods, they show up as false results and in the histories<br>
 * 
 * 2. lifecycle misuse (sending to a shut down machine, lock timeouts) throws
 * {@link MachineException}<br>
 * 
 * 3. reads return consistent point-in-time snapshots<br>
 */
public interface StateMachine<S extends Enum<S>, E extends Enum<E>> extends Supervisable {

  /**
   * Enqueues {@code event} at the default priority.
   * 
   * @return false if the event is not legal in the current state
   */
  boolean sendEvent(E event, Object payload) throws MachineException;

  boolean sendEvent(E event, Object payload, int priority) throws MachineException;

  /**
   * Processes {@code event} on the calling thread, bypassing the queue.
   * 
   * @return true if the event led to a successful transition
   */
  boolean sendEventImmediate(E event, Object payload) throws MachineException;

  S getCurrentState();

  MachineContext<S, E> getContext() throws MachineException;

  /**
   * Blocks until the machine reaches {@code state} or the timeout elapses.
   */
  boolean awaitState(S state, long timeout, TimeUnit unit) throws MachineException;

  String subscribe(Set<E> events, EventListener<E> listener, Predicate<Object> filter,
      boolean once);

  boolean unsubscribe(String subscriptionId);

  MachineDefinition<S, E> getDefinition();

}
