package com.github.fsmhub;

/**
 * Processing step a dispatcher hands every dequeued event to; a machine instance plugs its
 * transition logic in here. Throwing marks the dispatch as failed.
 */
@FunctionalInterface
public interface EventHandler<E extends Enum<E>> {

  void handle(QueuedEvent<E> event) throws MachineException;

}
