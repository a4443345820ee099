package com.github.fsmhub;

import java.util.Optional;

/**
 * Observer callback for subscriptions; listeners sit outside the transition path.
 */
@FunctionalInterface
public interface EventListener<E extends Enum<E>> {

  /**
   * Called for every processed event the subscription matches.
   * 
   * @param failure why the machine refused or failed the event, empty when it was handled
   */
  void onEvent(QueuedEvent<E> event, Optional<String> failure) throws Exception;

}
