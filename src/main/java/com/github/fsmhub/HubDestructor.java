package com.github.fsmhub;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Tears down a hub, its supervisor and every registered instance when the JVM exits.
 */
final class HubDestructor {
  private static final Logger logger = LogManager.getLogger(HubDestructor.class.getSimpleName());

  private final Thread hook;

  HubDestructor(final OrchestrationHub hub) {
    hook = new Thread("hub-destructor-" + hub.getHubId()) {
      @Override
      public void run() {
        hub.shutdown();
      }
    };
    Runtime.getRuntime().addShutdownHook(hook);
    logger.info("Fired up hub destructor for " + hub.getHubId());
  }

  /**
   * Unhooks after an explicit shutdown; a no-op while the JVM is already exiting.
   */
  void disarm() {
    try {
      Runtime.getRuntime().removeShutdownHook(hook);
    } catch (IllegalStateException exiting) {
      logger.debug("JVM is shutting down, leaving hub destructor in place");
    }
  }
}
