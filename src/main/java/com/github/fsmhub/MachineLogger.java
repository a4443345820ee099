package com.github.fsmhub;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Machine-scoped logger handed to every component of a machine instance at construction. Messages
 * are prefixed with {@code [m:<machineId>][c:<component>]}.
 */
public final class MachineLogger {
  private final Logger logger;
  private final String prefix;

  private MachineLogger(final Logger logger, final String machineId, final String component) {
    this.logger = logger;
    this.prefix = new StringBuilder().append("[m:").append(machineId).append("][c:")
        .append(component).append("] ").toString();
  }

  public static MachineLogger forComponent(final Class<?> component, final String machineId) {
    return new MachineLogger(LogManager.getLogger(component.getSimpleName()), machineId,
        component.getSimpleName());
  }

  public void error(final String message) {
    logger.error(prefix + message);
  }

  public void error(final String message, final Throwable error) {
    logger.error(prefix + message, error);
  }

  public void warn(final String message) {
    logger.warn(prefix + message);
  }

  public void info(final String message) {
    logger.info(prefix + message);
  }

  public void debug(final String message) {
    if (logger.isDebugEnabled()) {
      logger.debug(prefix + message);
    }
  }

  public boolean isDebugEnabled() {
    return logger.isDebugEnabled();
  }
}
