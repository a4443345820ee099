package com.github.fsmhub;

/**
 * Payload for {@link SystemEvent#ERROR_OCCURRED} raised by callers. A critical fault blocks
 * automatic recovery.
 */
public final class SystemFault {
  private final String message;
  private final boolean critical;

  public SystemFault(final String message, final boolean critical) {
    this.message = message;
    this.critical = critical;
  }

  public String getMessage() {
    return message;
  }

  public boolean isCritical() {
    return critical;
  }

  @Override
  public String toString() {
    return "SystemFault [message=" + message + ", critical=" + critical + "]";
  }
}
