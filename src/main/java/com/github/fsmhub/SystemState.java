package com.github.fsmhub;

/**
 * Lifecycle states of the supervisory system machine.
 */
public enum SystemState {
  IDLE, INITIALIZING, ACTIVE, SUSPENDED, ERROR, RECOVERING, SHUTDOWN;
}
