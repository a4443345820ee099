package com.github.fsmhub;

/**
 * Events understood by the supervisory system machine.
 */
public enum SystemEvent {
  INITIALIZE, TRANSITION_COMPLETE, PAUSE, RESUME, STOP, ERROR_OCCURRED, RECOVERY_STARTED,
  RECOVERY_COMPLETE, FORCE_SHUTDOWN, HEALTH_CHECK;
}
