package com.github.fsmhub;

/**
 * Work invoked by the supervisory system machine. Every method runs on a service worker with a
 * read-only context snapshot and may block; the defaults succeed right away.
 */
public interface SystemServices {

  default Object initializeSystem(final MachineContext<SystemState, SystemEvent> context)
      throws Exception {
    return "initialized";
  }

  default Object attemptRecovery(final MachineContext<SystemState, SystemEvent> context)
      throws Exception {
    return "recovery-started";
  }

  default Object executeRecovery(final MachineContext<SystemState, SystemEvent> context)
      throws Exception {
    return "recovered";
  }

  default Object performShutdown(final MachineContext<SystemState, SystemEvent> context)
      throws Exception {
    return "shutdown";
  }

}
