package com.github.fsmhub;

import java.util.List;

/**
 * Type-erased view of a machine instance, which is all the orchestration hub needs to register,
 * monitor and restart it.
 */
public interface Supervisable {

  String getMachineId();

  String getDefinitionName();

  String getCurrentStateName();

  boolean isHealthy();

  boolean isAlive();

  int getPendingEvents();

  int getActiveTransitions();

  long getLastActivityMillis();

  /**
   * Re-evaluates the instance's performance thresholds.
   *
   * @return the alerts newly raised
   */
  List<PerformanceAlert> checkAlerts();

  List<PerformanceAlert> getActiveAlerts();

  void shutdown();

  /**
   * Fresh instance of the same definition and configuration at its initial state with empty
   * history. The receiver is left untouched.
   */
  Supervisable recreate() throws MachineException;

}
