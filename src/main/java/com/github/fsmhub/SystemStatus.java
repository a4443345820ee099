package com.github.fsmhub;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Operator-facing summary of the whole hub: supervisor lifecycle plus every registered instance.
 */
public final class SystemStatus {
  private final SystemState supervisorState;
  private final boolean supervisorHealthy;
  private final boolean systemHealthy;
  private final long uptimeMillis;
  private final Map<String, String> instanceStates;
  private final HubStatus hubStatus;

  SystemStatus(final SystemState supervisorState, final boolean supervisorHealthy,
      final boolean systemHealthy, final long uptimeMillis,
      final Map<String, String> instanceStates, final HubStatus hubStatus) {
    this.supervisorState = supervisorState;
    this.supervisorHealthy = supervisorHealthy;
    this.systemHealthy = systemHealthy;
    this.uptimeMillis = uptimeMillis;
    this.instanceStates = Collections.unmodifiableMap(new LinkedHashMap<>(instanceStates));
    this.hubStatus = hubStatus;
  }

  public SystemState getSupervisorState() {
    return supervisorState;
  }

  public boolean isSupervisorHealthy() {
    return supervisorHealthy;
  }

  public boolean isSystemHealthy() {
    return systemHealthy;
  }

  public long getUptimeMillis() {
    return uptimeMillis;
  }

  /**
   * K=instance id, V=current state name.
   */
  public Map<String, String> getInstanceStates() {
    return instanceStates;
  }

  public HubStatus getHubStatus() {
    return hubStatus;
  }

  @Override
  public String toString() {
    return "SystemStatus [supervisorState=" + supervisorState + ", systemHealthy=" + systemHealthy
        + ", uptimeMillis=" + uptimeMillis + ", instanceStates=" + instanceStates + ", "
        + hubStatus + "]";
  }
}
