package com.github.fsmhub;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicBoolean;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.github.fsmhub.HubStatus.CategoryHealth;
import com.github.fsmhub.MachineException.Code;

/**
 * Registry and health aggregator for live machine instances, hosting exactly one supervisory
 * {@link SystemMachine} instance.
 * 
 * Notes for users:<br>
 * 1. the hub is a plain object; create it, pass it around and shut it down. There is no static
 * registry behind it and several hubs can coexist in one process<br>
 * 
 * 2. the hub does not own registered instances: unregistering leaves them running, only
 * {@link #restartInstance(String)} and {@link #shutdown()} stop them<br>
 * 
 * 3. status reads are point-in-time snapshots over a concurrent registry and may race with
 * concurrent registrations<br>
 * 
 * 4. a daemon refreshes heartbeats from instance activity, marks quiet instances inactive and
 * periodically logs the system status<br>
 */
public final class OrchestrationHub {
  private static final Logger logger = LogManager.getLogger(OrchestrationHub.class.getSimpleName());

  private final HubConfiguration config;
  private final MachineInstance<SystemState, SystemEvent> supervisor;
  private final ConcurrentMap<String, RegisteredInstance> registry = new ConcurrentHashMap<>();
  private final AtomicBoolean hubAlive = new AtomicBoolean();
  private final long startedMillis = System.currentTimeMillis();
  private final HubDestructor destructor;
  private HubMonitor monitorDaemon;

  public OrchestrationHub(final HubConfiguration config, final SystemServices services)
      throws MachineException {
    if (config == null) {
      throw new MachineException(Code.INVALID_MACHINE_CONFIG, "HubConfiguration cannot be null");
    }
    this.config = config;
    logInfo("Firing up hub with " + config);
    this.supervisor = SystemMachine.newInstance(config.getSupervisorId(), services,
        config.getSupervisorConfiguration());
    this.destructor = config.getRegisterShutdownHook() ? new HubDestructor(this) : null;
    hubAlive.set(true);
    logInfo("Successfully fired up hub");
  }

  /**
   * Starts the heartbeat daemon and sends {@link SystemEvent#INITIALIZE} to the supervisor.
   * 
   * @return whether the supervisor accepted the event
   */
  public synchronized boolean start() throws MachineException {
    checkAlive();
    if (monitorDaemon == null) {
      monitorDaemon = new HubMonitor();
      monitorDaemon.start();
    }
    return supervisor.sendEvent(SystemEvent.INITIALIZE, null);
  }

  public RegisteredInstance registerInstance(final String id, final String category,
      final String displayName, final Supervisable handle) throws MachineException {
    checkAlive();
    if (id == null || id.trim().isEmpty() || category == null || category.trim().isEmpty()
        || handle == null) {
      throw new MachineException(Code.INVALID_MACHINE_CONFIG,
          "Registration needs an id, a category and a handle");
    }
    if (id.equals(config.getSupervisorId())) {
      throw new MachineException(Code.DUPLICATE_INSTANCE, id + " is reserved for the supervisor");
    }
    final RegisteredInstance entry = new RegisteredInstance(id, category,
        displayName == null ? id : displayName, handle);
    if (registry.putIfAbsent(id, entry) != null) {
      throw new MachineException(Code.DUPLICATE_INSTANCE, "Instance " + id + " is registered");
    }
    logInfo("Registered " + entry);
    return entry;
  }

  /**
   * Drops the registration; the instance itself keeps running.
   */
  public boolean unregisterInstance(final String id) {
    final RegisteredInstance removed = id == null ? null : registry.remove(id);
    if (removed != null) {
      logInfo("Unregistered " + id);
    }
    return removed != null;
  }

  public Optional<RegisteredInstance> lookup(final String id) {
    return Optional.ofNullable(id == null ? null : registry.get(id));
  }

  public List<RegisteredInstance> getRegisteredInstances() {
    return new ArrayList<>(registry.values());
  }

  /**
   * Shuts down the registered instance and puts a fresh one of the same definition, at its initial
   * state with empty history, under the same id.
   */
  public Supervisable restartInstance(final String id) throws MachineException {
    checkAlive();
    final RegisteredInstance existing = id == null ? null : registry.get(id);
    if (existing == null) {
      throw new MachineException(Code.UNKNOWN_INSTANCE, "No instance registered as " + id);
    }
    logInfo("Restarting " + existing);
    existing.getHandle().shutdown();
    final Supervisable fresh = existing.getHandle().recreate();
    final RegisteredInstance replacement = new RegisteredInstance(id, existing.getCategory(),
        existing.getDisplayName(), fresh);
    if (!registry.replace(id, existing, replacement)) {
      fresh.shutdown();
      throw new MachineException(Code.UNKNOWN_INSTANCE,
          "Instance " + id + " was unregistered or replaced during restart");
    }
    logInfo("Successfully restarted " + id + " at " + fresh.getCurrentStateName());
    return fresh;
  }

  public boolean updateHeartbeat(final String id) {
    final RegisteredInstance entry = id == null ? null : registry.get(id);
    if (entry == null) {
      return false;
    }
    entry.heartbeat(System.currentTimeMillis());
    return true;
  }

  public boolean sendSystemEvent(final SystemEvent event, final Object payload)
      throws MachineException {
    checkAlive();
    return supervisor.sendEvent(event, payload);
  }

  public MachineInstance<SystemState, SystemEvent> getSupervisor() {
    return supervisor;
  }

  public String getHubId() {
    return config.getSupervisorId();
  }

  public boolean isAlive() {
    return hubAlive.get();
  }

  /**
   * Supervisor healthy and every registered instance healthy; stops at the first unhealthy one.
   */
  /**
   * Healthy when the supervisor and every registered instance are in healthy states and none of
   * them holds an active critical alert.
   */
  public boolean isSystemHealthy() {
    if (!supervisor.isHealthy() || hasCriticalAlert(supervisor)) {
      return false;
    }
    for (final RegisteredInstance entry : registry.values()) {
      if (!entry.getHandle().isHealthy()) {
        logDebug("Unhealthy instance " + entry.getId());
        return false;
      }
      if (hasCriticalAlert(entry.getHandle())) {
        logDebug("Critical alert on instance " + entry.getId());
        return false;
      }
    }
    return true;
  }

  /**
   * Active alerts of the supervisor and every registered instance.
   */
  public List<PerformanceAlert> getActiveAlerts() {
    final List<PerformanceAlert> active = new ArrayList<>(supervisor.getActiveAlerts());
    for (final RegisteredInstance entry : registry.values()) {
      active.addAll(entry.getHandle().getActiveAlerts());
    }
    return active;
  }

  public HubStatus getStatus() {
    final Map<String, int[]> perCategory = new TreeMap<>();
    int registered = 0;
    int pending = 0;
    int transitions = 0;
    for (final RegisteredInstance entry : registry.values()) {
      registered++;
      final Supervisable handle = entry.getHandle();
      pending += handle.getPendingEvents();
      transitions += handle.getActiveTransitions();
      int[] counts = perCategory.get(entry.getCategory());
      if (counts == null) {
        // total, healthy, active
        counts = new int[3];
        perCategory.put(entry.getCategory(), counts);
      }
      counts[0]++;
      if (handle.isHealthy()) {
        counts[1]++;
      }
      if (entry.isActive()) {
        counts[2]++;
      }
    }
    final Map<String, CategoryHealth> categoryHealth = new LinkedHashMap<>();
    for (final Map.Entry<String, int[]> entry : perCategory.entrySet()) {
      categoryHealth.put(entry.getKey(), new CategoryHealth(entry.getKey(), entry.getValue()[0],
          entry.getValue()[1], entry.getValue()[2]));
    }
    return new HubStatus(registered, categoryHealth, pending, transitions,
        System.currentTimeMillis());
  }

  public SystemStatus getSystemStatus() {
    final Map<String, String> instanceStates = new TreeMap<>();
    for (final RegisteredInstance entry : registry.values()) {
      instanceStates.put(entry.getId(), entry.getHandle().getCurrentStateName());
    }
    return new SystemStatus(supervisor.getCurrentState(), supervisor.isHealthy(),
        isSystemHealthy(), System.currentTimeMillis() - startedMillis, instanceStates,
        getStatus());
  }

  /**
   * Stops the heartbeat daemon, takes the supervisor to SHUTDOWN where the lifecycle allows it,
   * then shuts down the supervisor and every registered instance.
   */
  public void shutdown() {
    if (!hubAlive.compareAndSet(true, false)) {
      logInfo("Hub is already shut down");
      return;
    }
    logInfo("Shutting down hub");
    synchronized (this) {
      if (monitorDaemon != null) {
        monitorDaemon.interrupt();
        monitorDaemon = null;
      }
    }
    stopSupervisor();
    for (final RegisteredInstance entry : registry.values()) {
      entry.getHandle().shutdown();
    }
    registry.clear();
    if (destructor != null) {
      destructor.disarm();
    }
    logInfo("Successfully shut down hub");
  }

  // one heartbeat pass, run by the monitor daemon
  int scanHeartbeats() {
    final long now = System.currentTimeMillis();
    int inactive = 0;
    for (final RegisteredInstance entry : registry.values()) {
      entry.heartbeat(entry.getHandle().getLastActivityMillis());
      if (now - entry.getLastHeartbeatMillis() > config.getInactivityThresholdMillis()) {
        if (entry.isActive()) {
          logWarning(String.format("Instance %s has been quiet for %d millis, marking inactive",
              entry.getId(), now - entry.getLastHeartbeatMillis()));
        }
        entry.markInactive();
        inactive++;
      }
    }
    return inactive;
  }

  /**
   * Re-evaluates the alert thresholds of the supervisor and every registered instance.
   *
   * @return count of alerts newly raised
   */
  int checkAlerts() {
    int raised = supervisor.checkAlerts().size();
    for (final RegisteredInstance entry : registry.values()) {
      raised += entry.getHandle().checkAlerts().size();
    }
    return raised;
  }

  private static boolean hasCriticalAlert(final Supervisable handle) {
    for (final PerformanceAlert alert : handle.getActiveAlerts()) {
      if (alert.isCritical()) {
        return true;
      }
    }
    return false;
  }

  private void stopSupervisor() {
    final SystemState state = supervisor.getCurrentState();
    try {
      if (supervisor.isAlive() && state != SystemState.SHUTDOWN) {
        final SystemEvent stop =
            supervisor.getValidator().validateEvent(state, SystemEvent.STOP) ? SystemEvent.STOP
                : SystemEvent.FORCE_SHUTDOWN;
        if (!supervisor.sendEventImmediate(stop, null)) {
          logWarning("Supervisor could not leave " + state + " cleanly");
        }
      }
    } catch (MachineException exception) {
      logError("Failed to stop supervisor", exception);
    }
    supervisor.shutdown();
  }

  private void checkAlive() throws MachineException {
    if (!hubAlive.get()) {
      throw new MachineException(Code.MACHINE_NOT_ALIVE, "Hub is shut down");
    }
  }

  private void logInfo(final String message) {
    logger.info(new StringBuilder().append("[h:").append(config.getSupervisorId()).append("] ")
        .append(message).toString());
  }

  private void logWarning(final String message) {
    logger.warn(new StringBuilder().append("[h:").append(config.getSupervisorId()).append("] ")
        .append(message).toString());
  }

  private void logError(final String message, final Throwable error) {
    logger.error(new StringBuilder().append("[h:").append(config.getSupervisorId()).append("] ")
        .append(message).toString(), error);
  }

  private void logDebug(final String message) {
    if (logger.isDebugEnabled()) {
      logger.debug(new StringBuilder().append("[h:").append(config.getSupervisorId())
          .append("] ").append(message).toString());
    }
  }

  /**
   * Heartbeat and statistics daemon, one per hub.
   */
  private final class HubMonitor extends Thread {
    private long lastStatsMillis = System.currentTimeMillis();

    private HubMonitor() {
      setName("hub-monitor-" + config.getSupervisorId());
      setDaemon(true);
    }

    @Override
    public void run() {
      while (!isInterrupted()) {
        logDebug("Hub monitor woke up to scan heartbeats");
        final int inactive = scanHeartbeats();
        final int alerts = checkAlerts();
        if (alerts > 0) {
          logWarning(String.format("Raised %d performance alerts", alerts));
        }
        if (System.currentTimeMillis() - lastStatsMillis >= config.getStatsIntervalMillis()) {
          lastStatsMillis = System.currentTimeMillis();
          logInfo(String.format("Hub stats::inactive:%d, %s", inactive, getSystemStatus()));
        }
        try {
          Thread.sleep(config.getHeartbeatIntervalMillis());
        } catch (InterruptedException exception) {
          Thread.currentThread().interrupt();
        }
      }
      logInfo("Successfully shut down hub monitor");
    }
  }
}
