package com.github.fsmhub;

/**
 * Hub registry entry. The hub holds the handle without owning it: the instance lives until someone
 * shuts it down.
 */
public final class RegisteredInstance {
  private final String id;
  private final String category;
  private final String displayName;
  private final Supervisable handle;
  private final long registeredMillis = System.currentTimeMillis();
  private volatile long lastHeartbeatMillis = registeredMillis;
  private volatile boolean active = true;

  RegisteredInstance(final String id, final String category, final String displayName,
      final Supervisable handle) {
    this.id = id;
    this.category = category;
    this.displayName = displayName;
    this.handle = handle;
  }

  public String getId() {
    return id;
  }

  public String getCategory() {
    return category;
  }

  public String getDisplayName() {
    return displayName;
  }

  public Supervisable getHandle() {
    return handle;
  }

  public long getRegisteredMillis() {
    return registeredMillis;
  }

  public long getLastHeartbeatMillis() {
    return lastHeartbeatMillis;
  }

  /**
   * False once the instance went quiet for longer than the hub's inactivity threshold.
   */
  public boolean isActive() {
    return active;
  }

  void heartbeat(final long timestampMillis) {
    if (timestampMillis > lastHeartbeatMillis) {
      lastHeartbeatMillis = timestampMillis;
      active = true;
    }
  }

  void markInactive() {
    active = false;
  }

  @Override
  public String toString() {
    return "RegisteredInstance [id=" + id + ", category=" + category + ", displayName="
        + displayName + ", state=" + handle.getCurrentStateName() + ", healthy="
        + handle.isHealthy() + ", active=" + active + "]";
  }
}
