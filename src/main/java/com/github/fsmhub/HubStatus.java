package com.github.fsmhub;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Point-in-time aggregate over the hub registry. Not a locked join: entries registered or removed
 * while the status was being built may or may not show up.
 */
public final class HubStatus {
  private final int registeredCount;
  private final Map<String, CategoryHealth> categoryHealth;
  private final int pendingEvents;
  private final int activeTransitions;
  private final long timestamp;

  HubStatus(final int registeredCount, final Map<String, CategoryHealth> categoryHealth,
      final int pendingEvents, final int activeTransitions, final long timestamp) {
    this.registeredCount = registeredCount;
    this.categoryHealth = Collections.unmodifiableMap(new LinkedHashMap<>(categoryHealth));
    this.pendingEvents = pendingEvents;
    this.activeTransitions = activeTransitions;
    this.timestamp = timestamp;
  }

  public int getRegisteredCount() {
    return registeredCount;
  }

  public Map<String, CategoryHealth> getCategoryHealth() {
    return categoryHealth;
  }

  public int getPendingEvents() {
    return pendingEvents;
  }

  public int getActiveTransitions() {
    return activeTransitions;
  }

  public long getTimestamp() {
    return timestamp;
  }

  @Override
  public String toString() {
    return "HubStatus [registeredCount=" + registeredCount + ", categoryHealth=" + categoryHealth
        + ", pendingEvents=" + pendingEvents + ", activeTransitions=" + activeTransitions + "]";
  }

  public final static class CategoryHealth {
    private final String category;
    private final int total;
    private final int healthy;
    private final int active;

    CategoryHealth(final String category, final int total, final int healthy, final int active) {
      this.category = category;
      this.total = total;
      this.healthy = healthy;
      this.active = active;
    }

    public String getCategory() {
      return category;
    }

    public int getTotal() {
      return total;
    }

    public int getHealthy() {
      return healthy;
    }

    public int getActive() {
      return active;
    }

    public boolean isHealthy() {
      return healthy == total;
    }

    @Override
    public String toString() {
      return "CategoryHealth [category=" + category + ", total=" + total + ", healthy=" + healthy
          + ", active=" + active + "]";
    }
  }
}
