package com.github.fsmhub;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Point-in-time dispatcher counters.
 */
public final class EventStatistics<E extends Enum<E>> {
  private final long total;
  private final long successful;
  private final long failed;
  private final Map<E, Long> countsByType;
  private final int queueDepth;
  private final long headWaitMillis;

  EventStatistics(final long total, final long successful, final long failed,
      final Map<E, Long> countsByType, final int queueDepth, final long headWaitMillis) {
    this.total = total;
    this.successful = successful;
    this.failed = failed;
    this.countsByType = Collections.unmodifiableMap(new LinkedHashMap<>(countsByType));
    this.queueDepth = queueDepth;
    this.headWaitMillis = headWaitMillis;
  }

  public long getTotal() {
    return total;
  }

  public long getSuccessful() {
    return successful;
  }

  public long getFailed() {
    return failed;
  }

  public Map<E, Long> getCountsByType() {
    return countsByType;
  }

  public int getQueueDepth() {
    return queueDepth;
  }

  /**
   * How long the event at the head of the queue has been waiting, 0 when the queue is empty.
   */
  public long getHeadWaitMillis() {
    return headWaitMillis;
  }

  @Override
  public String toString() {
    return "EventStatistics [total=" + total + ", successful=" + successful + ", failed=" + failed
        + ", countsByType=" + countsByType + ", queueDepth=" + queueDepth + ", headWaitMillis="
        + headWaitMillis + "]";
  }
}
