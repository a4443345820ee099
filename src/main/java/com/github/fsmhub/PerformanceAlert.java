package com.github.fsmhub;

/**
 * Alert raised by a machine's history recorder when a transition, its error rate or its event
 * backlog crosses a configured threshold. Critical alerts mark the whole hub unhealthy while
 * they are retained.
 */
public final class PerformanceAlert {
  public enum Type {
    SLOW_TRANSITION, HIGH_ERROR_RATE, SLOW_AVERAGE, QUEUE_BACKLOG;
  }

  public enum Severity {
    LOW, MEDIUM, HIGH, CRITICAL;
  }

  private final String machineId;
  private final Type type;
  private final Severity severity;
  private final String message;
  private final double value;
  private final double threshold;
  private final long timestamp;

  public PerformanceAlert(final String machineId, final Type type, final Severity severity,
      final String message, final double value, final double threshold, final long timestamp) {
    this.machineId = machineId;
    this.type = type;
    this.severity = severity;
    this.message = message;
    this.value = value;
    this.threshold = threshold;
    this.timestamp = timestamp;
  }

  public String getMachineId() {
    return machineId;
  }

  public Type getType() {
    return type;
  }

  public Severity getSeverity() {
    return severity;
  }

  public String getMessage() {
    return message;
  }

  /**
   * The observed metric: millis, a rate in [0, 1] or a queue length depending on the type.
   */
  public double getValue() {
    return value;
  }

  public double getThreshold() {
    return threshold;
  }

  public long getTimestamp() {
    return timestamp;
  }

  public boolean isCritical() {
    return severity == Severity.CRITICAL;
  }

  @Override
  public String toString() {
    return "PerformanceAlert [machineId=" + machineId + ", type=" + type + ", severity="
        + severity + ", message=" + message + ", value=" + value + ", threshold=" + threshold
        + ", timestamp=" + timestamp + "]";
  }
}
