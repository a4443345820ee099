package com.github.fsmhub;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * This class encapsulates all the configuration parameters of a machine instance. Use the
 * {@code MachineConfigurationBuilder} to build it.
 * 
 * Notes:<br>
 * 1. unset capacities, intervals and timeouts fall back to their defaults; negative values are
 * rejected<br>
 * 2. config entries become the read-only metadata of the instance's context; initial values seed
 * its data bag on creation and on every recreate<br>
 * 3. alert thresholds drive the recorder's performance alerts: a single transition slower than
 * twice the average-time threshold raises a slow-transition alert<br>
 */
public final class MachineConfiguration {
  public static final int DEFAULT_CONTEXT_HISTORY_CAPACITY = 100;
  public static final int DEFAULT_VALIDATION_HISTORY_CAPACITY = 1000;
  public static final int DEFAULT_EVENT_HISTORY_CAPACITY = 1000;
  public static final int DEFAULT_TRANSITION_HISTORY_CAPACITY = 10000;
  public static final int DEFAULT_PRIORITY = 5;
  public static final long DEFAULT_POLL_INTERVAL_MILLIS = 10L;
  public static final long DEFAULT_LOCK_ACQUISITION_MILLIS = 100L;
  public static final String DEFAULT_VERSION = "1.0.0";
  public static final long DEFAULT_TRANSITION_TIME_THRESHOLD_MILLIS = 10000L;
  public static final double DEFAULT_ERROR_RATE_THRESHOLD = 0.05;
  public static final int DEFAULT_QUEUE_SIZE_THRESHOLD = 100;
  public static final int DEFAULT_ALERT_HISTORY_CAPACITY = 100;
  public static final long DEFAULT_ALERT_RETENTION_MILLIS = 60L * 60L * 1000L;

  private final DispatchMode dispatchMode;
  private final InvariantMode invariantMode;
  private final int contextHistoryCapacity;
  private final int validationHistoryCapacity;
  private final int eventHistoryCapacity;
  private final int transitionHistoryCapacity;
  private final int defaultPriority;
  private final long pollIntervalMillis;
  private final long lockAcquisitionMillis;
  private final String version;
  private final long transitionTimeThresholdMillis;
  private final double errorRateThreshold;
  private final int queueSizeThreshold;
  private final int alertHistoryCapacity;
  private final long alertRetentionMillis;
  private final Map<String, String> configEntries;
  private final Map<ContextKey<?>, Object> initialValues;

  public DispatchMode getDispatchMode() {
    return dispatchMode;
  }

  public InvariantMode getInvariantMode() {
    return invariantMode;
  }

  public int getContextHistoryCapacity() {
    return contextHistoryCapacity;
  }

  public int getValidationHistoryCapacity() {
    return validationHistoryCapacity;
  }

  public int getEventHistoryCapacity() {
    return eventHistoryCapacity;
  }

  public int getTransitionHistoryCapacity() {
    return transitionHistoryCapacity;
  }

  public int getDefaultPriority() {
    return defaultPriority;
  }

  public long getPollIntervalMillis() {
    return pollIntervalMillis;
  }

  public long getLockAcquisitionMillis() {
    return lockAcquisitionMillis;
  }

  public String getVersion() {
    return version;
  }

  public long getTransitionTimeThresholdMillis() {
    return transitionTimeThresholdMillis;
  }

  public double getErrorRateThreshold() {
    return errorRateThreshold;
  }

  public int getQueueSizeThreshold() {
    return queueSizeThreshold;
  }

  public int getAlertHistoryCapacity() {
    return alertHistoryCapacity;
  }

  public long getAlertRetentionMillis() {
    return alertRetentionMillis;
  }

  public Map<String, String> getConfigEntries() {
    return configEntries;
  }

  public Map<ContextKey<?>, Object> getInitialValues() {
    return initialValues;
  }

  public static MachineConfiguration defaults() {
    try {
      return MachineConfigurationBuilder.newBuilder().build();
    } catch (MachineException exception) {
      throw new IllegalStateException("Default machine configuration is invalid", exception);
    }
  }

  public final static class MachineConfigurationBuilder {
    private DispatchMode dispatchMode = DispatchMode.AUTO_ASYNC;
    private InvariantMode invariantMode = InvariantMode.ATOMIC;
    private int contextHistoryCapacity;
    private int validationHistoryCapacity;
    private int eventHistoryCapacity;
    private int transitionHistoryCapacity;
    private int defaultPriority = DEFAULT_PRIORITY;
    private long pollIntervalMillis;
    private long lockAcquisitionMillis;
    private String version = DEFAULT_VERSION;
    private long transitionTimeThresholdMillis;
    private double errorRateThreshold;
    private int queueSizeThreshold;
    private int alertHistoryCapacity;
    private long alertRetentionMillis;
    private final Map<String, String> configEntries = new LinkedHashMap<>();
    private final Map<ContextKey<?>, Object> initialValues = new LinkedHashMap<>();

    public static MachineConfigurationBuilder newBuilder() {
      return new MachineConfigurationBuilder();
    }

    public MachineConfigurationBuilder dispatchMode(final DispatchMode dispatchMode) {
      this.dispatchMode = dispatchMode;
      return this;
    }

    public MachineConfigurationBuilder invariantMode(final InvariantMode invariantMode) {
      this.invariantMode = invariantMode;
      return this;
    }

    public MachineConfigurationBuilder contextHistoryCapacity(final int contextHistoryCapacity) {
      this.contextHistoryCapacity = contextHistoryCapacity;
      return this;
    }

    public MachineConfigurationBuilder validationHistoryCapacity(
        final int validationHistoryCapacity) {
      this.validationHistoryCapacity = validationHistoryCapacity;
      return this;
    }

    public MachineConfigurationBuilder eventHistoryCapacity(final int eventHistoryCapacity) {
      this.eventHistoryCapacity = eventHistoryCapacity;
      return this;
    }

    public MachineConfigurationBuilder transitionHistoryCapacity(
        final int transitionHistoryCapacity) {
      this.transitionHistoryCapacity = transitionHistoryCapacity;
      return this;
    }

    public MachineConfigurationBuilder defaultPriority(final int defaultPriority) {
      this.defaultPriority = defaultPriority;
      return this;
    }

    public MachineConfigurationBuilder pollIntervalMillis(final long pollIntervalMillis) {
      this.pollIntervalMillis = pollIntervalMillis;
      return this;
    }

    public MachineConfigurationBuilder lockAcquisitionMillis(final long lockAcquisitionMillis) {
      this.lockAcquisitionMillis = lockAcquisitionMillis;
      return this;
    }

    public MachineConfigurationBuilder version(final String version) {
      this.version = version;
      return this;
    }

    public MachineConfigurationBuilder transitionTimeThresholdMillis(
        final long transitionTimeThresholdMillis) {
      this.transitionTimeThresholdMillis = transitionTimeThresholdMillis;
      return this;
    }

    public MachineConfigurationBuilder errorRateThreshold(final double errorRateThreshold) {
      this.errorRateThreshold = errorRateThreshold;
      return this;
    }

    public MachineConfigurationBuilder queueSizeThreshold(final int queueSizeThreshold) {
      this.queueSizeThreshold = queueSizeThreshold;
      return this;
    }

    public MachineConfigurationBuilder alertHistoryCapacity(final int alertHistoryCapacity) {
      this.alertHistoryCapacity = alertHistoryCapacity;
      return this;
    }

    public MachineConfigurationBuilder alertRetentionMillis(final long alertRetentionMillis) {
      this.alertRetentionMillis = alertRetentionMillis;
      return this;
    }

    public MachineConfigurationBuilder configEntry(final String key, final String value) {
      configEntries.put(key, value);
      return this;
    }

    public <T> MachineConfigurationBuilder initialValue(final ContextKey<T> key, final T value) {
      initialValues.put(key, value);
      return this;
    }

    public MachineConfiguration build() throws MachineException {
      final MachineConfiguration config = new MachineConfiguration(this);
      config.validate(this);
      return config;
    }

    private MachineConfigurationBuilder() {}
  }

  private void validate(final MachineConfigurationBuilder builder) throws MachineException {
    StringBuilder messages = new StringBuilder();
    if (dispatchMode == null) {
      messages.append("DispatchMode cannot be null. ");
    }
    if (invariantMode == null) {
      messages.append("InvariantMode cannot be null. ");
    }
    if (builder.contextHistoryCapacity < 0 || builder.validationHistoryCapacity < 0
        || builder.eventHistoryCapacity < 0 || builder.transitionHistoryCapacity < 0) {
      messages.append("History capacities cannot be negative. ");
    }
    if (builder.pollIntervalMillis < 0L || builder.lockAcquisitionMillis < 0L) {
      messages.append("Poll interval and lock acquisition timeout cannot be negative. ");
    }
    if (builder.transitionTimeThresholdMillis < 0L || builder.queueSizeThreshold < 0
        || builder.alertHistoryCapacity < 0 || builder.alertRetentionMillis < 0L) {
      messages.append("Alert thresholds, capacity and retention cannot be negative. ");
    }
    if (builder.errorRateThreshold < 0.0 || builder.errorRateThreshold > 1.0) {
      messages.append("Error rate threshold must be within [0, 1]. ");
    }
    if (defaultPriority < 0) {
      messages.append("Default priority cannot be negative. ");
    }
    if (version == null || version.trim().isEmpty()) {
      messages.append("Version cannot be null or blank. ");
    }
    for (final Map.Entry<ContextKey<?>, Object> entry : initialValues.entrySet()) {
      if (entry.getValue() == null || !entry.getKey().getType().isInstance(entry.getValue())) {
        messages.append("Initial value of ").append(entry.getKey().getName())
            .append(" must be a non-null ").append(entry.getKey().getType().getSimpleName())
            .append(". ");
      }
    }
    if (messages.length() > 0) {
      throw new MachineException(MachineException.Code.INVALID_MACHINE_CONFIG,
          messages.toString());
    }
  }

  @Override
  public String toString() {
    return "MachineConfiguration [dispatchMode=" + dispatchMode + ", invariantMode="
        + invariantMode + ", contextHistoryCapacity=" + contextHistoryCapacity
        + ", validationHistoryCapacity=" + validationHistoryCapacity + ", eventHistoryCapacity="
        + eventHistoryCapacity + ", transitionHistoryCapacity=" + transitionHistoryCapacity
        + ", defaultPriority=" + defaultPriority + ", pollIntervalMillis=" + pollIntervalMillis
        + ", lockAcquisitionMillis=" + lockAcquisitionMillis + ", version=" + version
        + ", transitionTimeThresholdMillis=" + transitionTimeThresholdMillis
        + ", errorRateThreshold=" + errorRateThreshold + ", queueSizeThreshold="
        + queueSizeThreshold + "]";
  }

  private MachineConfiguration(final MachineConfigurationBuilder builder) {
    this.dispatchMode = builder.dispatchMode;
    this.invariantMode = builder.invariantMode;
    this.contextHistoryCapacity = orDefault(builder.contextHistoryCapacity,
        DEFAULT_CONTEXT_HISTORY_CAPACITY);
    this.validationHistoryCapacity = orDefault(builder.validationHistoryCapacity,
        DEFAULT_VALIDATION_HISTORY_CAPACITY);
    this.eventHistoryCapacity = orDefault(builder.eventHistoryCapacity,
        DEFAULT_EVENT_HISTORY_CAPACITY);
    this.transitionHistoryCapacity = orDefault(builder.transitionHistoryCapacity,
        DEFAULT_TRANSITION_HISTORY_CAPACITY);
    this.defaultPriority = builder.defaultPriority;
    this.pollIntervalMillis = builder.pollIntervalMillis <= 0L ? DEFAULT_POLL_INTERVAL_MILLIS
        : builder.pollIntervalMillis;
    this.lockAcquisitionMillis = builder.lockAcquisitionMillis <= 0L
        ? DEFAULT_LOCK_ACQUISITION_MILLIS : builder.lockAcquisitionMillis;
    this.version = builder.version;
    this.transitionTimeThresholdMillis = builder.transitionTimeThresholdMillis <= 0L
        ? DEFAULT_TRANSITION_TIME_THRESHOLD_MILLIS : builder.transitionTimeThresholdMillis;
    this.errorRateThreshold = builder.errorRateThreshold <= 0.0 ? DEFAULT_ERROR_RATE_THRESHOLD
        : builder.errorRateThreshold;
    this.queueSizeThreshold = orDefault(builder.queueSizeThreshold, DEFAULT_QUEUE_SIZE_THRESHOLD);
    this.alertHistoryCapacity = orDefault(builder.alertHistoryCapacity,
        DEFAULT_ALERT_HISTORY_CAPACITY);
    this.alertRetentionMillis = builder.alertRetentionMillis <= 0L
        ? DEFAULT_ALERT_RETENTION_MILLIS : builder.alertRetentionMillis;
    this.configEntries = Collections.unmodifiableMap(new LinkedHashMap<>(builder.configEntries));
    this.initialValues = Collections.unmodifiableMap(new LinkedHashMap<>(builder.initialValues));
  }

  private static int orDefault(final int value, final int defaultValue) {
    return value <= 0 ? defaultValue : value;
  }
}
