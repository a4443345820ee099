package com.github.fsmhub;

import java.util.concurrent.TimeUnit;

/**
 * This class encapsulates all the configuration parameters of the orchestration hub. Use the
 * {@code HubConfigurationBuilder} to build it. Unset intervals fall back to their defaults.
 */
public final class HubConfiguration {
  public static final long DEFAULT_HEARTBEAT_INTERVAL_MILLIS = TimeUnit.SECONDS.toMillis(30L);
  public static final long DEFAULT_INACTIVITY_THRESHOLD_MILLIS = TimeUnit.SECONDS.toMillis(120L);
  public static final long DEFAULT_STATS_INTERVAL_MILLIS = TimeUnit.SECONDS.toMillis(300L);
  public static final String DEFAULT_SUPERVISOR_ID = "system-supervisor";

  private final String supervisorId;
  private final long heartbeatIntervalMillis;
  private final long inactivityThresholdMillis;
  private final long statsIntervalMillis;
  private final MachineConfiguration supervisorConfiguration;
  private final boolean registerShutdownHook;

  public String getSupervisorId() {
    return supervisorId;
  }

  public long getHeartbeatIntervalMillis() {
    return heartbeatIntervalMillis;
  }

  public long getInactivityThresholdMillis() {
    return inactivityThresholdMillis;
  }

  public long getStatsIntervalMillis() {
    return statsIntervalMillis;
  }

  public MachineConfiguration getSupervisorConfiguration() {
    return supervisorConfiguration;
  }

  public boolean getRegisterShutdownHook() {
    return registerShutdownHook;
  }

  public static HubConfiguration defaults() {
    try {
      return HubConfigurationBuilder.newBuilder().build();
    } catch (MachineException exception) {
      throw new IllegalStateException("Default hub configuration is invalid", exception);
    }
  }

  public final static class HubConfigurationBuilder {
    private String supervisorId = DEFAULT_SUPERVISOR_ID;
    private long heartbeatIntervalMillis;
    private long inactivityThresholdMillis;
    private long statsIntervalMillis;
    private MachineConfiguration supervisorConfiguration;
    private boolean registerShutdownHook;

    public static HubConfigurationBuilder newBuilder() {
      return new HubConfigurationBuilder();
    }

    public HubConfigurationBuilder supervisorId(final String supervisorId) {
      this.supervisorId = supervisorId;
      return this;
    }

    public HubConfigurationBuilder heartbeatIntervalMillis(final long heartbeatIntervalMillis) {
      this.heartbeatIntervalMillis = heartbeatIntervalMillis;
      return this;
    }

    public HubConfigurationBuilder inactivityThresholdMillis(
        final long inactivityThresholdMillis) {
      this.inactivityThresholdMillis = inactivityThresholdMillis;
      return this;
    }

    public HubConfigurationBuilder statsIntervalMillis(final long statsIntervalMillis) {
      this.statsIntervalMillis = statsIntervalMillis;
      return this;
    }

    public HubConfigurationBuilder supervisorConfiguration(
        final MachineConfiguration supervisorConfiguration) {
      this.supervisorConfiguration = supervisorConfiguration;
      return this;
    }

    public HubConfigurationBuilder registerShutdownHook(final boolean registerShutdownHook) {
      this.registerShutdownHook = registerShutdownHook;
      return this;
    }

    public HubConfiguration build() throws MachineException {
      final HubConfiguration config = new HubConfiguration(this);
      config.validate();
      return config;
    }

    private HubConfigurationBuilder() {}
  }

  private void validate() throws MachineException {
    StringBuilder messages = new StringBuilder();
    if (supervisorId == null || supervisorId.trim().isEmpty()) {
      messages.append("Supervisor id cannot be null or blank. ");
    }
    if (inactivityThresholdMillis < heartbeatIntervalMillis) {
      messages.append("Inactivity threshold cannot be shorter than the heartbeat interval. ");
    }
    if (messages.length() > 0) {
      throw new MachineException(MachineException.Code.INVALID_MACHINE_CONFIG,
          messages.toString());
    }
  }

  @Override
  public String toString() {
    return "HubConfiguration [supervisorId=" + supervisorId + ", heartbeatIntervalMillis="
        + heartbeatIntervalMillis + ", inactivityThresholdMillis=" + inactivityThresholdMillis
        + ", statsIntervalMillis=" + statsIntervalMillis + ", registerShutdownHook="
        + registerShutdownHook + "]";
  }

  private HubConfiguration(final HubConfigurationBuilder builder) {
    this.supervisorId = builder.supervisorId;
    this.heartbeatIntervalMillis = builder.heartbeatIntervalMillis <= 0L
        ? DEFAULT_HEARTBEAT_INTERVAL_MILLIS : builder.heartbeatIntervalMillis;
    this.inactivityThresholdMillis = builder.inactivityThresholdMillis <= 0L
        ? DEFAULT_INACTIVITY_THRESHOLD_MILLIS : builder.inactivityThresholdMillis;
    this.statsIntervalMillis = builder.statsIntervalMillis <= 0L ? DEFAULT_STATS_INTERVAL_MILLIS
        : builder.statsIntervalMillis;
    this.supervisorConfiguration = builder.supervisorConfiguration != null
        ? builder.supervisorConfiguration : MachineConfiguration.defaults();
    this.registerShutdownHook = builder.registerShutdownHook;
  }
}
