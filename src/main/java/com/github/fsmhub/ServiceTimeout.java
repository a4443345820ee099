package com.github.fsmhub;

/**
 * Payload of the fallback event posted when an invoked service overruns its state's timeout.
 */
public final class ServiceTimeout {
  private final String state;
  private final String serviceName;
  private final long timeoutMillis;

  public ServiceTimeout(final String state, final String serviceName, final long timeoutMillis) {
    this.state = state;
    this.serviceName = serviceName;
    this.timeoutMillis = timeoutMillis;
  }

  public String getState() {
    return state;
  }

  public String getServiceName() {
    return serviceName;
  }

  public long getTimeoutMillis() {
    return timeoutMillis;
  }

  public String getReason() {
    return String.format("Service %s of state %s timed out after %d millis", serviceName, state,
        timeoutMillis);
  }

  @Override
  public String toString() {
    return "ServiceTimeout [state=" + state + ", serviceName=" + serviceName + ", timeoutMillis="
        + timeoutMillis + "]";
  }
}
