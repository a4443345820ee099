package com.github.fsmhub;

/**
 * Payload for {@link SystemEvent#HEALTH_CHECK}: percentages of CPU and memory in use.
 */
public final class ResourceUsage {
  private final double cpuPercent;
  private final double memoryPercent;

  public ResourceUsage(final double cpuPercent, final double memoryPercent) {
    this.cpuPercent = cpuPercent;
    this.memoryPercent = memoryPercent;
  }

  public double getCpuPercent() {
    return cpuPercent;
  }

  public double getMemoryPercent() {
    return memoryPercent;
  }

  @Override
  public String toString() {
    return "ResourceUsage [cpuPercent=" + cpuPercent + ", memoryPercent=" + memoryPercent + "]";
  }
}
