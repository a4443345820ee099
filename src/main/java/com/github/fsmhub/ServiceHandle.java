package com.github.fsmhub;

import java.util.concurrent.Future;
import java.util.concurrent.ScheduledFuture;

/**
 * Cancellable handle over one running invoked service and its timeout timer, tied to the state
 * entry that started it.
 */
final class ServiceHandle {
  private final String serviceName;
  private final long entrySequence;
  private final Future<?> execution;
  private volatile ScheduledFuture<?> timer;

  ServiceHandle(final String serviceName, final long entrySequence, final Future<?> execution) {
    this.serviceName = serviceName;
    this.entrySequence = entrySequence;
    this.execution = execution;
  }

  void setTimer(final ScheduledFuture<?> timer) {
    this.timer = timer;
  }

  String getServiceName() {
    return serviceName;
  }

  long getEntrySequence() {
    return entrySequence;
  }

  /**
   * Interrupts the service if it is still running and disarms its timer.
   * 
   * @return true if the service was still running
   */
  boolean cancel() {
    final ScheduledFuture<?> scheduled = timer;
    if (scheduled != null) {
      scheduled.cancel(false);
    }
    return execution.cancel(true);
  }

  @Override
  public String toString() {
    return "ServiceHandle [serviceName=" + serviceName + ", entrySequence=" + entrySequence
        + ", done=" + execution.isDone() + "]";
  }
}
