package com.github.fsmhub.machines;

public enum ArchitectureEvent {
  STEP_APPROVED, STEP_REJECTED, TASK_FAILED, RESTART;
}
