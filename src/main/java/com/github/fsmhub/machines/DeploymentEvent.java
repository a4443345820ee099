package com.github.fsmhub.machines;

public enum DeploymentEvent {
  // stage service succeeded
  STAGE_COMPLETED,
  // stage service failed or reported failure
  STAGE_FAILED,
  ROLLBACK_COMPLETED,
  // external abort, also raised on invariant violations
  TASK_FAILED,
  // FAILED -> PIPELINE_SETUP
  RETRY;
}
