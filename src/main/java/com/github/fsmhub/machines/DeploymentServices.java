package com.github.fsmhub.machines;

import com.github.fsmhub.MachineContext;

/**
 * Domain work behind each deployment stage. Implementations run on service workers with a
 * read-only context snapshot; a report that did not pass fails the stage just like an exception.
 * The defaults pass right away.
 */
public interface DeploymentServices {

  default StageReport runStage(final DeploymentState stage,
      final MachineContext<DeploymentState, DeploymentEvent> context) throws Exception {
    return StageReport.passed(stage);
  }

  default StageReport executeRollback(
      final MachineContext<DeploymentState, DeploymentEvent> context) throws Exception {
    return StageReport.passed(DeploymentState.ROLLBACK);
  }

}
