package com.github.fsmhub.machines;

/**
 * Stages of a deployment pipeline, in pipeline order, followed by the off-path states.
 */
public enum DeploymentState {
  PIPELINE_SETUP, ENVIRONMENT_PREP, ARTIFACT_BUILD, PRE_DEPLOYMENT_VALIDATION,
  DEPLOYMENT_EXECUTION, POST_DEPLOYMENT_VALIDATION, MONITORING_SETUP, RELEASE_FINALIZATION,
  ROLLBACK, COMPLETE, FAILED;
}
