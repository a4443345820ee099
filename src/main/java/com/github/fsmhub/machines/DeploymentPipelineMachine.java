package com.github.fsmhub.machines;

import static com.github.fsmhub.machines.DeploymentEvent.RETRY;
import static com.github.fsmhub.machines.DeploymentEvent.ROLLBACK_COMPLETED;
import static com.github.fsmhub.machines.DeploymentEvent.STAGE_COMPLETED;
import static com.github.fsmhub.machines.DeploymentEvent.STAGE_FAILED;
import static com.github.fsmhub.machines.DeploymentEvent.TASK_FAILED;
import static com.github.fsmhub.machines.DeploymentState.ARTIFACT_BUILD;
import static com.github.fsmhub.machines.DeploymentState.COMPLETE;
import static com.github.fsmhub.machines.DeploymentState.DEPLOYMENT_EXECUTION;
import static com.github.fsmhub.machines.DeploymentState.FAILED;
import static com.github.fsmhub.machines.DeploymentState.PIPELINE_SETUP;
import static com.github.fsmhub.machines.DeploymentState.POST_DEPLOYMENT_VALIDATION;
import static com.github.fsmhub.machines.DeploymentState.PRE_DEPLOYMENT_VALIDATION;
import static com.github.fsmhub.machines.DeploymentState.RELEASE_FINALIZATION;
import static com.github.fsmhub.machines.DeploymentState.ROLLBACK;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.TimeUnit;

import com.github.fsmhub.ContextKey;
import com.github.fsmhub.MachineConfiguration;
import com.github.fsmhub.MachineContext;
import com.github.fsmhub.MachineDefinition;
import com.github.fsmhub.MachineException;
import com.github.fsmhub.MachineException.Code;
import com.github.fsmhub.MachineInstance;
import com.github.fsmhub.QueuedEvent;
import com.github.fsmhub.ServiceTimeout;
import com.github.fsmhub.StateDefinition;
import com.github.fsmhub.TransitionGuard;

/**
 * Deployment pipeline running its stages strictly in order:
 * 
 * <pre>
 * PIPELINE_SETUP -> ENVIRONMENT_PREP -> ARTIFACT_BUILD -> PRE_DEPLOYMENT_VALIDATION
 *   -> DEPLOYMENT_EXECUTION -> POST_DEPLOYMENT_VALIDATION -> MONITORING_SETUP
 *   -> RELEASE_FINALIZATION -> COMPLETE (terminal)
 * DEPLOYMENT_EXECUTION | POST_DEPLOYMENT_VALIDATION -- STAGE_FAILED --> ROLLBACK
 * ROLLBACK -- ROLLBACK_COMPLETED --> PRE_DEPLOYMENT_VALIDATION
 * any other stage failure, or TASK_FAILED -> FAILED -- RETRY --> PIPELINE_SETUP
 * </pre>
 * 
 * Notes for users:<br>
 * 1. every stage invokes {@link DeploymentServices#runStage}; a report that did not pass fails the
 * stage<br>
 * 2. a deployment may be rolled back {@value #MAX_ROLLBACKS} times and retried
 * {@value #MAX_RETRIES} times<br>
 */
public final class DeploymentPipelineMachine {
  public static final String NAME = "deployment-pipeline";
  public static final int MAX_ROLLBACKS = 2;
  public static final int MAX_RETRIES = 3;
  public static final long DEFAULT_STAGE_TIMEOUT_MILLIS = TimeUnit.MINUTES.toMillis(10L);

  public static final List<DeploymentState> STAGES = Collections.unmodifiableList(
      Arrays.asList(PIPELINE_SETUP, DeploymentState.ENVIRONMENT_PREP, ARTIFACT_BUILD,
          PRE_DEPLOYMENT_VALIDATION, DEPLOYMENT_EXECUTION, POST_DEPLOYMENT_VALIDATION,
          DeploymentState.MONITORING_SETUP, RELEASE_FINALIZATION));

  public static final ContextKey<DeploymentState> LAST_COMPLETED_STAGE =
      ContextKey.of("lastCompletedStage", DeploymentState.class);
  public static final ContextKey<String> ARTIFACT_ID = ContextKey.of("artifactId", String.class);
  public static final ContextKey<Integer> ROLLBACKS = ContextKey.of("rollbacks", Integer.class);
  public static final ContextKey<Integer> RETRIES = ContextKey.of("retries", Integer.class);
  public static final ContextKey<String> FAILURE_REASON =
      ContextKey.of("failureReason", String.class);
  public static final ContextKey<DeploymentState> FAILED_STAGE =
      ContextKey.of("failedStage", DeploymentState.class);

  public static final TransitionGuard<DeploymentState, DeploymentEvent> PREVIOUS_STAGE_COMPLETED =
      TransitionGuard.of("previousStageCompleted", "Stages must complete in pipeline order",
          context -> {
            final int index = STAGES.indexOf(context.getCurrentState());
            if (index <= 0) {
              return !context.contains(LAST_COMPLETED_STAGE);
            }
            return context.getOrDefault(LAST_COMPLETED_STAGE, null) == STAGES.get(index - 1);
          });
  public static final TransitionGuard<DeploymentState, DeploymentEvent> WITHIN_ROLLBACK_BUDGET =
      TransitionGuard.of("withinRollbackBudget", "Rollback budget exhausted",
          context -> context.getOrDefault(ROLLBACKS, 0) < MAX_ROLLBACKS);
  public static final TransitionGuard<DeploymentState, DeploymentEvent> CAN_RETRY =
      TransitionGuard.of("canRetry", "Retry budget exhausted",
          context -> context.getOrDefault(RETRIES, 0) < MAX_RETRIES);

  private DeploymentPipelineMachine() {}

  public static MachineDefinition<DeploymentState, DeploymentEvent> definition(
      final DeploymentServices services) throws MachineException {
    return definition(services, DEFAULT_STAGE_TIMEOUT_MILLIS);
  }

  public static MachineDefinition<DeploymentState, DeploymentEvent> definition(
      final DeploymentServices services, final long stageTimeoutMillis) throws MachineException {
    if (services == null) {
      throw new MachineException(Code.INVALID_MACHINE_DEFINITION,
          "DeploymentServices cannot be null");
    }
    final MachineDefinition.Builder<DeploymentState, DeploymentEvent> builder =
        MachineDefinition.newBuilder(NAME, DeploymentState.class, DeploymentEvent.class);
    builder.initialState(PIPELINE_SETUP).failureEvent(TASK_FAILED);

    for (int index = 0; index < STAGES.size(); index++) {
      final DeploymentState stage = STAGES.get(index);
      final DeploymentState next = index + 1 < STAGES.size() ? STAGES.get(index + 1) : COMPLETE;
      final StateDefinition.Builder<DeploymentState, DeploymentEvent> state = builder.state(stage)
          .invoke("run" + stage.name(), context -> passed(services.runStage(stage, context)),
              STAGE_COMPLETED, STAGE_FAILED)
          .timeout(stageTimeoutMillis, STAGE_FAILED);
      if (stage == DEPLOYMENT_EXECUTION) {
        state.invariant("artifactBuilt", context -> context.contains(ARTIFACT_ID));
      }
      state.add();
      builder.transition(stage, STAGE_COMPLETED, next).guard(PREVIOUS_STAGE_COMPLETED)
          .action((context, event) -> completeStage(stage, context, event)).add();
      final boolean rollsBack =
          stage == DEPLOYMENT_EXECUTION || stage == POST_DEPLOYMENT_VALIDATION;
      builder.transition(stage, STAGE_FAILED, rollsBack ? ROLLBACK : FAILED)
          .action(DeploymentPipelineMachine::recordFailure).add();
      builder.transition(stage, TASK_FAILED, FAILED)
          .action(DeploymentPipelineMachine::recordFailure).add();
    }
    builder.state(ROLLBACK)
        .invoke("executeRollback", context -> {
          if (context.getOrDefault(ROLLBACKS, 0) >= MAX_ROLLBACKS) {
            throw new MachineException(Code.SERVICE_FAILURE,
                "Rollback budget of " + MAX_ROLLBACKS + " exhausted");
          }
          return passed(services.executeRollback(context));
        }, ROLLBACK_COMPLETED, STAGE_FAILED)
        .timeout(stageTimeoutMillis, STAGE_FAILED).add();
    builder.transition(ROLLBACK, ROLLBACK_COMPLETED, PRE_DEPLOYMENT_VALIDATION)
        .guard(WITHIN_ROLLBACK_BUDGET)
        .action((context, event) -> {
          context.put(ROLLBACKS, context.getOrDefault(ROLLBACKS, 0) + 1);
          context.put(LAST_COMPLETED_STAGE, ARTIFACT_BUILD);
        }).add();
    builder.transition(ROLLBACK, STAGE_FAILED, FAILED)
        .action(DeploymentPipelineMachine::recordFailure).add();
    builder.transition(ROLLBACK, TASK_FAILED, FAILED)
        .action(DeploymentPipelineMachine::recordFailure).add();

    builder.state(COMPLETE).terminal().add();
    builder.state(FAILED).unhealthy().add();
    builder.transition(FAILED, RETRY, PIPELINE_SETUP).guard(CAN_RETRY)
        .action((context, event) -> {
          context.put(RETRIES, context.getOrDefault(RETRIES, 0) + 1);
          context.remove(LAST_COMPLETED_STAGE);
          context.remove(ARTIFACT_ID);
          context.remove(ROLLBACKS);
          context.remove(FAILURE_REASON);
          context.remove(FAILED_STAGE);
        }).add();
    return builder.build();
  }

  public static MachineInstance<DeploymentState, DeploymentEvent> newInstance(
      final String machineId, final DeploymentServices services, final MachineConfiguration config)
      throws MachineException {
    return new MachineInstance<>(machineId, definition(services), config);
  }

  private static StageReport passed(final StageReport report) throws MachineException {
    if (report == null) {
      throw new MachineException(Code.SERVICE_FAILURE, "Stage returned no report");
    }
    if (!report.isPassed()) {
      throw new MachineException(Code.SERVICE_FAILURE,
          "Stage " + report.getStage() + " failed: " + report.getMessage());
    }
    return report;
  }

  private static void completeStage(final DeploymentState stage,
      final MachineContext<DeploymentState, DeploymentEvent> context,
      final QueuedEvent<DeploymentEvent> event) {
    context.put(LAST_COMPLETED_STAGE, stage);
    if (stage == ARTIFACT_BUILD) {
      final String artifact = event == null ? null
          : event.payload(StageReport.class).map(StageReport::getMessage).orElse(null);
      context.put(ARTIFACT_ID, artifact == null ? stage.name() : artifact);
    }
  }

  private static void recordFailure(final MachineContext<DeploymentState, DeploymentEvent> context,
      final QueuedEvent<DeploymentEvent> event) {
    final Object payload = event == null ? null : event.getPayload();
    String reason = "Unknown failure";
    if (payload instanceof ServiceTimeout) {
      reason = ((ServiceTimeout) payload).getReason();
    } else if (payload instanceof Throwable) {
      reason = String.valueOf(((Throwable) payload).getMessage());
    } else if (payload != null) {
      reason = payload.toString();
    }
    context.put(FAILED_STAGE, context.getCurrentState());
    context.put(FAILURE_REASON, reason);
  }
}
