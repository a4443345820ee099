package com.github.fsmhub.machines;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import java.util.EnumSet;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import org.junit.Test;

import com.github.fsmhub.DispatchMode;
import com.github.fsmhub.MachineConfiguration;
import com.github.fsmhub.MachineConfiguration.MachineConfigurationBuilder;
import com.github.fsmhub.MachineContext;
import com.github.fsmhub.MachineDefinition;
import com.github.fsmhub.MachineException;
import com.github.fsmhub.MachineInstance;

/**
 * Tests to maintain the sanity and correctness of the deployment pipeline machine.
 */
public class DeploymentPipelineMachineTest {
  static {
    System.setProperty("log4j.configurationFile", "log4j2-test.properties");
  }

  // fails the stages in failing, as many times as failuresLeft allows
  private static final class ScriptedServices implements DeploymentServices {
    private final Set<DeploymentState> failing =
        ConcurrentHashMap.<DeploymentState>newKeySet();
    private final AtomicInteger failuresLeft = new AtomicInteger(Integer.MAX_VALUE);
    private final AtomicInteger rollbacks = new AtomicInteger();

    private ScriptedServices failing(final DeploymentState stage, final int times) {
      failing.add(stage);
      failuresLeft.set(times);
      return this;
    }

    @Override
    public StageReport runStage(final DeploymentState stage,
        final MachineContext<DeploymentState, DeploymentEvent> context) {
      if (failing.contains(stage) && failuresLeft.getAndDecrement() > 0) {
        return StageReport.failed(stage, "health checks red");
      }
      if (stage == DeploymentState.ARTIFACT_BUILD) {
        return new StageReport(stage.name(), true, "shop-2.4.1.jar");
      }
      return StageReport.passed(stage);
    }

    @Override
    public StageReport executeRollback(
        final MachineContext<DeploymentState, DeploymentEvent> context) {
      rollbacks.incrementAndGet();
      return StageReport.passed(DeploymentState.ROLLBACK);
    }
  }

  private static MachineConfiguration config() throws MachineException {
    return MachineConfigurationBuilder.newBuilder().dispatchMode(DispatchMode.AUTO_ASYNC)
        .pollIntervalMillis(5L).build();
  }

  @Test
  public void testStagesRunInOrder() throws MachineException {
    final MachineInstance<DeploymentState, DeploymentEvent> pipeline =
        DeploymentPipelineMachine.newInstance("deploy-1", new ScriptedServices(), config());
    try {
      assertTrue(pipeline.awaitState(DeploymentState.COMPLETE, 5L, TimeUnit.SECONDS));
      final MachineContext<DeploymentState, DeploymentEvent> context = pipeline.getContext();
      assertEquals("shop-2.4.1.jar", context.get(DeploymentPipelineMachine.ARTIFACT_ID).get());
      assertEquals(DeploymentState.RELEASE_FINALIZATION,
          context.get(DeploymentPipelineMachine.LAST_COMPLETED_STAGE).get());
      assertEquals(DeploymentPipelineMachine.STAGES.size(),
          pipeline.getHistoryRecorder().getStateChanges().size());
      assertTrue(pipeline.isHealthy());
      assertFalse(pipeline.sendEvent(DeploymentEvent.RETRY, null));
    } finally {
      pipeline.shutdown();
    }
  }

  @Test
  public void testFailedDeploymentRollsBackAndRecovers() throws MachineException {
    final ScriptedServices services =
        new ScriptedServices().failing(DeploymentState.DEPLOYMENT_EXECUTION, 1);
    final MachineInstance<DeploymentState, DeploymentEvent> pipeline =
        DeploymentPipelineMachine.newInstance("deploy-2", services, config());
    try {
      assertTrue(pipeline.awaitState(DeploymentState.COMPLETE, 5L, TimeUnit.SECONDS));
      assertEquals(1, services.rollbacks.get());
      assertEquals(Integer.valueOf(1),
          pipeline.getContext().get(DeploymentPipelineMachine.ROLLBACKS).get());
      assertEquals(1, pipeline.getHistoryRecorder().query(pipeline.getHistoryRecorder()
          .newQuery().from(DeploymentState.ROLLBACK)
          .to(DeploymentState.PRE_DEPLOYMENT_VALIDATION).build()).size());
    } finally {
      pipeline.shutdown();
    }
  }

  @Test
  public void testRollbackBudgetThenRetry() throws MachineException {
    final ScriptedServices services =
        new ScriptedServices().failing(DeploymentState.POST_DEPLOYMENT_VALIDATION, 3);
    final MachineInstance<DeploymentState, DeploymentEvent> pipeline =
        DeploymentPipelineMachine.newInstance("deploy-3", services, config());
    try {
      assertTrue(pipeline.awaitState(DeploymentState.FAILED, 5L, TimeUnit.SECONDS));
      assertFalse(pipeline.isHealthy());
      assertEquals(DeploymentPipelineMachine.MAX_ROLLBACKS, services.rollbacks.get());
      final MachineContext<DeploymentState, DeploymentEvent> failed = pipeline.getContext();
      assertEquals(DeploymentState.ROLLBACK,
          failed.get(DeploymentPipelineMachine.FAILED_STAGE).get());
      assertTrue(failed.get(DeploymentPipelineMachine.FAILURE_REASON).get()
          .contains("Rollback budget"));

      // failures used up, the retry runs clean
      assertTrue(pipeline.sendEventImmediate(DeploymentEvent.RETRY, null));
      assertTrue(pipeline.awaitState(DeploymentState.COMPLETE, 5L, TimeUnit.SECONDS));
      final MachineContext<DeploymentState, DeploymentEvent> done = pipeline.getContext();
      assertEquals(Integer.valueOf(1), done.get(DeploymentPipelineMachine.RETRIES).get());
      assertFalse(done.contains(DeploymentPipelineMachine.ROLLBACKS));
      assertFalse(done.contains(DeploymentPipelineMachine.FAILURE_REASON));
    } finally {
      pipeline.shutdown();
    }
  }

  @Test
  public void testEarlyStageFailureFailsThePipeline() throws MachineException {
    final MachineInstance<DeploymentState, DeploymentEvent> pipeline =
        DeploymentPipelineMachine.newInstance("deploy-4",
            new ScriptedServices().failing(DeploymentState.ENVIRONMENT_PREP, 1), config());
    try {
      assertTrue(pipeline.awaitState(DeploymentState.FAILED, 5L, TimeUnit.SECONDS));
      final MachineContext<DeploymentState, DeploymentEvent> context = pipeline.getContext();
      assertEquals(DeploymentState.ENVIRONMENT_PREP,
          context.get(DeploymentPipelineMachine.FAILED_STAGE).get());
      assertTrue(context.get(DeploymentPipelineMachine.FAILURE_REASON).get()
          .contains("health checks red"));
      assertFalse(context.contains(DeploymentPipelineMachine.ARTIFACT_ID));
    } finally {
      pipeline.shutdown();
    }
  }

  @Test
  public void testStageTimeoutAndAbort() throws Exception {
    final CountDownLatch release = new CountDownLatch(1);
    final DeploymentServices stuck = new DeploymentServices() {
      @Override
      public StageReport runStage(final DeploymentState stage,
          final MachineContext<DeploymentState, DeploymentEvent> context) throws Exception {
        if (stage == DeploymentState.MONITORING_SETUP) {
          release.await();
        }
        return StageReport.passed(stage);
      }
    };
    final MachineInstance<DeploymentState, DeploymentEvent> timed = new MachineInstance<>(
        "deploy-5", DeploymentPipelineMachine.definition(stuck, 100L), config());
    try {
      assertTrue(timed.awaitState(DeploymentState.FAILED, 5L, TimeUnit.SECONDS));
      final MachineContext<DeploymentState, DeploymentEvent> context = timed.getContext();
      assertEquals(DeploymentState.MONITORING_SETUP,
          context.get(DeploymentPipelineMachine.FAILED_STAGE).get());
      assertTrue(context.get(DeploymentPipelineMachine.FAILURE_REASON).get()
          .contains("timed out"));
    } finally {
      timed.shutdown();
    }

    final MachineInstance<DeploymentState, DeploymentEvent> aborted =
        DeploymentPipelineMachine.newInstance("deploy-6", stuck, config());
    try {
      assertTrue(aborted.awaitState(DeploymentState.MONITORING_SETUP, 5L, TimeUnit.SECONDS));
      assertTrue(aborted.sendEventImmediate(DeploymentEvent.TASK_FAILED, "operator abort"));
      assertEquals(DeploymentState.FAILED, aborted.getCurrentState());
      assertEquals("operator abort",
          aborted.getContext().get(DeploymentPipelineMachine.FAILURE_REASON).get());
    } finally {
      aborted.shutdown();
      release.countDown();
    }
  }

  @Test
  public void testDefinitionShape() throws MachineException {
    final MachineDefinition<DeploymentState, DeploymentEvent> definition =
        DeploymentPipelineMachine.definition(new ScriptedServices());
    assertEquals(DeploymentState.PIPELINE_SETUP, definition.getInitialState());
    assertEquals(DeploymentEvent.TASK_FAILED, definition.getFailureEvent().get());
    assertTrue(definition.getStateDefinition(DeploymentState.COMPLETE).isTerminal());
    assertFalse(definition.getStateDefinition(DeploymentState.FAILED).isHealthy());
    for (final DeploymentState stage : EnumSet.of(DeploymentState.DEPLOYMENT_EXECUTION,
        DeploymentState.POST_DEPLOYMENT_VALIDATION)) {
      assertEquals(DeploymentState.ROLLBACK,
          definition.findTransition(stage, DeploymentEvent.STAGE_FAILED).get().getTo());
    }
    assertEquals(DeploymentState.FAILED, definition
        .findTransition(DeploymentState.ARTIFACT_BUILD, DeploymentEvent.STAGE_FAILED).get()
        .getTo());
    assertEquals(1,
        definition.getStateDefinition(DeploymentState.DEPLOYMENT_EXECUTION).getInvariants().size());
  }
}
