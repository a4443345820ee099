package com.github.fsmhub.machines;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import java.util.Arrays;
import java.util.Deque;
import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.ConcurrentLinkedDeque;
import java.util.concurrent.TimeUnit;

import org.junit.Test;

import com.github.fsmhub.DispatchMode;
import com.github.fsmhub.MachineConfiguration;
import com.github.fsmhub.MachineConfiguration.MachineConfigurationBuilder;
import com.github.fsmhub.MachineContext;
import com.github.fsmhub.MachineException;
import com.github.fsmhub.MachineInstance;

/**
 * Tests to maintain the sanity and correctness of the architecture review machine.
 */
public class ArchitectureReviewMachineTest {
  static {
    System.setProperty("log4j.configurationFile", "log4j2-test.properties");
  }

  // hands out queued scores per step, 100 once a step's queue runs dry
  private static final class ScriptedReviews implements ArchitectureServices {
    private final Map<ArchitectureState, Deque<Integer>> scores =
        new EnumMap<>(ArchitectureState.class);

    private ScriptedReviews scores(final ArchitectureState step, final Integer... queued) {
      scores.put(step, new ConcurrentLinkedDeque<>(Arrays.asList(queued)));
      return this;
    }

    @Override
    public ReviewReport review(final ArchitectureState step,
        final MachineContext<ArchitectureState, ArchitectureEvent> context) {
      final Deque<Integer> queued = scores.get(step);
      final Integer score = queued == null ? null : queued.poll();
      return new ReviewReport(step, score == null ? 100 : score, "scripted");
    }
  }

  private static MachineConfiguration config() throws MachineException {
    return MachineConfigurationBuilder.newBuilder().dispatchMode(DispatchMode.AUTO_ASYNC)
        .pollIntervalMillis(5L).build();
  }

  @Test
  public void testCleanReview() throws MachineException {
    final MachineInstance<ArchitectureState, ArchitectureEvent> review =
        ArchitectureReviewMachine.newInstance("arch-1",
            new ScriptedReviews().scores(ArchitectureState.QUALITY_ATTRIBUTE_ANALYSIS, 75)
                .scores(ArchitectureState.COMPLIANCE_VALIDATION, 90),
            config());
    try {
      assertTrue(review.awaitState(ArchitectureState.COMPLETE, 5L, TimeUnit.SECONDS));
      final MachineContext<ArchitectureState, ArchitectureEvent> context = review.getContext();
      assertEquals(Integer.valueOf(75), context.get(ArchitectureReviewMachine.QUALITY_SCORE).get());
      assertEquals(Integer.valueOf(90),
          context.get(ArchitectureReviewMachine.COMPLIANCE_SCORE).get());
      assertFalse(context.contains(ArchitectureReviewMachine.REVISIONS));
      assertEquals(ArchitectureReviewMachine.STEPS.size(),
          review.getHistoryRecorder().getStateChanges().size());
    } finally {
      review.shutdown();
    }
  }

  @Test
  public void testRejectedDesignGoesBackToRequirements() throws MachineException {
    final MachineInstance<ArchitectureState, ArchitectureEvent> review =
        ArchitectureReviewMachine.newInstance("arch-2",
            new ScriptedReviews().scores(ArchitectureState.SYSTEM_DESIGN, 55), config());
    try {
      assertTrue(review.awaitState(ArchitectureState.COMPLETE, 5L, TimeUnit.SECONDS));
      assertEquals(Integer.valueOf(1),
          review.getContext().get(ArchitectureReviewMachine.REVISIONS).get());
      assertTrue(review.getContext().get(ArchitectureReviewMachine.REJECTION_REASON).get()
          .contains("scored 55"));
      assertEquals(2, review.getHistoryRecorder().query(review.getHistoryRecorder().newQuery()
          .from(ArchitectureState.REQUIREMENTS_ANALYSIS).to(ArchitectureState.SYSTEM_DESIGN)
          .build()).size());
    } finally {
      review.shutdown();
    }
  }

  @Test
  public void testQualityIssuesTriggerOptimization() throws MachineException {
    final MachineInstance<ArchitectureState, ArchitectureEvent> review =
        ArchitectureReviewMachine.newInstance("arch-3",
            new ScriptedReviews().scores(ArchitectureState.QUALITY_ATTRIBUTE_ANALYSIS, 40),
            config());
    try {
      assertTrue(review.awaitState(ArchitectureState.COMPLETE, 5L, TimeUnit.SECONDS));
      assertEquals(Integer.valueOf(1),
          review.getContext().get(ArchitectureReviewMachine.OPTIMIZATION_ROUNDS).get());
      assertEquals(1, review.getHistoryRecorder().getIncomingTransitions(
          ArchitectureState.ARCHITECTURE_OPTIMIZATION).size());
    } finally {
      review.shutdown();
    }
  }

  @Test
  public void testOptimizationBudgetThenRestart() throws MachineException {
    final MachineInstance<ArchitectureState, ArchitectureEvent> review =
        ArchitectureReviewMachine.newInstance("arch-4", new ScriptedReviews()
            .scores(ArchitectureState.COMPLIANCE_VALIDATION, 60, 70, 80, 84), config());
    try {
      assertTrue(review.awaitState(ArchitectureState.FAILED, 5L, TimeUnit.SECONDS));
      assertFalse(review.isHealthy());
      final MachineContext<ArchitectureState, ArchitectureEvent> failed = review.getContext();
      assertEquals(Integer.valueOf(ArchitectureReviewMachine.MAX_OPTIMIZATION_ROUNDS),
          failed.get(ArchitectureReviewMachine.OPTIMIZATION_ROUNDS).get());
      assertTrue(failed.get(ArchitectureReviewMachine.REJECTION_REASON).get()
          .contains("Optimization budget"));

      assertTrue(review.sendEventImmediate(ArchitectureEvent.RESTART, null));
      assertTrue(review.awaitState(ArchitectureState.COMPLETE, 5L, TimeUnit.SECONDS));
      assertFalse(review.getContext().contains(ArchitectureReviewMachine.OPTIMIZATION_ROUNDS));
    } finally {
      review.shutdown();
    }
  }

  @Test
  public void testEmptyRequirementsFailTheReview() throws MachineException {
    final MachineInstance<ArchitectureState, ArchitectureEvent> review =
        ArchitectureReviewMachine.newInstance("arch-5",
            new ScriptedReviews().scores(ArchitectureState.REQUIREMENTS_ANALYSIS, 0), config());
    try {
      assertTrue(review.awaitState(ArchitectureState.FAILED, 5L, TimeUnit.SECONDS));
      assertFalse(review.getContext().contains(ArchitectureReviewMachine.LAST_APPROVED_STEP));
    } finally {
      review.shutdown();
    }
  }

  @Test
  public void testRoutingTable() {
    assertEquals(ArchitectureState.REQUIREMENTS_ANALYSIS,
        ArchitectureReviewMachine.rejectionTarget(ArchitectureState.SYSTEM_DESIGN));
    assertEquals(ArchitectureState.SYSTEM_DESIGN,
        ArchitectureReviewMachine.rejectionTarget(ArchitectureState.TECHNICAL_SPECIFICATION));
    assertEquals(ArchitectureState.ARCHITECTURE_OPTIMIZATION,
        ArchitectureReviewMachine.rejectionTarget(ArchitectureState.COMPLIANCE_VALIDATION));
    assertEquals(ArchitectureState.FAILED,
        ArchitectureReviewMachine.rejectionTarget(ArchitectureState.DOCUMENTATION_GENERATION));
    assertEquals(85, ArchitectureReviewMachine.threshold(ArchitectureState.COMPLIANCE_VALIDATION));
    assertEquals(0, ArchitectureReviewMachine.threshold(ArchitectureState.COMPLETE));
  }

  @Test(expected = IllegalArgumentException.class)
  public void testScoresAreBounded() {
    new ReviewReport(ArchitectureState.SYSTEM_DESIGN, 101, "too good");
  }
}
