package com.github.fsmhub.machines;

import static com.github.fsmhub.machines.ArchitectureEvent.RESTART;
import static com.github.fsmhub.machines.ArchitectureEvent.STEP_APPROVED;
import static com.github.fsmhub.machines.ArchitectureEvent.STEP_REJECTED;
import static com.github.fsmhub.machines.ArchitectureEvent.TASK_FAILED;
import static com.github.fsmhub.machines.ArchitectureState.ARCHITECTURE_OPTIMIZATION;
import static com.github.fsmhub.machines.ArchitectureState.COMPLETE;
import static com.github.fsmhub.machines.ArchitectureState.COMPLIANCE_VALIDATION;
import static com.github.fsmhub.machines.ArchitectureState.DOCUMENTATION_GENERATION;
import static com.github.fsmhub.machines.ArchitectureState.FAILED;
import static com.github.fsmhub.machines.ArchitectureState.QUALITY_ATTRIBUTE_ANALYSIS;
import static com.github.fsmhub.machines.ArchitectureState.REQUIREMENTS_ANALYSIS;
import static com.github.fsmhub.machines.ArchitectureState.SYSTEM_DESIGN;
import static com.github.fsmhub.machines.ArchitectureState.TECHNICAL_SPECIFICATION;

import java.util.Arrays;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import com.github.fsmhub.ContextKey;
import com.github.fsmhub.MachineConfiguration;
import com.github.fsmhub.MachineContext;
import com.github.fsmhub.MachineDefinition;
import com.github.fsmhub.MachineException;
import com.github.fsmhub.MachineException.Code;
import com.github.fsmhub.MachineInstance;
import com.github.fsmhub.QueuedEvent;
import com.github.fsmhub.StateDefinition;
import com.github.fsmhub.TransitionGuard;

/**
 * Architecture review walking a design from requirements to documentation. Each step is reviewed
 * by {@link ArchitectureServices#review}; a score below the step's threshold rejects the step:
 * 
 * <pre>
 * SYSTEM_DESIGN rejected           -> REQUIREMENTS_ANALYSIS
 * TECHNICAL_SPECIFICATION rejected -> SYSTEM_DESIGN
 * QUALITY_ATTRIBUTE_ANALYSIS | COMPLIANCE_VALIDATION rejected -> ARCHITECTURE_OPTIMIZATION
 * ARCHITECTURE_OPTIMIZATION approved -> QUALITY_ATTRIBUTE_ANALYSIS
 * REQUIREMENTS_ANALYSIS | DOCUMENTATION_GENERATION rejected, or TASK_FAILED -> FAILED
 * </pre>
 */
public final class ArchitectureReviewMachine {
  public static final String NAME = "architecture-review";
  public static final int MAX_OPTIMIZATION_ROUNDS = 3;

  public static final List<ArchitectureState> STEPS = Collections.unmodifiableList(
      Arrays.asList(REQUIREMENTS_ANALYSIS, SYSTEM_DESIGN, TECHNICAL_SPECIFICATION,
          QUALITY_ATTRIBUTE_ANALYSIS, COMPLIANCE_VALIDATION, DOCUMENTATION_GENERATION));

  private static final Map<ArchitectureState, Integer> THRESHOLDS =
      new EnumMap<>(ArchitectureState.class);
  static {
    THRESHOLDS.put(REQUIREMENTS_ANALYSIS, 1);
    THRESHOLDS.put(SYSTEM_DESIGN, 70);
    THRESHOLDS.put(TECHNICAL_SPECIFICATION, 1);
    THRESHOLDS.put(QUALITY_ATTRIBUTE_ANALYSIS, 70);
    THRESHOLDS.put(COMPLIANCE_VALIDATION, 85);
    THRESHOLDS.put(DOCUMENTATION_GENERATION, 1);
  }

  public static final ContextKey<ArchitectureState> LAST_APPROVED_STEP =
      ContextKey.of("lastApprovedStep", ArchitectureState.class);
  public static final ContextKey<Integer> QUALITY_SCORE =
      ContextKey.of("qualityScore", Integer.class);
  public static final ContextKey<Integer> COMPLIANCE_SCORE =
      ContextKey.of("complianceScore", Integer.class);
  public static final ContextKey<Integer> OPTIMIZATION_ROUNDS =
      ContextKey.of("optimizationRounds", Integer.class);
  public static final ContextKey<Integer> REVISIONS = ContextKey.of("revisions", Integer.class);
  public static final ContextKey<String> REJECTION_REASON =
      ContextKey.of("rejectionReason", String.class);

  public static final TransitionGuard<ArchitectureState, ArchitectureEvent> PREVIOUS_STEP_APPROVED =
      TransitionGuard.of("previousStepApproved", "Steps must be approved in review order",
          context -> context.getOrDefault(LAST_APPROVED_STEP, null) == predecessor(
              context.getCurrentState()));
  public static final TransitionGuard<ArchitectureState, ArchitectureEvent>
      WITHIN_OPTIMIZATION_BUDGET = TransitionGuard.of("withinOptimizationBudget",
          "Optimization rounds exhausted",
          context -> context.getOrDefault(OPTIMIZATION_ROUNDS, 0) < MAX_OPTIMIZATION_ROUNDS);

  private ArchitectureReviewMachine() {}

  public static int threshold(final ArchitectureState step) {
    final Integer threshold = THRESHOLDS.get(step);
    return threshold == null ? 0 : threshold;
  }

  public static MachineDefinition<ArchitectureState, ArchitectureEvent> definition(
      final ArchitectureServices services) throws MachineException {
    if (services == null) {
      throw new MachineException(Code.INVALID_MACHINE_DEFINITION,
          "ArchitectureServices cannot be null");
    }
    final MachineDefinition.Builder<ArchitectureState, ArchitectureEvent> builder =
        MachineDefinition.newBuilder(NAME, ArchitectureState.class, ArchitectureEvent.class);
    builder.initialState(REQUIREMENTS_ANALYSIS).failureEvent(TASK_FAILED);

    for (int index = 0; index < STEPS.size(); index++) {
      final ArchitectureState step = STEPS.get(index);
      final ArchitectureState next = index + 1 < STEPS.size() ? STEPS.get(index + 1) : COMPLETE;
      final StateDefinition.Builder<ArchitectureState, ArchitectureEvent> state =
          builder.state(step).invoke("review" + step.name(),
              context -> approved(step, services.review(step, context)), STEP_APPROVED,
              STEP_REJECTED);
      if (step == DOCUMENTATION_GENERATION) {
        state.invariant("complianceApproved",
            context -> context.getOrDefault(COMPLIANCE_SCORE, 0) >= threshold(
                COMPLIANCE_VALIDATION));
      }
      state.add();
      builder.transition(step, STEP_APPROVED, next).guard(PREVIOUS_STEP_APPROVED)
          .action((context, event) -> approve(step, context, event)).add();
      final ArchitectureState onRejection = rejectionTarget(step);
      builder.transition(step, STEP_REJECTED, onRejection)
          .action((context, event) -> reject(onRejection, context, event)).add();
      builder.transition(step, TASK_FAILED, FAILED)
          .action((context, event) -> reject(FAILED, context, event)).add();
    }

    builder.state(ARCHITECTURE_OPTIMIZATION)
        .invoke("optimizeArchitecture", context -> {
          if (context.getOrDefault(OPTIMIZATION_ROUNDS, 0) >= MAX_OPTIMIZATION_ROUNDS) {
            throw new MachineException(Code.SERVICE_FAILURE,
                "Optimization budget of " + MAX_OPTIMIZATION_ROUNDS + " rounds exhausted");
          }
          return services.optimize(context);
        }, STEP_APPROVED, STEP_REJECTED).add();
    builder.transition(ARCHITECTURE_OPTIMIZATION, STEP_APPROVED, QUALITY_ATTRIBUTE_ANALYSIS)
        .guard(WITHIN_OPTIMIZATION_BUDGET)
        .action((context, event) -> {
          context.put(OPTIMIZATION_ROUNDS, context.getOrDefault(OPTIMIZATION_ROUNDS, 0) + 1);
          context.put(LAST_APPROVED_STEP, TECHNICAL_SPECIFICATION);
          context.remove(QUALITY_SCORE);
          context.remove(COMPLIANCE_SCORE);
        }).add();
    builder.transition(ARCHITECTURE_OPTIMIZATION, STEP_REJECTED, FAILED)
        .action((context, event) -> reject(FAILED, context, event)).add();
    builder.transition(ARCHITECTURE_OPTIMIZATION, TASK_FAILED, FAILED)
        .action((context, event) -> reject(FAILED, context, event)).add();

    builder.state(COMPLETE).terminal().add();
    builder.state(FAILED).unhealthy().add();
    builder.transition(FAILED, RESTART, REQUIREMENTS_ANALYSIS)
        .action((context, event) -> {
          context.remove(LAST_APPROVED_STEP);
          context.remove(QUALITY_SCORE);
          context.remove(COMPLIANCE_SCORE);
          context.remove(OPTIMIZATION_ROUNDS);
          context.remove(REJECTION_REASON);
        }).add();
    return builder.build();
  }

  public static MachineInstance<ArchitectureState, ArchitectureEvent> newInstance(
      final String machineId, final ArchitectureServices services,
      final MachineConfiguration config) throws MachineException {
    return new MachineInstance<>(machineId, definition(services), config);
  }

  static ArchitectureState rejectionTarget(final ArchitectureState step) {
    switch (step) {
      case SYSTEM_DESIGN:
        return REQUIREMENTS_ANALYSIS;
      case TECHNICAL_SPECIFICATION:
        return SYSTEM_DESIGN;
      case QUALITY_ATTRIBUTE_ANALYSIS:
      case COMPLIANCE_VALIDATION:
        return ARCHITECTURE_OPTIMIZATION;
      default:
        return FAILED;
    }
  }

  private static ArchitectureState predecessor(final ArchitectureState step) {
    final int index = STEPS.indexOf(step);
    return index <= 0 ? null : STEPS.get(index - 1);
  }

  private static ReviewReport approved(final ArchitectureState step, final ReviewReport report)
      throws MachineException {
    if (report == null) {
      throw new MachineException(Code.SERVICE_FAILURE, "Review of " + step + " returned no report");
    }
    if (report.getScore() < threshold(step)) {
      throw new MachineException(Code.SERVICE_FAILURE, "Review of " + step + " scored "
          + report.getScore() + ", below " + threshold(step) + ": " + report.getNotes());
    }
    return report;
  }

  private static void approve(final ArchitectureState step,
      final MachineContext<ArchitectureState, ArchitectureEvent> context,
      final QueuedEvent<ArchitectureEvent> event) {
    context.put(LAST_APPROVED_STEP, step);
    final int score = event == null ? 0
        : event.payload(ReviewReport.class).map(ReviewReport::getScore).orElse(0);
    if (step == QUALITY_ATTRIBUTE_ANALYSIS) {
      context.put(QUALITY_SCORE, score);
    } else if (step == COMPLIANCE_VALIDATION) {
      context.put(COMPLIANCE_SCORE, score);
    }
  }

  private static void reject(final ArchitectureState target,
      final MachineContext<ArchitectureState, ArchitectureEvent> context,
      final QueuedEvent<ArchitectureEvent> event) {
    final Object payload = event == null ? null : event.getPayload();
    context.put(REJECTION_REASON, payload instanceof Throwable
        ? String.valueOf(((Throwable) payload).getMessage())
        : String.valueOf(payload));
    context.put(REVISIONS, context.getOrDefault(REVISIONS, 0) + 1);
    final ArchitectureState rewound = predecessor(target);
    if (rewound == null) {
      context.remove(LAST_APPROVED_STEP);
    } else {
      context.put(LAST_APPROVED_STEP, rewound);
    }
  }
}
