package com.github.fsmhub;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import org.junit.Test;

import com.github.fsmhub.Fixtures.Phase;
import com.github.fsmhub.Fixtures.Signal;
import com.github.fsmhub.MachineException.Code;
import com.github.fsmhub.TransitionExecutor.ExecutorMetrics;

/**
 * Tests to maintain the sanity and correctness of TransitionExecutor.
 */
public class TransitionExecutorTest {
  static {
    System.setProperty("log4j.configurationFile", "log4j2-test.properties");
  }

  private static final ContextKey<String> NOTE = ContextKey.of("note", String.class);

  private static TransitionExecutor<Phase, Signal> executor(
      final MachineDefinition<Phase, Signal> definition, final InvariantMode mode) {
    final TransitionValidator<Phase, Signal> validator = new TransitionValidator<>(definition, 10,
        Fixtures.logger(TransitionValidator.class));
    return new TransitionExecutor<>(definition, validator, mode,
        Fixtures.logger(TransitionExecutor.class));
  }

  private static TransitionExecutionResult<Phase, Signal> run(
      final TransitionExecutor<Phase, Signal> executor,
      final MachineDefinition<Phase, Signal> definition,
      final MachineContext<Phase, Signal> context, final Signal signal) {
    final TransitionDefinition<Phase, Signal> transition =
        definition.findTransition(context.getCurrentState(), signal).get();
    return executor.execute(transition, context, QueuedEvent.of(signal, null));
  }

  @Test
  public void testHooksAndActionsRunInOrder() throws MachineException {
    final List<String> trail = new ArrayList<>();
    final MachineDefinition.Builder<Phase, Signal> builder =
        MachineDefinition.newBuilder("ordered", Phase.class, Signal.class);
    builder.initialState(Phase.IDLE);
    builder.state(Phase.IDLE).onExit(context -> trail.add("exit IDLE")).add();
    builder.state(Phase.RUNNING).onEntry(context -> trail.add("enter RUNNING")).add();
    builder.transition(Phase.IDLE, Signal.START, Phase.RUNNING)
        .action((context, event) -> trail.add("action 1"))
        .action((context, event) -> {
          trail.add("action 2");
          context.put(NOTE, "started by " + event.getType());
        }).add();
    final MachineDefinition<Phase, Signal> definition = builder.build();
    final TransitionExecutor<Phase, Signal> executor = executor(definition, InvariantMode.ATOMIC);
    final MachineContext<Phase, Signal> context = Fixtures.context(Phase.IDLE);

    final TransitionExecutionResult<Phase, Signal> result =
        run(executor, definition, context, Signal.START);
    assertTrue(result.isSuccess());
    assertTrue(result.isCommitted());
    assertEquals(2, result.getActionsRun());
    assertEquals(Arrays.asList("exit IDLE", "action 1", "action 2", "enter RUNNING"), trail);
    assertEquals(Phase.RUNNING, context.getCurrentState());
    assertEquals(Phase.IDLE, context.getPreviousState().get());
    assertEquals("started by START", context.get(NOTE).get());

    assertEquals(1, context.getTransitionHistory().size());
    final TransitionRecord<Phase, Signal> record = context.getTransitionHistory().get(0);
    assertTrue(record.isSuccess());
    assertEquals(Phase.IDLE, record.getFrom());
    assertEquals(Phase.RUNNING, record.getTo());
    assertEquals("started by START", record.getContextSnapshot().get().get("note"));
  }

  @Test
  public void testFailedActionLeavesContextUntouched() throws MachineException {
    final MachineDefinition.Builder<Phase, Signal> builder =
        MachineDefinition.newBuilder("failing", Phase.class, Signal.class);
    builder.initialState(Phase.IDLE);
    builder.transition(Phase.IDLE, Signal.START, Phase.RUNNING)
        .action((context, event) -> context.put(NOTE, "half done"))
        .action((context, event) -> {
          throw new IllegalStateException("disk full");
        }).add();
    final MachineDefinition<Phase, Signal> definition = builder.build();
    final TransitionExecutor<Phase, Signal> executor = executor(definition, InvariantMode.ATOMIC);
    final MachineContext<Phase, Signal> context = Fixtures.context(Phase.IDLE);

    final TransitionExecutionResult<Phase, Signal> result =
        run(executor, definition, context, Signal.START);
    assertFalse(result.isSuccess());
    assertFalse(result.isCommitted());
    assertEquals(Code.ACTION_FAILURE, result.getErrorCode().get());
    assertEquals(1, result.getActionsRun());
    assertTrue(result.getError().get().contains("disk full"));
    assertEquals(Phase.IDLE, context.getCurrentState());
    assertFalse(context.contains(NOTE));
    assertFalse(context.getTransitionHistory().get(0).isSuccess());
  }

  @Test
  public void testInvariantModes() throws MachineException {
    final MachineDefinition.Builder<Phase, Signal> builder =
        MachineDefinition.newBuilder("guarded", Phase.class, Signal.class);
    builder.initialState(Phase.IDLE);
    builder.state(Phase.RUNNING).invariant("noted", context -> context.contains(NOTE)).add();
    builder.transition(Phase.IDLE, Signal.START, Phase.RUNNING)
        .action((context, event) -> context.put(Fixtures.TICKS, 1)).add();
    final MachineDefinition<Phase, Signal> definition = builder.build();

    final MachineContext<Phase, Signal> atomic = Fixtures.context(Phase.IDLE);
    final TransitionExecutionResult<Phase, Signal> discarded =
        run(executor(definition, InvariantMode.ATOMIC), definition, atomic, Signal.START);
    assertEquals(Code.INVARIANT_VIOLATION, discarded.getErrorCode().get());
    assertFalse(discarded.isCommitted());
    assertEquals(Phase.IDLE, atomic.getCurrentState());
    assertFalse(atomic.contains(Fixtures.TICKS));

    final MachineContext<Phase, Signal> eager = Fixtures.context(Phase.IDLE);
    final TransitionExecutionResult<Phase, Signal> kept = run(
        executor(definition, InvariantMode.COMMIT_THEN_CHECK), definition, eager, Signal.START);
    assertEquals(Code.INVARIANT_VIOLATION, kept.getErrorCode().get());
    assertTrue(kept.isCommitted());
    assertEquals(Phase.RUNNING, eager.getCurrentState());
    assertEquals(Integer.valueOf(1), eager.get(Fixtures.TICKS).get());
  }

  @Test
  public void testGuardFailureAndInternalTransition() throws MachineException {
    final MachineDefinition<Phase, Signal> definition = Fixtures.jobDefinition();
    final TransitionExecutor<Phase, Signal> executor = executor(definition, InvariantMode.ATOMIC);
    final MachineContext<Phase, Signal> context = Fixtures.context(Phase.IDLE);
    context.put(Fixtures.BUDGET, 0);

    final TransitionExecutionResult<Phase, Signal> refused =
        run(executor, definition, context, Signal.START);
    assertEquals(Code.GUARD_FAILURE, refused.getErrorCode().get());
    assertEquals(0, refused.getActionsRun());
    assertEquals(Phase.IDLE, context.getCurrentState());

    context.put(Fixtures.BUDGET, 1);
    assertTrue(run(executor, definition, context, Signal.START).isSuccess());
    final long enteredAt = context.getTimestamp();
    final TransitionExecutionResult<Phase, Signal> tick =
        run(executor, definition, context, Signal.TICK);
    assertTrue(tick.isSuccess());
    assertFalse(tick.isCommitted());
    assertEquals(Phase.RUNNING, context.getCurrentState());
    assertEquals(Phase.IDLE, context.getPreviousState().get());
    assertTrue(context.getTimestamp() >= enteredAt);
    assertEquals(Integer.valueOf(1), context.get(Fixtures.TICKS).get());

    // stale transition for a state the context already left
    final TransitionExecutionResult<Phase, Signal> stale = executor.execute(
        definition.findTransition(Phase.IDLE, Signal.START).get(), context,
        QueuedEvent.of(Signal.START, null));
    assertEquals(Code.INVALID_EVENT, stale.getErrorCode().get());

    final ExecutorMetrics metrics = executor.getMetrics();
    assertEquals(4, metrics.getExecutions());
    assertEquals(2, metrics.getSuccesses());
    assertEquals(2, metrics.getFailures());
  }

  @Test
  public void testConcurrentExecutionIsRejected() throws Exception {
    final CountDownLatch entered = new CountDownLatch(1);
    final CountDownLatch release = new CountDownLatch(1);
    final MachineDefinition.Builder<Phase, Signal> builder =
        MachineDefinition.newBuilder("slow", Phase.class, Signal.class);
    builder.initialState(Phase.IDLE);
    builder.transition(Phase.IDLE, Signal.START, Phase.RUNNING)
        .action((context, event) -> {
          entered.countDown();
          release.await(5L, TimeUnit.SECONDS);
        }).add();
    final MachineDefinition<Phase, Signal> definition = builder.build();
    final TransitionExecutor<Phase, Signal> executor = executor(definition, InvariantMode.ATOMIC);
    final MachineContext<Phase, Signal> context = Fixtures.context(Phase.IDLE);

    final ExecutorService worker = Executors.newSingleThreadExecutor();
    try {
      final Future<TransitionExecutionResult<Phase, Signal>> first =
          worker.submit(() -> run(executor, definition, context, Signal.START));
      assertTrue(entered.await(5L, TimeUnit.SECONDS));
      assertTrue(executor.isInFlight());

      final TransitionExecutionResult<Phase, Signal> second = executor.execute(
          definition.findTransition(Phase.IDLE, Signal.START).get(), Fixtures.context(Phase.IDLE),
          QueuedEvent.of(Signal.START, null));
      assertEquals(Code.TRANSITION_IN_PROGRESS, second.getErrorCode().get());
      assertEquals(1, executor.getMetrics().getRejected());

      release.countDown();
      assertTrue(first.get(5L, TimeUnit.SECONDS).isSuccess());
      assertFalse(executor.isInFlight());
    } finally {
      worker.shutdownNow();
    }
  }
}
