package com.github.fsmhub;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotSame;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.util.EnumSet;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import org.junit.Test;

import com.github.fsmhub.Fixtures.Phase;
import com.github.fsmhub.Fixtures.Signal;
import com.github.fsmhub.MachineConfiguration.MachineConfigurationBuilder;
import com.github.fsmhub.MachineException.Code;

/**
 * Tests to maintain the sanity and correctness of MachineInstance.
 */
public class MachineInstanceTest {
  static {
    System.setProperty("log4j.configurationFile", "log4j2-test.properties");
  }

  // job machine whose RUNNING state invokes the given service, FINISH on done and FAIL on error
  private static MachineDefinition<Phase, Signal> serviceDefinition(
      final InvokedService<Phase, Signal> service, final long timeoutMillis)
      throws MachineException {
    final MachineDefinition.Builder<Phase, Signal> builder =
        MachineDefinition.newBuilder("service-job", Phase.class, Signal.class);
    builder.initialState(Phase.IDLE);
    final StateDefinition.Builder<Phase, Signal> running =
        builder.state(Phase.RUNNING).invoke("work", service, Signal.FINISH, Signal.FAIL);
    if (timeoutMillis > 0L) {
      running.timeout(timeoutMillis, Signal.FAIL);
    }
    running.add();
    builder.state(Phase.DONE).terminal().add();
    builder.transition(Phase.IDLE, Signal.START, Phase.RUNNING).add();
    builder.transition(Phase.RUNNING, Signal.FINISH, Phase.DONE).add();
    builder.transition(Phase.RUNNING, Signal.FAIL, Phase.IDLE).add();
    builder.transition(Phase.RUNNING, Signal.PAUSE, Phase.PAUSED).add();
    return builder.build();
  }

  @Test
  public void testIllegalEventIsRefused() throws MachineException {
    final MachineInstance<Phase, Signal> machine =
        new MachineInstance<>("job-1", Fixtures.jobDefinition(), Fixtures.manual());
    try {
      assertTrue(machine.isAlive());
      assertEquals(Phase.IDLE, machine.getCurrentState());

      assertFalse(machine.sendEvent(Signal.FINISH, null));
      assertEquals(Phase.IDLE, machine.getCurrentState());
      assertEquals(0, machine.getPendingEvents());
      final List<EventRecord<Phase, Signal>> events = machine.getHistoryRecorder().getEvents();
      assertEquals(1, events.size());
      assertFalse(events.get(0).isSuccess());
      assertEquals(Signal.FINISH, events.get(0).getEvent());

      assertTrue(machine.sendEvent(Signal.START, null));
      assertEquals(1, machine.getPendingEvents());
      assertEquals(Phase.IDLE, machine.getCurrentState());
      assertEquals(1, machine.drain());
      assertEquals(Phase.RUNNING, machine.getCurrentState());

      assertTrue(machine.sendEventImmediate(Signal.TICK, null));
      assertTrue(machine.sendEventImmediate(Signal.TICK, null));
      assertEquals(Integer.valueOf(2), machine.getContext().get(Fixtures.TICKS).get());
      assertEquals(Phase.RUNNING, machine.getCurrentState());

      assertTrue(machine.sendEventImmediate(Signal.FINISH, null));
      assertEquals(Phase.DONE, machine.getCurrentState());
      // terminal
      assertFalse(machine.sendEvent(Signal.START, null));
      assertTrue(machine.isHealthy());
      assertEquals(2, machine.getHistoryRecorder().getStateChanges().size());
    } finally {
      machine.shutdown();
    }
  }

  @Test
  public void testGuardFailureReturnsFalse() throws MachineException {
    final MachineConfiguration config = MachineConfigurationBuilder.newBuilder()
        .dispatchMode(DispatchMode.MANUAL).initialValue(Fixtures.BUDGET, 0).build();
    final MachineInstance<Phase, Signal> machine =
        new MachineInstance<>("job-2", Fixtures.jobDefinition(), config);
    final AtomicReference<String> rejection = new AtomicReference<>();
    try {
      machine.subscribe(Signal.START, (event, failure) -> rejection.set(failure.orElse("none")));
      assertFalse(machine.sendEventImmediate(Signal.START, null));
      assertEquals(Phase.IDLE, machine.getCurrentState());
      // observers see the rejected event and why
      assertTrue(rejection.get().startsWith(Code.GUARD_FAILURE.name()));
      assertTrue(rejection.get().contains("hasBudget"));
      final TransitionRecord<Phase, Signal> failed =
          machine.getHistoryRecorder().getTransitions().get(0);
      assertFalse(failed.isSuccess());
      assertTrue(failed.getError().get().contains("hasBudget"));
      assertEquals(1, machine.getContext().getTransitionHistory().size());
      assertFalse(machine.getDispatchHistory().get(0).isSuccess());
    } finally {
      machine.shutdown();
    }
  }

  @Test
  public void testServiceResultBecomesDoneEvent() throws Exception {
    final AtomicReference<Object> payload = new AtomicReference<>();
    final MachineInstance<Phase, Signal> machine = new MachineInstance<>("job-3",
        serviceDefinition(snapshot -> "built " + snapshot.getCurrentState(), 0L), Fixtures.auto());
    try {
      machine.subscribe(Signal.FINISH, (event, failure) -> payload.set(event.getPayload()));
      assertTrue(machine.sendEvent(Signal.START, null));
      assertTrue(machine.awaitState(Phase.DONE, 5L, TimeUnit.SECONDS));
      assertEquals("built RUNNING", payload.get());
      assertEquals(Phase.RUNNING, machine.getContext().getPreviousState().get());
    } finally {
      machine.shutdown();
    }
  }

  @Test
  public void testServiceFailureBecomesErrorEvent() throws Exception {
    final CountDownLatch failed = new CountDownLatch(1);
    final AtomicReference<Object> payload = new AtomicReference<>();
    final MachineInstance<Phase, Signal> machine = new MachineInstance<>("job-4",
        serviceDefinition(snapshot -> {
          throw new IllegalStateException("compiler crashed");
        }, 0L), Fixtures.auto());
    try {
      machine.subscribe(Signal.FAIL, (event, failure) -> {
        payload.set(event.getPayload());
        failed.countDown();
      });
      assertTrue(machine.sendEvent(Signal.START, null));
      assertTrue(failed.await(5L, TimeUnit.SECONDS));
      assertTrue(machine.awaitState(Phase.IDLE, 5L, TimeUnit.SECONDS));
      assertTrue(payload.get() instanceof IllegalStateException);
      assertEquals("compiler crashed", ((Throwable) payload.get()).getMessage());
    } finally {
      machine.shutdown();
    }
  }

  @Test
  public void testTimeoutCancelsService() throws Exception {
    final CountDownLatch interrupted = new CountDownLatch(1);
    final CountDownLatch timedOut = new CountDownLatch(1);
    final AtomicReference<Object> payload = new AtomicReference<>();
    final MachineInstance<Phase, Signal> machine = new MachineInstance<>("job-5",
        serviceDefinition(snapshot -> {
          try {
            Thread.sleep(TimeUnit.SECONDS.toMillis(10L));
          } catch (InterruptedException exception) {
            interrupted.countDown();
            throw exception;
          }
          return "too late";
        }, 50L), Fixtures.auto());
    try {
      machine.subscribe(Signal.FAIL, (event, failure) -> {
        payload.set(event.getPayload());
        timedOut.countDown();
      });
      assertTrue(machine.sendEvent(Signal.START, null));
      assertTrue(timedOut.await(5L, TimeUnit.SECONDS));
      assertTrue(interrupted.await(5L, TimeUnit.SECONDS));
      assertTrue(machine.awaitState(Phase.IDLE, 5L, TimeUnit.SECONDS));
      final ServiceTimeout timeout = (ServiceTimeout) payload.get();
      assertEquals("RUNNING", timeout.getState());
      assertEquals("work", timeout.getServiceName());
      assertEquals(50L, timeout.getTimeoutMillis());
    } finally {
      machine.shutdown();
    }
  }

  @Test
  public void testTimeoutStaysArmedAfterRefusedCompletion() throws Exception {
    final MachineDefinition.Builder<Phase, Signal> builder =
        MachineDefinition.newBuilder("refused-job", Phase.class, Signal.class);
    builder.initialState(Phase.IDLE);
    builder.state(Phase.RUNNING).invoke("work", snapshot -> "quick", Signal.FINISH, Signal.FAIL)
        .timeout(150L, Signal.FAIL).add();
    builder.state(Phase.DONE).terminal().add();
    builder.transition(Phase.IDLE, Signal.START, Phase.RUNNING).add();
    builder.transition(Phase.RUNNING, Signal.FINISH, Phase.DONE)
        .guard(TransitionGuard.of("closed", "Finishing is closed", context -> false)).add();
    builder.transition(Phase.RUNNING, Signal.FAIL, Phase.PAUSED).add();
    final MachineInstance<Phase, Signal> machine =
        new MachineInstance<>("job-9", builder.build(), Fixtures.auto());
    final CountDownLatch routed = new CountDownLatch(1);
    final AtomicReference<Object> payload = new AtomicReference<>();
    try {
      machine.subscribe(Signal.FAIL, (event, failure) -> {
        if (!failure.isPresent()) {
          payload.set(event.getPayload());
          routed.countDown();
        }
      });
      assertTrue(machine.sendEvent(Signal.START, null));
      // the refused completion leaves RUNNING in place until its timeout routes it out
      assertTrue(routed.await(5L, TimeUnit.SECONDS));
      assertEquals(Phase.PAUSED, machine.getCurrentState());
      assertEquals(150L, ((ServiceTimeout) payload.get()).getTimeoutMillis());
      assertEquals(1, machine.getHistoryRecorder().query(machine.getHistoryRecorder().newQuery()
          .from(Phase.RUNNING).event(Signal.FINISH).build()).size());
    } finally {
      machine.shutdown();
    }
  }

  @Test
  public void testLeavingStateCancelsItsService() throws Exception {
    final CountDownLatch started = new CountDownLatch(1);
    final CountDownLatch interrupted = new CountDownLatch(1);
    final CountDownLatch never = new CountDownLatch(1);
    final MachineInstance<Phase, Signal> machine = new MachineInstance<>("job-6",
        serviceDefinition(snapshot -> {
          started.countDown();
          try {
            never.await();
          } catch (InterruptedException exception) {
            interrupted.countDown();
            throw exception;
          }
          return "done";
        }, 0L), Fixtures.auto());
    try {
      assertTrue(machine.sendEvent(Signal.START, null));
      assertTrue(started.await(5L, TimeUnit.SECONDS));
      assertTrue(machine.sendEventImmediate(Signal.PAUSE, null));
      assertEquals(Phase.PAUSED, machine.getCurrentState());
      assertTrue(interrupted.await(5L, TimeUnit.SECONDS));
      // neither the result nor a failure of the cancelled service may move the machine
      assertFalse(machine.awaitState(Phase.DONE, 100L, TimeUnit.MILLISECONDS));
      assertEquals(Phase.PAUSED, machine.getCurrentState());
    } finally {
      machine.shutdown();
    }
  }

  @Test
  public void testInvariantViolationRaisesFailureEvent() throws MachineException {
    final MachineDefinition.Builder<Phase, Signal> builder = Fixtures.jobBuilder();
    builder.failureEvent(Signal.FAIL);
    builder.state(Phase.PAUSED).invariant("neverHolds", context -> false).add();
    final MachineInstance<Phase, Signal> machine =
        new MachineInstance<>("job-7", builder.build(), Fixtures.manual());
    try {
      assertTrue(machine.sendEventImmediate(Signal.START, null));
      assertTrue(machine.sendEvent(Signal.PAUSE, null));
      // the failed PAUSE, then the FAIL it raised
      assertEquals(2, machine.drain());
      assertEquals(Phase.IDLE, machine.getCurrentState());
      final List<DispatchRecord<Signal>> dispatches = machine.getDispatchHistory();
      final DispatchRecord<Signal> pause = dispatches.get(dispatches.size() - 2);
      assertEquals(Signal.PAUSE, pause.getEventType());
      assertTrue(pause.getError().get().startsWith(Code.INVARIANT_VIOLATION.name()));
      assertEquals(Signal.FAIL, dispatches.get(dispatches.size() - 1).getEventType());
      assertEquals(MachineInstance.FAILURE_PRIORITY,
          dispatches.get(dispatches.size() - 1).getPriority());
    } finally {
      machine.shutdown();
    }
  }

  @Test
  public void testSubscriptionsFireOnce() throws MachineException {
    final MachineInstance<Phase, Signal> machine =
        new MachineInstance<>("job-8", Fixtures.jobDefinition(), Fixtures.manual());
    try {
      final CountDownLatch ticks = new CountDownLatch(3);
      final String id = machine.subscribe(EnumSet.of(Signal.TICK),
          (event, failure) -> ticks.countDown(), null, true);
      machine.sendEventImmediate(Signal.START, null);
      machine.sendEventImmediate(Signal.TICK, null);
      machine.sendEventImmediate(Signal.TICK, null);
      assertEquals(2L, ticks.getCount());
      assertFalse(machine.unsubscribe(id));
    } finally {
      machine.shutdown();
    }
  }

  @Test
  public void testShutdownAndRecreate() throws MachineException {
    final MachineInstance<Phase, Signal> machine =
        new MachineInstance<>("job-9", Fixtures.jobDefinition(), Fixtures.manual());
    machine.sendEventImmediate(Signal.START, null);
    assertEquals(Phase.RUNNING, machine.getCurrentState());
    assertFalse(machine.awaitState(Phase.DONE, 20L, TimeUnit.MILLISECONDS));

    final MachineContext<Phase, Signal> snapshot = machine.getContext();
    assertTrue(snapshot.isReadOnly());
    try {
      snapshot.put(Fixtures.TICKS, 1);
      fail("snapshots are read-only");
    } catch (UnsupportedOperationException expected) {
      // expected
    }

    machine.shutdown();
    machine.shutdown();
    assertFalse(machine.isAlive());
    assertFalse(machine.isHealthy());
    try {
      machine.sendEvent(Signal.PAUSE, null);
      fail("machine is shut down");
    } catch (MachineException exception) {
      assertEquals(Code.MACHINE_NOT_ALIVE, exception.getCode());
    }

    final MachineInstance<Phase, Signal> fresh = machine.recreate();
    try {
      assertNotSame(machine, fresh);
      assertTrue(fresh.isAlive());
      assertEquals("job-9", fresh.getMachineId());
      assertEquals(Phase.IDLE, fresh.getCurrentState());
      assertTrue(fresh.getHistoryRecorder().getTransitions().isEmpty());
    } finally {
      fresh.shutdown();
    }
  }

  @Test
  public void testFailingInitialEntryAbortsConstruction() throws MachineException {
    final MachineDefinition.Builder<Phase, Signal> builder = Fixtures.jobBuilder();
    builder.state(Phase.IDLE).onEntry(context -> {
      throw new IllegalStateException("no database");
    }).add();
    try {
      new MachineInstance<>("job-10", builder.build(), Fixtures.manual());
      fail("entry hook of the initial state failed");
    } catch (MachineException exception) {
      assertEquals(Code.HOOK_FAILURE, exception.getCode());
    }
  }

  @Test
  public void testUnhealthyState() throws MachineException {
    final MachineDefinition.Builder<Phase, Signal> builder = Fixtures.jobBuilder();
    builder.state(Phase.PAUSED).unhealthy().add();
    final MachineInstance<Phase, Signal> machine =
        new MachineInstance<>("job-11", builder.build(), Fixtures.manual());
    try {
      machine.sendEventImmediate(Signal.START, null);
      assertTrue(machine.isHealthy());
      machine.sendEventImmediate(Signal.PAUSE, null);
      assertFalse(machine.isHealthy());
      assertEquals("PAUSED", machine.getCurrentStateName());
    } finally {
      machine.shutdown();
    }
  }
}
