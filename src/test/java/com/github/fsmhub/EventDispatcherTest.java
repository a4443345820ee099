package com.github.fsmhub;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import org.junit.Test;

import com.github.fsmhub.Fixtures.Signal;
import com.github.fsmhub.MachineConfiguration.MachineConfigurationBuilder;
import com.github.fsmhub.MachineException.Code;

/**
 * Tests to maintain the sanity and correctness of EventDispatcher.
 */
public class EventDispatcherTest {
  static {
    System.setProperty("log4j.configurationFile", "log4j2-test.properties");
  }

  // records every handled event, fails FAIL events
  private static final class RecordingHandler implements EventHandler<Signal> {
    private final List<QueuedEvent<Signal>> handled =
        Collections.synchronizedList(new ArrayList<QueuedEvent<Signal>>());

    @Override
    public void handle(final QueuedEvent<Signal> event) throws MachineException {
      handled.add(event);
      if (event.getType() == Signal.FAIL) {
        throw new MachineException(Code.INVALID_EVENT, "refusing " + event.getType());
      }
    }

    private List<Object> payloads() {
      final List<Object> payloads = new ArrayList<>();
      synchronized (handled) {
        for (final QueuedEvent<Signal> event : handled) {
          payloads.add(event.getPayload());
        }
      }
      return payloads;
    }
  }

  private static EventDispatcher<Signal> dispatcher(final MachineConfiguration config,
      final EventHandler<Signal> handler) {
    return new EventDispatcher<>("test", Signal.class, config, handler,
        Fixtures.logger(EventDispatcher.class));
  }

  @Test
  public void testPriorityOrderWithFifoTies() throws MachineException {
    final RecordingHandler handler = new RecordingHandler();
    final EventDispatcher<Signal> dispatcher = dispatcher(Fixtures.manual(), handler);
    dispatcher.start();
    dispatcher.dispatch(Signal.TICK, "p9", 9);
    dispatcher.dispatch(Signal.TICK, "p1", 1);
    dispatcher.dispatch(Signal.TICK, "p5-first", 5);
    dispatcher.dispatch(Signal.TICK, "p5-second", 5);
    assertEquals(4, dispatcher.getPendingEvents());

    assertEquals(4, dispatcher.drain());
    assertEquals(Arrays.<Object>asList("p1", "p5-first", "p5-second", "p9"), handler.payloads());
    assertEquals(0, dispatcher.getPendingEvents());
    assertFalse(dispatcher.processNext().isPresent());
    dispatcher.stop();
  }

  @Test
  public void testDefaultPriorityAndRejections() throws MachineException {
    final RecordingHandler handler = new RecordingHandler();
    final EventDispatcher<Signal> dispatcher = dispatcher(Fixtures.manual(), handler);
    try {
      dispatcher.dispatch(Signal.START, null);
      fail("dispatcher is not started");
    } catch (MachineException exception) {
      assertEquals(Code.MACHINE_NOT_ALIVE, exception.getCode());
    }
    dispatcher.start();
    assertTrue(dispatcher.isRunning());
    assertEquals(MachineConfiguration.DEFAULT_PRIORITY,
        dispatcher.dispatch(Signal.START, null).getPriority());
    try {
      dispatcher.dispatch(Signal.START, null, -1);
      fail("negative priority");
    } catch (IllegalArgumentException exception) {
      assertTrue(exception.getMessage().contains("-1"));
    }

    // stopping drops what is queued
    dispatcher.stop();
    assertFalse(dispatcher.isRunning());
    assertEquals(0, dispatcher.getPendingEvents());
    assertTrue(handler.handled.isEmpty());
  }

  @Test
  public void testImmediateDispatchSkipsTheQueue() throws MachineException {
    final RecordingHandler handler = new RecordingHandler();
    final EventDispatcher<Signal> dispatcher = dispatcher(Fixtures.manual(), handler);
    dispatcher.start();
    dispatcher.dispatch(Signal.TICK, "queued");
    final DispatchRecord<Signal> record = dispatcher.dispatchImmediate(Signal.START, "now");
    assertTrue(record.isImmediate());
    assertTrue(record.isSuccess());
    assertEquals(0, record.getPriority());
    assertEquals(Arrays.<Object>asList("now"), handler.payloads());
    assertEquals(1, dispatcher.getPendingEvents());

    final DispatchRecord<Signal> failed = dispatcher.dispatchImmediate(Signal.FAIL, null);
    assertFalse(failed.isSuccess());
    assertTrue(failed.getError().get().startsWith(Code.INVALID_EVENT.name()));
    dispatcher.stop();
  }

  @Test
  public void testSubscriptions() throws MachineException {
    final RecordingHandler handler = new RecordingHandler();
    final EventDispatcher<Signal> dispatcher = dispatcher(Fixtures.manual(), handler);
    dispatcher.start();
    final List<Object> everyTick = new ArrayList<>();
    final List<Object> bigTicks = new ArrayList<>();
    final AtomicInteger onceCalls = new AtomicInteger();
    final List<String> failures = new ArrayList<>();

    final String tickId =
        dispatcher.subscribe(Signal.TICK, (event, failure) -> everyTick.add(event.getPayload()));
    dispatcher.subscribe(EnumSet.of(Signal.TICK),
        (event, failure) -> bigTicks.add(event.getPayload()),
        payload -> payload instanceof Integer && (Integer) payload > 10, false);
    dispatcher.subscribe(EnumSet.of(Signal.TICK, Signal.START),
        (event, failure) -> onceCalls.incrementAndGet(), null, true);
    dispatcher.subscribe(Signal.FAIL, (event, failure) -> failures.add(failure.get()));
    dispatcher.subscribe(Signal.PAUSE, (event, failure) -> {
      throw new IllegalStateException("listener bug");
    });
    assertEquals(5, dispatcher.getSubscriptions().size());

    dispatcher.dispatch(Signal.TICK, 5);
    dispatcher.dispatch(Signal.TICK, 50);
    dispatcher.dispatch(Signal.FAIL, null);
    dispatcher.dispatch(Signal.PAUSE, null);
    dispatcher.drain();

    assertEquals(Arrays.<Object>asList(5, 50), everyTick);
    assertEquals(Arrays.<Object>asList(50), bigTicks);
    assertEquals(1, onceCalls.get());
    // refused events reach their listeners too, with the reason
    assertEquals(Arrays.asList("INVALID_EVENT: refusing FAIL"), failures);
    assertEquals(4, dispatcher.getSubscriptions().size());

    final List<DispatchRecord<Signal>> history = dispatcher.getDispatchHistory();
    assertEquals(2, history.get(0).getListenersNotified());
    assertEquals(2, history.get(1).getListenersNotified());
    assertFalse(history.get(2).isSuccess());
    assertEquals(1, history.get(2).getListenersNotified());
    // a throwing listener does not fail the dispatch
    assertTrue(history.get(3).isSuccess());
    assertEquals(0, history.get(3).getListenersNotified());

    assertTrue(dispatcher.unsubscribe(tickId));
    assertFalse(dispatcher.unsubscribe(tickId));
    dispatcher.dispatch(Signal.TICK, 7);
    dispatcher.drain();
    assertEquals(2, everyTick.size());
    dispatcher.stop();
  }

  @Test
  public void testHistoryIsBoundedAndStatistics() throws MachineException {
    final MachineConfiguration config = MachineConfigurationBuilder.newBuilder()
        .dispatchMode(DispatchMode.MANUAL).eventHistoryCapacity(3).build();
    final EventDispatcher<Signal> dispatcher = dispatcher(config, new RecordingHandler());
    dispatcher.start();
    for (int i = 0; i < 5; i++) {
      dispatcher.dispatch(Signal.TICK, i);
    }
    dispatcher.dispatch(Signal.FAIL, null, 9);
    dispatcher.dispatch(Signal.START, null, 9);
    dispatcher.drain();

    final List<DispatchRecord<Signal>> history = dispatcher.getDispatchHistory();
    assertEquals(3, history.size());
    assertEquals(Signal.TICK, history.get(0).getEventType());
    assertEquals(Signal.FAIL, history.get(1).getEventType());
    assertEquals(Signal.START, history.get(2).getEventType());

    final EventStatistics<Signal> statistics = dispatcher.getStatistics();
    assertEquals(7, statistics.getTotal());
    assertEquals(6, statistics.getSuccessful());
    assertEquals(1, statistics.getFailed());
    assertEquals(Long.valueOf(5L), statistics.getCountsByType().get(Signal.TICK));
    assertEquals(Long.valueOf(1L), statistics.getCountsByType().get(Signal.FAIL));
    assertEquals(0, statistics.getQueueDepth());
    assertEquals(0L, statistics.getHeadWaitMillis());
    dispatcher.stop();
  }

  @Test
  public void testAutoModeProcessesOnItsOwnThread() throws Exception {
    final CountDownLatch processed = new CountDownLatch(3);
    final List<String> threads = Collections.synchronizedList(new ArrayList<String>());
    final EventDispatcher<Signal> dispatcher = dispatcher(Fixtures.auto(), event -> {
      threads.add(Thread.currentThread().getName());
      processed.countDown();
    });
    dispatcher.start();
    dispatcher.dispatch(Signal.START, null);
    dispatcher.dispatch(Signal.TICK, null);
    dispatcher.dispatch(Signal.FINISH, null);
    assertTrue(processed.await(5L, TimeUnit.SECONDS));
    assertEquals(3, threads.size());
    for (final String thread : threads) {
      assertEquals("event-dispatcher-test", thread);
    }
    dispatcher.stop();
    try {
      dispatcher.dispatch(Signal.START, null);
      fail("dispatcher is stopped");
    } catch (MachineException exception) {
      assertEquals(Code.MACHINE_NOT_ALIVE, exception.getCode());
    }
  }
}
