package com.github.fsmhub;

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.PriorityBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Predicate;

import com.github.fsmhub.MachineException.Code;

/**
 * Priority mailbox of one machine instance plus its subscription registry.
 * 
 * Notes for users:<br>
 * 1. {@link #dispatch(Enum, Object, int)} only enqueues; enqueue is non-blocking and safe from
 * any number of producer threads<br>
 * 
 * 2. the queue is served by ascending priority value, FIFO within a priority<br>
 * 
 * 3. in {@link DispatchMode#AUTO_ASYNC} a daemon polling loop drains the queue, in
 * {@link DispatchMode#MANUAL} callers drive it with {@link #processNext()} or {@link #drain()}<br>
 * 
 * 4. subscribers hear about every processed event, refused and failed ones included along with
 * the failure reason; a failing listener is logged and does not fail the dispatch<br>
 */
public final class EventDispatcher<E extends Enum<E>> {
  private final String machineId;
  private final Class<E> eventType;
  private final DispatchMode dispatchMode;
  private final int defaultPriority;
  private final long pollIntervalMillis;
  private final MachineLogger logger;
  private final EventHandler<E> handler;

  private final PriorityBlockingQueue<QueuedEvent<E>> queue =
      new PriorityBlockingQueue<>(16, QueuedEvent.<E>servingOrder());
  private final AtomicLong sequencer = new AtomicLong();
  private final AtomicLong subscriptionIds = new AtomicLong();
  private final List<EventSubscription<E>> subscriptions = new CopyOnWriteArrayList<>();
  private final BoundedHistory<DispatchRecord<E>> dispatchHistory;

  private final AtomicLong totalDispatches = new AtomicLong();
  private final AtomicLong successfulDispatches = new AtomicLong();
  private final AtomicLong failedDispatches = new AtomicLong();
  private final ConcurrentMap<E, AtomicLong> countsByType = new ConcurrentHashMap<>();

  private final AtomicBoolean running = new AtomicBoolean();
  private volatile DispatchLoop dispatchLoop;

  public EventDispatcher(final String machineId, final Class<E> eventType,
      final MachineConfiguration config, final EventHandler<E> handler,
      final MachineLogger logger) {
    this.machineId = machineId;
    this.eventType = eventType;
    this.dispatchMode = config.getDispatchMode();
    this.defaultPriority = config.getDefaultPriority();
    this.pollIntervalMillis = config.getPollIntervalMillis();
    this.dispatchHistory = new BoundedHistory<>(config.getEventHistoryCapacity());
    this.handler = handler;
    this.logger = logger;
  }

  public void start() {
    if (!running.compareAndSet(false, true)) {
      logger.info("Dispatcher is already running");
      return;
    }
    if (dispatchMode == DispatchMode.AUTO_ASYNC) {
      dispatchLoop = new DispatchLoop();
      dispatchLoop.start();
    }
    logger.info("Started dispatcher in " + dispatchMode + " mode");
  }

  /**
   * Stops accepting events and halts the polling loop. Events still queued are dropped.
   */
  public void stop() {
    if (!running.compareAndSet(true, false)) {
      return;
    }
    final DispatchLoop loop = dispatchLoop;
    if (loop != null) {
      loop.interrupt();
      if (Thread.currentThread() != loop) {
        try {
          loop.join(TimeUnit.SECONDS.toMillis(1L));
        } catch (InterruptedException exception) {
          Thread.currentThread().interrupt();
        }
      }
      dispatchLoop = null;
    }
    final int dropped = queue.size();
    queue.clear();
    logger.info(String.format("Stopped dispatcher, dropped:%d, %s", dropped, getStatistics()));
  }

  public boolean isRunning() {
    return running.get();
  }

  public DispatchMode getDispatchMode() {
    return dispatchMode;
  }

  public QueuedEvent<E> dispatch(final E event, final Object payload) throws MachineException {
    return dispatch(event, payload, defaultPriority);
  }

  public QueuedEvent<E> dispatch(final E event, final Object payload, final int priority)
      throws MachineException {
    return enqueue(event, payload, priority, QueuedEvent.UNTAGGED);
  }

  QueuedEvent<E> dispatchTagged(final E event, final Object payload, final int priority,
      final long entrySequence) throws MachineException {
    return enqueue(event, payload, priority, entrySequence);
  }

  /**
   * Bypasses the queue and processes {@code event} on the calling thread.
   */
  public DispatchRecord<E> dispatchImmediate(final E event, final Object payload)
      throws MachineException {
    checkRunning(event);
    final QueuedEvent<E> queued = new QueuedEvent<>(event, payload, 0,
        System.currentTimeMillis(), sequencer.incrementAndGet(), QueuedEvent.UNTAGGED);
    return process(queued, true);
  }

  public Optional<DispatchRecord<E>> processNext() {
    final QueuedEvent<E> next = queue.poll();
    if (next == null) {
      return Optional.empty();
    }
    return Optional.of(process(next, false));
  }

  /**
   * Processes queued events until the queue is empty, including events enqueued meanwhile.
   */
  public int drain() {
    int processed = 0;
    while (processNext().isPresent()) {
      processed++;
    }
    return processed;
  }

  public String subscribe(final E event, final EventListener<E> listener) {
    return subscribe(EnumSet.of(event), listener, null, false);
  }

  public String subscribe(final Set<E> events, final EventListener<E> listener,
      final Predicate<Object> filter, final boolean once) {
    if (events == null || events.isEmpty() || listener == null) {
      throw new IllegalArgumentException("Subscription needs at least one event and a listener");
    }
    final String id = machineId + "-sub-" + subscriptionIds.incrementAndGet();
    subscriptions.add(new EventSubscription<>(id, events, listener, filter, once));
    logger.debug("Added subscription " + id + " for " + events);
    return id;
  }

  public boolean unsubscribe(final String subscriptionId) {
    for (final EventSubscription<E> subscription : subscriptions) {
      if (subscription.getId().equals(subscriptionId)) {
        return subscriptions.remove(subscription);
      }
    }
    return false;
  }

  public List<EventSubscription<E>> getSubscriptions() {
    return Collections.unmodifiableList(subscriptions);
  }

  public int getPendingEvents() {
    return queue.size();
  }

  /**
   * Oldest first.
   */
  public List<DispatchRecord<E>> getDispatchHistory() {
    return dispatchHistory.toList();
  }

  public EventStatistics<E> getStatistics() {
    final Map<E, Long> counts = new EnumMap<>(eventType);
    for (final Map.Entry<E, AtomicLong> entry : countsByType.entrySet()) {
      counts.put(entry.getKey(), entry.getValue().get());
    }
    final QueuedEvent<E> head = queue.peek();
    final long headWaitMillis =
        head == null ? 0L : Math.max(0L, System.currentTimeMillis() - head.getEnqueuedAt());
    return new EventStatistics<>(totalDispatches.get(), successfulDispatches.get(),
        failedDispatches.get(), counts, queue.size(), headWaitMillis);
  }

  private QueuedEvent<E> enqueue(final E event, final Object payload, final int priority,
      final long entrySequence) throws MachineException {
    checkRunning(event);
    if (priority < 0) {
      throw new IllegalArgumentException("Priority cannot be negative, but was: " + priority);
    }
    final QueuedEvent<E> queued = new QueuedEvent<>(event, payload, priority,
        System.currentTimeMillis(), sequencer.incrementAndGet(), entrySequence);
    queue.offer(queued);
    logger.debug("Enqueued " + queued);
    return queued;
  }

  private void checkRunning(final E event) throws MachineException {
    if (event == null) {
      throw new IllegalArgumentException("Event cannot be null");
    }
    if (!running.get()) {
      throw new MachineException(Code.MACHINE_NOT_ALIVE,
          "Dispatcher of machine " + machineId + " is not running, rejected " + event);
    }
  }

  private DispatchRecord<E> process(final QueuedEvent<E> event, final boolean immediate) {
    final long startMillis = System.currentTimeMillis();
    boolean success = false;
    String error = null;
    try {
      handler.handle(event);
      success = true;
    } catch (MachineException exception) {
      error = exception.getCode() + ": " + exception.getMessage();
      logger.debug(String.format("Failed to process %s, %s", event, error));
    } catch (RuntimeException exception) {
      error = Code.UNKNOWN_FAILURE + ": " + exception;
      logger.error("Handler blew up while processing " + event, exception);
    }
    final int notified = notifySubscribers(event, Optional.ofNullable(error));
    final long processedAt = System.currentTimeMillis();
    final DispatchRecord<E> record = new DispatchRecord<>(event, processedAt,
        processedAt - startMillis, immediate, success, notified, error);
    dispatchHistory.add(record);
    totalDispatches.incrementAndGet();
    if (success) {
      successfulDispatches.incrementAndGet();
    } else {
      failedDispatches.incrementAndGet();
    }
    AtomicLong typeCount = countsByType.get(event.getType());
    if (typeCount == null) {
      countsByType.putIfAbsent(event.getType(), new AtomicLong());
      typeCount = countsByType.get(event.getType());
    }
    typeCount.incrementAndGet();
    return record;
  }

  private int notifySubscribers(final QueuedEvent<E> event, final Optional<String> failure) {
    int notified = 0;
    for (final EventSubscription<E> subscription : subscriptions) {
      try {
        if (!subscription.matches(event)) {
          continue;
        }
        if (subscription.isOnce() && !subscriptions.remove(subscription)) {
          // another thread already fired it
          continue;
        }
        subscription.deliver(event, failure);
        notified++;
      } catch (Exception exception) {
        if (subscription.isOnce()) {
          subscriptions.add(subscription);
        }
        logger.warn(String.format("Subscription %s failed on %s: %s", subscription.getId(),
            event.getType(), exception));
      }
    }
    return notified;
  }

  /**
   * Per-dispatcher polling loop, alive between {@link #start()} and {@link #stop()}.
   */
  private final class DispatchLoop extends Thread {
    private DispatchLoop() {
      setName("event-dispatcher-" + machineId);
      setDaemon(true);
    }

    @Override
    public void run() {
      while (!isInterrupted()) {
        try {
          final QueuedEvent<E> next = queue.poll(pollIntervalMillis, TimeUnit.MILLISECONDS);
          if (next != null) {
            process(next, false);
          }
        } catch (InterruptedException exception) {
          Thread.currentThread().interrupt();
        } catch (RuntimeException exception) {
          logger.error("Dispatch loop caught unexpected failure", exception);
        }
      }
      logger.info("Successfully shut down dispatch loop");
    }
  }
}
