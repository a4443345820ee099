package com.github.fsmhub;

import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock.ReadLock;
import java.util.concurrent.locks.ReentrantReadWriteLock.WriteLock;
import java.util.function.Predicate;

import com.github.fsmhub.MachineException.Code;
import com.github.fsmhub.TransitionExecutor.ExecutorMetrics;

/**
 * A live machine: one {@link MachineDefinition} bound to one {@link MachineContext}, with its own
 * validator, executor, dispatcher and history recorder.
 * 
 * Notes for users:<br>
 * 1. this instance is thread-safe; any number of threads may send events to it. All context
 * mutation happens under the instance write lock, one transition at a time<br>
 * 
 * 2. it is designed to not be singleton within a process, create as many as needed. Instances
 * share nothing, so transitions of distinct instances run truly concurrently<br>
 * 
 * 3. when a state with an invoked service is entered, the service starts on a daemon worker with a
 * read-only snapshot of the context. Its result or failure comes back as the state's done or error
 * event, tagged with the state entry that started it; tagged events arriving after the state was
 * left are dropped<br>
 * 
 * 4. leaving a state or overrunning its timeout cancels its still-running service<br>
 * 
 * 5. the instance runs until {@link #shutdown()}; reaching a terminal state only stops it from
 * accepting events<br>
 */
public final class MachineInstance<S extends Enum<S>, E extends Enum<E>>
    implements StateMachine<S, E> {
  // service completions are served ahead of regular traffic, failures ahead of everything
  static final int COMPLETION_PRIORITY = 1;
  static final int FAILURE_PRIORITY = 0;

  private final String machineId;
  private final MachineDefinition<S, E> definition;
  private final MachineConfiguration config;
  private final MachineLogger logger;

  private final MachineContext<S, E> context;
  private final TransitionValidator<S, E> validator;
  private final TransitionExecutor<S, E> executor;
  private final EventDispatcher<E> dispatcher;
  private final HistoryRecorder<S, E> recorder;

  // instance level locks guarding the live context
  private final ReentrantReadWriteLock machineSuperLock = new ReentrantReadWriteLock(true);
  private final WriteLock machineWriteLock = machineSuperLock.writeLock();
  private final ReadLock machineReadLock = machineSuperLock.readLock();

  private final AtomicBoolean machineAlive = new AtomicBoolean();
  private final AtomicLong entrySequence = new AtomicLong();
  private final ExecutorService serviceWorkers;
  private final ScheduledExecutorService timeoutTimer;
  private final Object stateMonitor = new Object();
  private final long createdMillis = System.currentTimeMillis();

  private volatile S currentState;
  private volatile ServiceHandle activeService;
  private volatile long lastActivityMillis = createdMillis;

  public MachineInstance(final String machineId, final MachineDefinition<S, E> definition,
      final MachineConfiguration config) throws MachineException {
    if (machineId == null || machineId.trim().isEmpty()) {
      throw new MachineException(Code.INVALID_MACHINE_CONFIG, "Machine id cannot be blank");
    }
    if (definition == null) {
      throw new MachineException(Code.INVALID_MACHINE_DEFINITION);
    }
    if (config == null) {
      throw new MachineException(Code.INVALID_MACHINE_CONFIG);
    }
    this.machineId = machineId;
    this.definition = definition;
    this.config = config;
    this.logger = MachineLogger.forComponent(MachineInstance.class, machineId);
    logger.info("Firing up " + definition + " with " + config);

    this.context = new MachineContext<>(machineId, config.getVersion(),
        config.getConfigEntries(), definition.getInitialState(),
        config.getContextHistoryCapacity());
    context.seed(config.getInitialValues());
    this.validator = new TransitionValidator<>(definition, config.getValidationHistoryCapacity(),
        MachineLogger.forComponent(TransitionValidator.class, machineId));
    this.executor = new TransitionExecutor<>(definition, validator, config.getInvariantMode(),
        MachineLogger.forComponent(TransitionExecutor.class, machineId));
    this.recorder = new HistoryRecorder<>(machineId, definition.getStateType(),
        definition.getEventType(), config,
        MachineLogger.forComponent(HistoryRecorder.class, machineId));
    this.dispatcher = new EventDispatcher<>(machineId, definition.getEventType(), config,
        new EventHandler<E>() {
          @Override
          public void handle(final QueuedEvent<E> event) throws MachineException {
            processEvent(event);
          }
        }, MachineLogger.forComponent(EventDispatcher.class, machineId));
    this.serviceWorkers = Executors.newCachedThreadPool(new DaemonThreadFactory("service-"
        + machineId));
    this.timeoutTimer = Executors.newSingleThreadScheduledExecutor(new DaemonThreadFactory(
        "service-timer-" + machineId));

    currentState = definition.getInitialState();
    machineAlive.set(true);
    // the initial state's service may post its completion right away
    dispatcher.start();
    try {
      enterInitialState();
    } catch (MachineException exception) {
      machineAlive.set(false);
      dispatcher.stop();
      serviceWorkers.shutdownNow();
      timeoutTimer.shutdownNow();
      logger.error("Failed to fire up machine", exception);
      throw exception;
    }
    logger.info("Successfully fired up machine at " + currentState);
  }

  @Override
  public boolean sendEvent(final E event, final Object payload) throws MachineException {
    return sendEvent(event, payload, config.getDefaultPriority());
  }

  @Override
  public boolean sendEvent(final E event, final Object payload, final int priority)
      throws MachineException {
    checkAlive();
    if (!admit(event)) {
      return false;
    }
    dispatcher.dispatch(event, payload, priority);
    lastActivityMillis = System.currentTimeMillis();
    return true;
  }

  @Override
  public boolean sendEventImmediate(final E event, final Object payload)
      throws MachineException {
    checkAlive();
    if (!admit(event)) {
      return false;
    }
    final DispatchRecord<E> record = dispatcher.dispatchImmediate(event, payload);
    return record.isSuccess();
  }

  @Override
  public S getCurrentState() {
    return currentState;
  }

  @Override
  public MachineContext<S, E> getContext() throws MachineException {
    try {
      if (machineReadLock.tryLock(config.getLockAcquisitionMillis(), TimeUnit.MILLISECONDS)) {
        try {
          return context.snapshot();
        } finally {
          machineReadLock.unlock();
        }
      } else {
        throw new MachineException(Code.OPERATION_LOCK_ACQUISITION_FAILURE,
            "Timed out while trying to snapshot context of " + machineId);
      }
    } catch (InterruptedException exception) {
      Thread.currentThread().interrupt();
      throw new MachineException(Code.OPERATION_LOCK_ACQUISITION_FAILURE, exception);
    }
  }

  @Override
  public boolean isHealthy() {
    return machineAlive.get() && definition.getStateDefinition(currentState).isHealthy();
  }

  @Override
  public boolean isAlive() {
    return machineAlive.get();
  }

  @Override
  public boolean awaitState(final S state, final long timeout, final TimeUnit unit)
      throws MachineException {
    final long deadline = System.nanoTime() + unit.toNanos(timeout);
    synchronized (stateMonitor) {
      while (currentState != state) {
        final long remaining = deadline - System.nanoTime();
        if (remaining <= 0L || !machineAlive.get()) {
          return currentState == state;
        }
        try {
          TimeUnit.NANOSECONDS.timedWait(stateMonitor, remaining);
        } catch (InterruptedException exception) {
          Thread.currentThread().interrupt();
          throw new MachineException(Code.INTERRUPTED, exception);
        }
      }
      return true;
    }
  }

  /**
   * Processes the next queued event on the calling thread, meant for {@link DispatchMode#MANUAL}.
   */
  public Optional<DispatchRecord<E>> processNext() {
    return dispatcher.processNext();
  }

  public int drain() {
    return dispatcher.drain();
  }

  @Override
  public String subscribe(final Set<E> events, final EventListener<E> listener,
      final Predicate<Object> filter, final boolean once) {
    return dispatcher.subscribe(events, listener, filter, once);
  }

  public String subscribe(final E event, final EventListener<E> listener) {
    return dispatcher.subscribe(event, listener);
  }

  @Override
  public boolean unsubscribe(final String subscriptionId) {
    return dispatcher.unsubscribe(subscriptionId);
  }

  @Override
  public void shutdown() {
    if (!machineAlive.compareAndSet(true, false)) {
      logger.info("Machine is already shut down");
      return;
    }
    logger.info("Shutting down machine at " + currentState);
    dispatcher.stop();
    final ServiceHandle running = activeService;
    if (running != null && running.cancel()) {
      logger.info("Cancelled running service " + running.getServiceName());
    }
    activeService = null;
    serviceWorkers.shutdownNow();
    timeoutTimer.shutdownNow();
    synchronized (stateMonitor) {
      stateMonitor.notifyAll();
    }
    logger.info(recorder.getMetrics().toString());
    logger.info(executor.getMetrics().toString());
    logger.info("Successfully shut down machine");
  }

  @Override
  public MachineInstance<S, E> recreate() throws MachineException {
    return new MachineInstance<>(machineId, definition, config);
  }

  @Override
  public String getMachineId() {
    return machineId;
  }

  @Override
  public String getDefinitionName() {
    return definition.getName();
  }

  @Override
  public String getCurrentStateName() {
    return currentState.name();
  }

  @Override
  public int getPendingEvents() {
    return dispatcher.getPendingEvents();
  }

  @Override
  public int getActiveTransitions() {
    return executor.isInFlight() ? 1 : 0;
  }

  @Override
  public long getLastActivityMillis() {
    return lastActivityMillis;
  }

  @Override
  public List<PerformanceAlert> checkAlerts() {
    return recorder.evaluateAlerts(dispatcher.getPendingEvents());
  }

  @Override
  public List<PerformanceAlert> getActiveAlerts() {
    return recorder.getActiveAlerts();
  }

  public long getUptimeMillis() {
    return System.currentTimeMillis() - createdMillis;
  }

  @Override
  public MachineDefinition<S, E> getDefinition() {
    return definition;
  }

  public MachineConfiguration getConfiguration() {
    return config;
  }

  public TransitionValidator<S, E> getValidator() {
    return validator;
  }

  public HistoryRecorder<S, E> getHistoryRecorder() {
    return recorder;
  }

  public EventStatistics<E> getEventStatistics() {
    return dispatcher.getStatistics();
  }

  public List<DispatchRecord<E>> getDispatchHistory() {
    return dispatcher.getDispatchHistory();
  }

  public ExecutorMetrics getExecutorMetrics() {
    return executor.getMetrics();
  }

  private boolean admit(final E event) {
    final S state = currentState;
    if (validator.validateEvent(state, event)) {
      return true;
    }
    logger.info(String.format("Refused event %s, not legal in state %s", event, state));
    recorder.recordEvent(event, state, 0L, false, "Event " + event + " is not legal in " + state);
    return false;
  }

  private void processEvent(final QueuedEvent<E> event) throws MachineException {
    checkAlive();
    try {
      if (!machineWriteLock.tryLock(config.getLockAcquisitionMillis(), TimeUnit.MILLISECONDS)) {
        throw new MachineException(Code.OPERATION_LOCK_ACQUISITION_FAILURE,
            "Timed out while trying to process " + event);
      }
    } catch (InterruptedException exception) {
      Thread.currentThread().interrupt();
      throw new MachineException(Code.OPERATION_LOCK_ACQUISITION_FAILURE, exception);
    }
    final long startMillis = System.currentTimeMillis();
    try {
      final S from = context.getCurrentState();
      final Optional<Long> tag = event.getEntrySequence();
      if (tag.isPresent() && tag.get() != entrySequence.get()) {
        final String reason = String.format("Dropped stale %s, its state entry %d is gone",
            event.getType(), tag.get());
        logger.info(reason);
        recorder.recordEvent(event.getType(), from, 0L, false, reason);
        throw new MachineException(Code.INVALID_EVENT, reason);
      }
      final Optional<TransitionDefinition<S, E>> transition =
          validator.validateEvent(from, event.getType())
              ? definition.findTransition(from, event.getType())
              : Optional.<TransitionDefinition<S, E>>empty();
      if (!transition.isPresent()) {
        final String reason = "Event " + event.getType() + " is not legal in " + from;
        recorder.recordEvent(event.getType(), from, 0L, false, reason);
        throw new MachineException(Code.INVALID_EVENT, reason);
      }

      final TransitionExecutionResult<S, E> result =
          executor.execute(transition.get(), context, event);
      recorder.recordTransition(result.getRecord());
      if (result.isCommitted()) {
        changeState(transition.get().getTo());
      }
      lastActivityMillis = System.currentTimeMillis();
      recorder.recordEvent(event.getType(), from, lastActivityMillis - startMillis,
          result.isSuccess(), result.getError().orElse(null));
      if (!result.isSuccess()) {
        final Code code = result.getErrorCode().orElse(Code.UNKNOWN_FAILURE);
        if (code == Code.INVARIANT_VIOLATION) {
          postFailureEvent(result);
        }
        throw new MachineException(code, result.getError().orElse(code.getDescription()));
      }
    } finally {
      machineWriteLock.unlock();
    }
  }

  private void enterInitialState() throws MachineException {
    try {
      if (!machineWriteLock.tryLock(config.getLockAcquisitionMillis(), TimeUnit.MILLISECONDS)) {
        throw new MachineException(Code.OPERATION_LOCK_ACQUISITION_FAILURE);
      }
    } catch (InterruptedException exception) {
      Thread.currentThread().interrupt();
      throw new MachineException(Code.OPERATION_LOCK_ACQUISITION_FAILURE, exception);
    }
    try {
      final StateDefinition<S, E> initial =
          definition.getStateDefinition(definition.getInitialState());
      if (initial.getEntry().isPresent()) {
        try {
          initial.getEntry().get().apply(context);
        } catch (Exception exception) {
          throw new MachineException(Code.HOOK_FAILURE,
              "Entry hook of initial state " + initial.getState() + " failed", exception);
        }
      }
      entrySequence.incrementAndGet();
      startService(initial);
    } finally {
      machineWriteLock.unlock();
    }
  }

  // caller holds the write lock
  private void changeState(final S to) {
    final ServiceHandle previous = activeService;
    activeService = null;
    if (previous != null && previous.cancel()) {
      logger.info(String.format("Cancelled service %s on leaving its state",
          previous.getServiceName()));
    }
    entrySequence.incrementAndGet();
    synchronized (stateMonitor) {
      currentState = to;
      stateMonitor.notifyAll();
    }
    final StateDefinition<S, E> entered = definition.getStateDefinition(to);
    if (entered.isTerminal()) {
      logger.info("Reached terminal state " + to + ", no further events will be accepted");
    }
    startService(entered);
  }

  // caller holds the write lock
  private void startService(final StateDefinition<S, E> state) {
    if (!state.getService().isPresent()) {
      return;
    }
    final long sequence = entrySequence.get();
    final MachineContext<S, E> snapshot = context.snapshot();
    final InvokedService<S, E> service = state.getService().get();
    final Future<?> execution = serviceWorkers.submit(new Runnable() {
      @Override
      public void run() {
        runService(state, service, snapshot, sequence);
      }
    });
    final ServiceHandle handle = new ServiceHandle(state.getServiceName(), sequence, execution);
    if (state.hasTimeout()) {
      handle.setTimer(timeoutTimer.schedule(new Runnable() {
        @Override
        public void run() {
          onServiceTimeout(state, handle);
        }
      }, state.getTimeoutMillis(), TimeUnit.MILLISECONDS));
    }
    activeService = handle;
    logger.debug(String.format("Started service %s for %s", state.getServiceName(),
        state.getState()));
  }

  private void runService(final StateDefinition<S, E> state, final InvokedService<S, E> service,
      final MachineContext<S, E> snapshot, final long sequence) {
    final Object result;
    try {
      result = service.invoke(snapshot);
    } catch (InterruptedException exception) {
      Thread.currentThread().interrupt();
      logger.info(String.format("Service %s of %s was cancelled", state.getServiceName(),
          state.getState()));
      return;
    } catch (Exception exception) {
      if (Thread.currentThread().isInterrupted()) {
        logger.info(String.format("Service %s of %s was cancelled", state.getServiceName(),
            state.getState()));
        return;
      }
      if (state.getErrorEvent().isPresent()) {
        logger.warn(String.format("Service %s of %s failed: %s", state.getServiceName(),
            state.getState(), exception));
        post(state.getErrorEvent().get(), exception, COMPLETION_PRIORITY, sequence);
      } else {
        logger.error(String.format("Service %s of %s failed with no error event to route to",
            state.getServiceName(), state.getState()), exception);
      }
      return;
    }
    if (Thread.currentThread().isInterrupted()) {
      logger.info(String.format("Discarded result of cancelled service %s",
          state.getServiceName()));
      return;
    }
    if (state.getDoneEvent().isPresent()) {
      post(state.getDoneEvent().get(), result, COMPLETION_PRIORITY, sequence);
    } else {
      logger.info(String.format("Service %s of %s completed", state.getServiceName(),
          state.getState()));
    }
  }

  // the timer stays armed until the state is left, a finished service alone doesn't disarm it
  private void onServiceTimeout(final StateDefinition<S, E> state, final ServiceHandle handle) {
    if (activeService != handle) {
      return;
    }
    final ServiceTimeout timeout = new ServiceTimeout(state.getState().name(),
        state.getServiceName(), state.getTimeoutMillis());
    if (handle.cancel()) {
      logger.warn(timeout.getReason() + ", cancelled it");
      post(state.getTimeoutEvent().get(), timeout, FAILURE_PRIORITY, handle.getEntrySequence());
    } else {
      // queued behind the completion already posted for this entry, stale once that one moves on
      logger.warn(String.format("%s without leaving %s", timeout.getReason(), state.getState()));
      post(state.getTimeoutEvent().get(), timeout, COMPLETION_PRIORITY,
          handle.getEntrySequence());
    }
  }

  private void postFailureEvent(final TransitionExecutionResult<S, E> result) {
    final Optional<E> failureEvent = definition.getFailureEvent();
    if (!failureEvent.isPresent()) {
      return;
    }
    if (!validator.validateEvent(context.getCurrentState(), failureEvent.get())) {
      logger.warn(String.format("Failure event %s has no route out of %s",
          failureEvent.get(), context.getCurrentState()));
      return;
    }
    try {
      dispatcher.dispatch(failureEvent.get(), result.getError().orElse(null), FAILURE_PRIORITY);
    } catch (MachineException exception) {
      logger.warn("Could not post failure event: " + exception.getMessage());
    }
  }

  private void post(final E event, final Object payload, final int priority,
      final long sequence) {
    try {
      dispatcher.dispatchTagged(event, payload, priority, sequence);
    } catch (MachineException exception) {
      logger.warn(String.format("Dropped %s, %s", event, exception.getMessage()));
    }
  }

  private void checkAlive() throws MachineException {
    if (!machineAlive.get()) {
      throw new MachineException(Code.MACHINE_NOT_ALIVE,
          "Machine " + machineId + " is shut down");
    }
  }

  @Override
  public String toString() {
    return "MachineInstance [machineId=" + machineId + ", definition=" + definition.getName()
        + ", currentState=" + currentState + ", alive=" + machineAlive.get() + "]";
  }

  private static final class DaemonThreadFactory implements ThreadFactory {
    private final String prefix;
    private final AtomicInteger counter = new AtomicInteger();

    private DaemonThreadFactory(final String prefix) {
      this.prefix = prefix;
    }

    @Override
    public Thread newThread(final Runnable runnable) {
      final Thread thread = new Thread(runnable, prefix + "-" + counter.incrementAndGet());
      thread.setDaemon(true);
      return thread;
    }
  }
}
