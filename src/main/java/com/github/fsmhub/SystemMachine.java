package com.github.fsmhub;

import static com.github.fsmhub.SystemEvent.ERROR_OCCURRED;
import static com.github.fsmhub.SystemEvent.FORCE_SHUTDOWN;
import static com.github.fsmhub.SystemEvent.HEALTH_CHECK;
import static com.github.fsmhub.SystemEvent.INITIALIZE;
import static com.github.fsmhub.SystemEvent.PAUSE;
import static com.github.fsmhub.SystemEvent.RECOVERY_COMPLETE;
import static com.github.fsmhub.SystemEvent.RECOVERY_STARTED;
import static com.github.fsmhub.SystemEvent.RESUME;
import static com.github.fsmhub.SystemEvent.STOP;
import static com.github.fsmhub.SystemEvent.TRANSITION_COMPLETE;
import static com.github.fsmhub.SystemState.ACTIVE;
import static com.github.fsmhub.SystemState.ERROR;
import static com.github.fsmhub.SystemState.IDLE;
import static com.github.fsmhub.SystemState.INITIALIZING;
import static com.github.fsmhub.SystemState.RECOVERING;
import static com.github.fsmhub.SystemState.SHUTDOWN;
import static com.github.fsmhub.SystemState.SUSPENDED;

import java.util.concurrent.TimeUnit;

import com.github.fsmhub.MachineException.Code;

/**
 * Definition of the supervisory machine describing the overall system lifecycle:
 * 
 * <pre>
 * IDLE -> INITIALIZING -> ACTIVE <-> SUSPENDED
 * ACTIVE | SUSPENDED | ERROR -> SHUTDOWN (terminal)
 * ERROR -> RECOVERING -> ACTIVE
 * </pre>
 * 
 * INITIALIZING, ERROR, RECOVERING and SHUTDOWN invoke the matching {@link SystemServices} call.
 * Recovery is given up after {@value #MAX_RECOVERY_ATTEMPTS} attempts or on a critical fault. An
 * initialization finishing later than the {@value #CONFIG_OPERATION_TIMEOUT_MILLIS} config entry
 * allows fails like any other initialization error.
 */
public final class SystemMachine {
  public static final String NAME = "system";
  public static final int MAX_RECOVERY_ATTEMPTS = 3;
  public static final long INITIALIZATION_TIMEOUT_MILLIS = TimeUnit.SECONDS.toMillis(30L);
  public static final double CPU_LIMIT_PERCENT = 80.0d;
  public static final double MEMORY_LIMIT_PERCENT = 85.0d;

  public static final String CONFIG_VALID = "configuration.valid";
  public static final String CONFIG_OPERATION_TIMEOUT_MILLIS = "operation.timeout.millis";

  public static final ContextKey<Boolean> INITIALIZED = ContextKey.of("initialized", Boolean.class);
  public static final ContextKey<Boolean> CRITICAL_OPERATION =
      ContextKey.of("criticalOperation", Boolean.class);
  public static final ContextKey<Integer> RECOVERY_ATTEMPTS =
      ContextKey.of("recoveryAttempts", Integer.class);
  public static final ContextKey<Boolean> CRITICAL_ERROR =
      ContextKey.of("criticalError", Boolean.class);
  public static final ContextKey<String> LAST_ERROR = ContextKey.of("lastError", String.class);
  public static final ContextKey<Double> CPU_USAGE = ContextKey.of("cpuUsage", Double.class);
  public static final ContextKey<Double> MEMORY_USAGE = ContextKey.of("memoryUsage", Double.class);
  public static final ContextKey<Long> OPERATION_STARTED =
      ContextKey.of("operationStartTime", Long.class);
  public static final ContextKey<Long> LAST_HEALTH_CHECK =
      ContextKey.of("lastHealthCheck", Long.class);

  public static final TransitionGuard<SystemState, SystemEvent> CAN_INITIALIZE =
      TransitionGuard.of("canInitialize", "System is not idle or already initialized",
          context -> context.getCurrentState() == IDLE
              && !context.getOrDefault(INITIALIZED, Boolean.FALSE));
  public static final TransitionGuard<SystemState, SystemEvent> CAN_SUSPEND =
      TransitionGuard.of("canSuspend", "System is not active or runs a critical operation",
          context -> context.getCurrentState() == ACTIVE
              && !context.getOrDefault(CRITICAL_OPERATION, Boolean.FALSE));
  public static final TransitionGuard<SystemState, SystemEvent> CAN_RESUME =
      TransitionGuard.of("canResume", "System is not suspended or was never initialized",
          context -> context.getCurrentState() == SUSPENDED
              && context.getOrDefault(INITIALIZED, Boolean.FALSE));
  public static final TransitionGuard<SystemState, SystemEvent> CAN_SHUTDOWN =
      TransitionGuard.of("canShutdown", "System can only shut down from active, suspended or error",
          context -> context.getCurrentState() == ACTIVE || context.getCurrentState() == SUSPENDED
              || context.getCurrentState() == ERROR);
  public static final TransitionGuard<SystemState, SystemEvent> CAN_RECOVER =
      TransitionGuard.of("canRecover", "Recovery attempts exhausted or error is critical",
          context -> context.getCurrentState() == ERROR
              && context.getOrDefault(RECOVERY_ATTEMPTS, 0) < MAX_RECOVERY_ATTEMPTS
              && !context.getOrDefault(CRITICAL_ERROR, Boolean.FALSE));
  public static final TransitionGuard<SystemState, SystemEvent> WITHIN_RESOURCE_LIMITS =
      TransitionGuard.of("withinResourceLimits", "CPU or memory usage above limits",
          context -> context.getOrDefault(CPU_USAGE, 0.0d) < CPU_LIMIT_PERCENT
              && context.getOrDefault(MEMORY_USAGE, 0.0d) < MEMORY_LIMIT_PERCENT);
  public static final TransitionGuard<SystemState, SystemEvent> HAS_VALID_CONFIGURATION =
      TransitionGuard.of("hasValidConfiguration", "Configuration is missing a version or invalid",
          context -> context.getVersion() != null && !context.getVersion().isEmpty()
              && !"false".equalsIgnoreCase(context.getMetadata().get(CONFIG_VALID)));

  private SystemMachine() {}

  public static MachineDefinition<SystemState, SystemEvent> definition(
      final SystemServices services) throws MachineException {
    if (services == null) {
      throw new MachineException(Code.INVALID_MACHINE_DEFINITION, "SystemServices cannot be null");
    }
    final MachineDefinition.Builder<SystemState, SystemEvent> builder =
        MachineDefinition.newBuilder(NAME, SystemState.class, SystemEvent.class);
    builder.initialState(IDLE)
        .eventGuard(INITIALIZE, WITHIN_RESOURCE_LIMITS)
        .eventGuard(RECOVERY_COMPLETE, WITHIN_RESOURCE_LIMITS);

    builder.state(INITIALIZING)
        .invoke("initializeSystem", context -> withinOperationTimeout(context,
            services.initializeSystem(context)), TRANSITION_COMPLETE, ERROR_OCCURRED)
        .timeout(INITIALIZATION_TIMEOUT_MILLIS, ERROR_OCCURRED).add();
    builder.state(ERROR).unhealthy()
        .invoke("attemptRecovery", context -> {
          if (context.getOrDefault(RECOVERY_ATTEMPTS, 0) >= MAX_RECOVERY_ATTEMPTS
              || context.getOrDefault(CRITICAL_ERROR, Boolean.FALSE)) {
            throw new MachineException(Code.SERVICE_FAILURE, "Recovery is not possible");
          }
          return services.attemptRecovery(context);
        }, RECOVERY_STARTED, null).add();
    builder.state(RECOVERING)
        .invoke("executeRecovery", context -> services.executeRecovery(context),
            RECOVERY_COMPLETE, ERROR_OCCURRED).add();
    builder.state(SHUTDOWN).terminal().unhealthy()
        .invoke("performShutdown", context -> services.performShutdown(context), null, null)
        .add();

    builder.transition(IDLE, INITIALIZE, INITIALIZING)
        .guard(CAN_INITIALIZE).guard(HAS_VALID_CONFIGURATION)
        .action((context, event) -> context.put(OPERATION_STARTED, System.currentTimeMillis()))
        .add();
    builder.transition(INITIALIZING, TRANSITION_COMPLETE, ACTIVE)
        .action((context, event) -> {
          context.put(INITIALIZED, Boolean.TRUE);
          context.remove(OPERATION_STARTED);
        }).add();
    builder.transition(INITIALIZING, ERROR_OCCURRED, ERROR)
        .action(SystemMachine::recordFault).add();

    builder.transition(ACTIVE, PAUSE, SUSPENDED).guard(CAN_SUSPEND).add();
    builder.transition(ACTIVE, STOP, SHUTDOWN).guard(CAN_SHUTDOWN).add();
    builder.transition(ACTIVE, ERROR_OCCURRED, ERROR).action(SystemMachine::recordFault).add();
    builder.internalTransition(ACTIVE, HEALTH_CHECK)
        .action(SystemMachine::recordHealthCheck).add();

    builder.transition(SUSPENDED, RESUME, ACTIVE).guard(CAN_RESUME).add();
    builder.transition(SUSPENDED, STOP, SHUTDOWN).add();

    builder.transition(ERROR, RECOVERY_STARTED, RECOVERING).guard(CAN_RECOVER)
        .action((context, event) -> context.put(RECOVERY_ATTEMPTS,
            context.getOrDefault(RECOVERY_ATTEMPTS, 0) + 1))
        .add();
    builder.transition(ERROR, RECOVERY_COMPLETE, ACTIVE).guard(CAN_RECOVER).add();
    builder.transition(ERROR, FORCE_SHUTDOWN, SHUTDOWN).add();

    builder.transition(RECOVERING, RECOVERY_COMPLETE, ACTIVE)
        .action((context, event) -> {
          context.put(RECOVERY_ATTEMPTS, 0);
          context.remove(LAST_ERROR);
        }).add();
    builder.transition(RECOVERING, ERROR_OCCURRED, ERROR)
        .action(SystemMachine::recordFault).add();
    return builder.build();
  }

  public static MachineInstance<SystemState, SystemEvent> newInstance(final String machineId,
      final SystemServices services, final MachineConfiguration config) throws MachineException {
    return new MachineInstance<>(machineId, definition(services), config);
  }

  private static void recordFault(final MachineContext<SystemState, SystemEvent> context,
      final QueuedEvent<SystemEvent> event) {
    final Object payload = event == null ? null : event.getPayload();
    String message = "Unknown error";
    if (payload instanceof SystemFault) {
      final SystemFault fault = (SystemFault) payload;
      message = fault.getMessage();
      if (fault.isCritical()) {
        context.put(CRITICAL_ERROR, Boolean.TRUE);
      }
    } else if (payload instanceof ServiceTimeout) {
      message = ((ServiceTimeout) payload).getReason();
    } else if (payload instanceof Throwable) {
      message = String.valueOf(((Throwable) payload).getMessage());
    } else if (payload != null) {
      message = payload.toString();
    }
    context.put(LAST_ERROR, message);
  }

  private static void recordHealthCheck(final MachineContext<SystemState, SystemEvent> context,
      final QueuedEvent<SystemEvent> event) {
    context.put(LAST_HEALTH_CHECK, System.currentTimeMillis());
    if (event != null && event.payload(ResourceUsage.class).isPresent()) {
      final ResourceUsage usage = event.payload(ResourceUsage.class).get();
      context.put(CPU_USAGE, usage.getCpuPercent());
      context.put(MEMORY_USAGE, usage.getMemoryPercent());
    }
  }

  /**
   * Fails an initialization that finished past the configured operation timeout, measured from the
   * INITIALIZE transition.
   */
  private static Object withinOperationTimeout(
      final MachineContext<SystemState, SystemEvent> context, final Object result)
      throws MachineException {
    if (!context.contains(OPERATION_STARTED)) {
      return result;
    }
    final long elapsedMillis =
        System.currentTimeMillis() - context.getOrDefault(OPERATION_STARTED, 0L);
    final long timeoutMillis = operationTimeout(context);
    if (elapsedMillis > timeoutMillis) {
      throw new MachineException(Code.SERVICE_TIMEOUT, String.format(
          "Initialization took %d millis, past its %d millis timeout", elapsedMillis,
          timeoutMillis));
    }
    return result;
  }

  private static long operationTimeout(final MachineContext<SystemState, SystemEvent> context) {
    final String configured = context.getMetadata().get(CONFIG_OPERATION_TIMEOUT_MILLIS);
    if (configured == null) {
      return INITIALIZATION_TIMEOUT_MILLIS;
    }
    try {
      return Long.parseLong(configured.trim());
    } catch (NumberFormatException exception) {
      return INITIALIZATION_TIMEOUT_MILLIS;
    }
  }
}
