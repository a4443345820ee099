package com.github.fsmhub;

import java.util.Collections;

import com.github.fsmhub.MachineConfiguration.MachineConfigurationBuilder;

/**
 * Small job lifecycle machine shared by the unit tests.
 */
final class Fixtures {
  enum Phase {
    IDLE, RUNNING, PAUSED, DONE;
  }

  enum Signal {
    START, PAUSE, RESUME, FINISH, TICK, FAIL;
  }

  static final ContextKey<Integer> BUDGET = ContextKey.of("budget", Integer.class);
  static final ContextKey<Integer> TICKS = ContextKey.of("ticks", Integer.class);

  static final TransitionGuard<Phase, Signal> HAS_BUDGET =
      TransitionGuard.of("hasBudget", "No budget left",
          context -> context.getOrDefault(BUDGET, 1) > 0);

  private Fixtures() {}

  /**
   * IDLE -START-> RUNNING -FINISH-> DONE, RUNNING <-PAUSE/RESUME-> PAUSED, RUNNING -FAIL-> IDLE and
   * an internal TICK on RUNNING counting ticks.
   */
  static MachineDefinition.Builder<Phase, Signal> jobBuilder() {
    final MachineDefinition.Builder<Phase, Signal> builder =
        MachineDefinition.newBuilder("job", Phase.class, Signal.class);
    builder.initialState(Phase.IDLE);
    builder.state(Phase.DONE).terminal().add();
    builder.transition(Phase.IDLE, Signal.START, Phase.RUNNING).guard(HAS_BUDGET).add();
    builder.transition(Phase.RUNNING, Signal.PAUSE, Phase.PAUSED).add();
    builder.transition(Phase.PAUSED, Signal.RESUME, Phase.RUNNING).add();
    builder.transition(Phase.RUNNING, Signal.FINISH, Phase.DONE).add();
    builder.transition(Phase.RUNNING, Signal.FAIL, Phase.IDLE).add();
    builder.internalTransition(Phase.RUNNING, Signal.TICK)
        .action((context, event) -> context.put(TICKS, context.getOrDefault(TICKS, 0) + 1))
        .add();
    return builder;
  }

  static MachineDefinition<Phase, Signal> jobDefinition() throws MachineException {
    return jobBuilder().build();
  }

  static MachineContext<Phase, Signal> context(final Phase state) {
    return new MachineContext<>("test", MachineConfiguration.DEFAULT_VERSION,
        Collections.<String, String>emptyMap(), state, 10);
  }

  static MachineConfiguration manual() throws MachineException {
    return MachineConfigurationBuilder.newBuilder().dispatchMode(DispatchMode.MANUAL).build();
  }

  static MachineConfiguration auto() throws MachineException {
    return MachineConfigurationBuilder.newBuilder().dispatchMode(DispatchMode.AUTO_ASYNC)
        .pollIntervalMillis(5L).build();
  }

  static MachineLogger logger(final Class<?> component) {
    return MachineLogger.forComponent(component, "test");
  }
}
