package com.github.fsmhub.machines;

import com.github.fsmhub.MachineContext;

/**
 * Review work behind the architecture steps. Both calls receive a read-only context snapshot and
 * default to a perfect score.
 */
public interface ArchitectureServices {

  default ReviewReport review(final ArchitectureState step,
      final MachineContext<ArchitectureState, ArchitectureEvent> context) throws Exception {
    return new ReviewReport(step, 100, "approved");
  }

  default ReviewReport optimize(final MachineContext<ArchitectureState, ArchitectureEvent> context)
      throws Exception {
    return new ReviewReport(ArchitectureState.ARCHITECTURE_OPTIMIZATION, 100, "optimized");
  }

}
