package com.github.fsmhub;

/**
 * When destination-state invariants are checked relative to committing the new state.
 */
public enum InvariantMode {
  // hooks, actions and invariants run against a staged copy which is committed only on success
  ATOMIC,
  // the new state is committed first; an invariant violation is reported after the fact
  COMMIT_THEN_CHECK;
}
