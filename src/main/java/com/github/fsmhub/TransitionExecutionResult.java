package com.github.fsmhub;

import java.util.Optional;

import com.github.fsmhub.MachineException.Code;

/**
 * Outcome of executing one transition. {@code committed} tells whether the context moved to the
 * destination state, which can be true for a failed result under
 * {@link InvariantMode#COMMIT_THEN_CHECK}.
 */
public final class TransitionExecutionResult<S extends Enum<S>, E extends Enum<E>> {
  private final TransitionRecord<S, E> record;
  private final int actionsRun;
  private final boolean committed;
  private final Code errorCode;

  TransitionExecutionResult(final TransitionRecord<S, E> record, final int actionsRun,
      final boolean committed, final Code errorCode) {
    this.record = record;
    this.actionsRun = actionsRun;
    this.committed = committed;
    this.errorCode = errorCode;
  }

  public boolean isSuccess() {
    return record.isSuccess();
  }

  public long getDurationMillis() {
    return record.getDurationMillis();
  }

  public int getActionsRun() {
    return actionsRun;
  }

  public boolean isCommitted() {
    return committed;
  }

  public Optional<String> getError() {
    return record.getError();
  }

  public Optional<Code> getErrorCode() {
    return Optional.ofNullable(errorCode);
  }

  public TransitionRecord<S, E> getRecord() {
    return record;
  }

  @Override
  public String toString() {
    return "TransitionExecutionResult [" + record.getFrom() + " --" + record.getEvent() + "--> "
        + record.getTo() + ", success=" + isSuccess() + ", committed=" + committed
        + ", actionsRun=" + actionsRun + ", durationMillis=" + getDurationMillis()
        + ", errorCode=" + errorCode + ", error=" + record.getError().orElse(null) + "]";
  }
}
