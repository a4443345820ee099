package com.github.fsmhub.machines;

/**
 * Result of one deployment stage as reported by {@link DeploymentServices}.
 */
public final class StageReport {
  private final String stage;
  private final boolean passed;
  private final String message;

  public StageReport(final String stage, final boolean passed, final String message) {
    this.stage = stage;
    this.passed = passed;
    this.message = message;
  }

  public static StageReport passed(final DeploymentState stage) {
    return new StageReport(stage.name(), true, stage.name() + " done");
  }

  public static StageReport failed(final DeploymentState stage, final String message) {
    return new StageReport(stage.name(), false, message);
  }

  public String getStage() {
    return stage;
  }

  public boolean isPassed() {
    return passed;
  }

  public String getMessage() {
    return message;
  }

  @Override
  public String toString() {
    return "StageReport [stage=" + stage + ", passed=" + passed + ", message=" + message + "]";
  }
}
