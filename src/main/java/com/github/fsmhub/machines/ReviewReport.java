package com.github.fsmhub.machines;

/**
 * Outcome of reviewing one architecture step. Scores range from 0 to 100.
 */
public final class ReviewReport {
  private final ArchitectureState step;
  private final int score;
  private final String notes;

  public ReviewReport(final ArchitectureState step, final int score, final String notes) {
    if (score < 0 || score > 100) {
      throw new IllegalArgumentException("Score must be within [0, 100], was " + score);
    }
    this.step = step;
    this.score = score;
    this.notes = notes;
  }

  public ArchitectureState getStep() {
    return step;
  }

  public int getScore() {
    return score;
  }

  public String getNotes() {
    return notes;
  }

  @Override
  public String toString() {
    return "ReviewReport [step=" + step + ", score=" + score + ", notes=" + notes + "]";
  }
}
