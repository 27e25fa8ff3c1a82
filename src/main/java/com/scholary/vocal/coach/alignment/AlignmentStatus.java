package com.scholary.vocal.coach.alignment;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Outcome of aligning one reference word.
 */
public enum AlignmentStatus {
  CORRECT("correct"),
  CORRECT_EARLY("correct_early"),
  CORRECT_LATE("correct_late"),
  INCORRECT("incorrect"),
  MISSED("missed"),
  /** A user word with no reference slot. Reported separately, never scored. */
  EXTRA_IGNORED("extra_ignored");

  private final String wireName;

  AlignmentStatus(String wireName) {
    this.wireName = wireName;
  }

  @JsonValue
  public String wireName() {
    return wireName;
  }

  /** True for the three "correct" variants regardless of timing. */
  public boolean isCorrect() {
    return this == CORRECT || this == CORRECT_EARLY || this == CORRECT_LATE;
  }
}
