package com.scholary.vocal.coach.performance;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

/**
 * Named weighting profile for the overall score.
 */
public enum PracticeMode {
  FULL("full", new PerformanceWeights(0.4, 0.25, 0.2, 0.15)),
  WORDS("words", new PerformanceWeights(0.1, 0.15, 0.05, 0.7)),
  TIMING("timing", new PerformanceWeights(0.1, 0.7, 0.05, 0.15)),
  PITCH("pitch", new PerformanceWeights(0.7, 0.1, 0.2, 0.0));

  private final String wireName;
  private final PerformanceWeights weights;

  PracticeMode(String wireName, PerformanceWeights weights) {
    this.wireName = wireName;
    this.weights = weights;
  }

  @JsonValue
  public String wireName() {
    return wireName;
  }

  public PerformanceWeights weights() {
    return weights;
  }

  /**
   * Parse a wire name, case-insensitively.
   *
   * @throws IllegalArgumentException for unknown modes
   */
  @JsonCreator
  public static PracticeMode fromWireName(String value) {
    if (value == null) {
      return FULL;
    }
    String normalized = value.trim().toLowerCase(Locale.ROOT);
    for (PracticeMode mode : values()) {
      if (mode.wireName.equals(normalized)) {
        return mode;
      }
    }
    throw new IllegalArgumentException("Unknown practice mode: " + value);
  }
}
