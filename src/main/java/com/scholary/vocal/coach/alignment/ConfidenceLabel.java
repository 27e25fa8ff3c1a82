package com.scholary.vocal.coach.alignment;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.List;

/**
 * Coarse bucket for a confidence value in [0, 1].
 */
public enum ConfidenceLabel {
  HIGH("High"),
  MEDIUM("Medium"),
  LOW("Low");

  static final double HIGH_THRESHOLD = 0.78;
  static final double MEDIUM_THRESHOLD = 0.5;

  private final String displayName;

  ConfidenceLabel(String displayName) {
    this.displayName = displayName;
  }

  @JsonValue
  public String displayName() {
    return displayName;
  }

  public static ConfidenceLabel of(double confidence) {
    if (confidence >= HIGH_THRESHOLD) {
      return HIGH;
    }
    if (confidence >= MEDIUM_THRESHOLD) {
      return MEDIUM;
    }
    return LOW;
  }

  /**
   * Bucket the unweighted mean of the given confidences. An empty list is {@link #LOW}.
   */
  public static ConfidenceLabel ofAverage(List<Double> confidences) {
    if (confidences.isEmpty()) {
      return LOW;
    }
    double total = 0.0;
    for (double confidence : confidences) {
      total += confidence;
    }
    return of(total / confidences.size());
  }
}
