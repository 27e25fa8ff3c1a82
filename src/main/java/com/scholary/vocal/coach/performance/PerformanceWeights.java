package com.scholary.vocal.coach.performance;

/**
 * Relative weights of the four subscores in the overall blend.
 */
public record PerformanceWeights(double pitch, double timing, double stability, double words) {

  /**
   * Rescale so the weights sum to 1. A zero total is left as-is.
   */
  public PerformanceWeights normalized() {
    double total = pitch + timing + stability + words;
    if (total == 0) {
      total = 1;
    }
    return new PerformanceWeights(pitch / total, timing / total, stability / total, words / total);
  }
}
