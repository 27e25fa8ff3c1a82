package com.scholary.vocal.coach.feedback;

import com.scholary.vocal.coach.util.Scores;

/**
 * Word-level subscores, each 0-100.
 */
public record Subscores(int wordAccuracy, int timing, int pace) {

  static Subscores from(int wordAccuracyPct, int timingMeanAbsMs, double paceRatio) {
    return new Subscores(
        Scores.clamp(wordAccuracyPct, 0, 100),
        Scores.toScore(100 - timingMeanAbsMs / 5.0),
        Scores.toScore(100 - Math.abs(1 - paceRatio) * 200));
  }
}
