package com.scholary.vocal.coach.alignment;

/**
 * Tuning for a single alignment run.
 *
 * @param referenceOffsetSec subtracted from every reference timestamp
 * @param userOffsetSec subtracted from every user timestamp, usually the estimated lag
 * @param earlyLateThresholdMs a correct word further than this from its cue is early/late
 * @param referenceDurationSec reference duration for the pace ratio, null if unknown
 * @param userDurationSec user duration for the pace ratio, null if unknown
 */
public record AlignmentOptions(
    double referenceOffsetSec,
    double userOffsetSec,
    int earlyLateThresholdMs,
    Double referenceDurationSec,
    Double userDurationSec) {

  public static final int DEFAULT_EARLY_LATE_THRESHOLD_MS = 200;

  public static AlignmentOptions defaults() {
    return new AlignmentOptions(0.0, 0.0, DEFAULT_EARLY_LATE_THRESHOLD_MS, null, null);
  }

  public AlignmentOptions withUserOffsetSec(double offsetSec) {
    return new AlignmentOptions(
        referenceOffsetSec, offsetSec, earlyLateThresholdMs, referenceDurationSec, userDurationSec);
  }

  public AlignmentOptions withDurations(Double referenceSec, Double userSec) {
    return new AlignmentOptions(
        referenceOffsetSec, userOffsetSec, earlyLateThresholdMs, referenceSec, userSec);
  }

  /**
   * User duration over reference duration, or 1 when either is unknown or not positive.
   */
  public double paceRatio() {
    if (referenceDurationSec == null || userDurationSec == null) {
      return 1.0;
    }
    if (referenceDurationSec <= 0 || userDurationSec <= 0) {
      return 1.0;
    }
    return userDurationSec / referenceDurationSec;
  }
}
