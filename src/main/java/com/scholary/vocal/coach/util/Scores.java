package com.scholary.vocal.coach.util;

/**
 * Rounding and clamping helpers shared by every scoring stage.
 *
 * <p>All rounding goes through {@link #round(double)} so that scores come out identical no matter
 * which stage produced them. Halves round away from zero: {@code 2.5 -> 3}, {@code -2.5 -> -3}.
 */
public final class Scores {

  private Scores() {
    // Utility class - prevent instantiation
  }

  /**
   * Round half away from zero.
   *
   * @param value the value to round (NaN rounds to 0)
   * @return the rounded value
   */
  public static long round(double value) {
    if (Double.isNaN(value)) {
      return 0L;
    }
    return value < 0 ? -Math.round(-value) : Math.round(value);
  }

  /**
   * Round half away from zero, saturating at {@code ±Integer.MAX_VALUE} so that the result always
   * has a representable absolute value.
   */
  public static int roundToInt(double value) {
    long rounded = round(value);
    return (int) Math.max(-Integer.MAX_VALUE, Math.min(Integer.MAX_VALUE, rounded));
  }

  public static double clamp(double value, double min, double max) {
    return Math.max(min, Math.min(max, value));
  }

  public static int clamp(int value, int min, int max) {
    return Math.max(min, Math.min(max, value));
  }

  /**
   * Round and clamp into the {@code [0, 100]} score range.
   *
   * @param value raw score
   * @return score in [0, 100]
   */
  public static int toScore(double value) {
    return roundToInt(clamp(value, 0.0, 100.0));
  }
}
