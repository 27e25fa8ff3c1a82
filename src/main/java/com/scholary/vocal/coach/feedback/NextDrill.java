package com.scholary.vocal.coach.feedback;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * The single drill recommended after an attempt.
 *
 * <p>{@code targetSegmentIndex} and {@code repeatCount} are only set for {@link
 * DrillType#REPEAT_SEGMENT}. Use the factory methods rather than the constructor.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record NextDrill(
    DrillType type, Integer targetSegmentIndex, Integer repeatCount, String note) {

  static final int REPEAT_COUNT = 3;

  public static NextDrill repeatSegment(int targetSegmentIndex) {
    return new NextDrill(
        DrillType.REPEAT_SEGMENT,
        targetSegmentIndex,
        REPEAT_COUNT,
        "Repeat the weakest line (" + (targetSegmentIndex + 1) + ") three times for clarity.");
  }

  public static NextDrill timingLock() {
    return new NextDrill(
        DrillType.TIMING_LOCK, null, null, "Clap the beat, then sing the line to lock timing.");
  }

  public static NextDrill slowDown() {
    return new NextDrill(
        DrillType.SLOW_DOWN,
        null,
        null,
        "Slow the verse slightly and land the word starts on the beat.");
  }

  public static NextDrill accuracyClean() {
    return new NextDrill(
        DrillType.ACCURACY_CLEAN,
        null,
        null,
        "Repeat the verse focusing on clean word delivery.");
  }
}
