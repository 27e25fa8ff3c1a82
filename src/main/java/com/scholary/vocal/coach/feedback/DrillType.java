package com.scholary.vocal.coach.feedback;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Kinds of follow-up drill, in no particular order. Selection priority lives in {@link
 * FeedbackBuilder}.
 */
public enum DrillType {
  REPEAT_SEGMENT("repeat_segment"),
  SLOW_DOWN("slow_down"),
  TIMING_LOCK("timing_lock"),
  ACCURACY_CLEAN("accuracy_clean");

  private final String wireName;

  DrillType(String wireName) {
    this.wireName = wireName;
  }

  @JsonValue
  public String wireName() {
    return wireName;
  }
}
