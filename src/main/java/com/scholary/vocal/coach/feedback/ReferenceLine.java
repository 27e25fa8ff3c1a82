package com.scholary.vocal.coach.feedback;

/**
 * A lyric line of the reference transcript with its declared span in seconds.
 */
public record ReferenceLine(int index, String text, double start, double end) {

  public ReferenceLine {
    if (text == null) {
      text = "";
    }
  }
}
