package com.scholary.vocal.coach.transcript;

import java.util.List;

/**
 * A segment of transcribed audio as returned by the speech-to-text collaborator.
 *
 * <p>Some engines report per-word timings inside each segment, others only the segment text and
 * span. {@code words} is empty in the latter case.
 */
public record TranscriptSegment(double start, double end, String text, List<WordTiming> words) {

  public TranscriptSegment {
    if (text == null) {
      text = "";
    }
    words = words == null ? List.of() : List.copyOf(words);
  }

  public static TranscriptSegment ofText(double start, double end, String text) {
    return new TranscriptSegment(start, end, text, List.of());
  }

  /** A word with its own timing inside a segment. */
  public record WordTiming(String word, double start, double end) {}
}
