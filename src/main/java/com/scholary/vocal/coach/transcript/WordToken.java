package com.scholary.vocal.coach.transcript;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * A single timed word from either the reference track or the user's recording.
 *
 * <p>Times are seconds relative to the start of that audio's own timeline. {@code index} is the
 * token's position within its own sequence and is used as a stable identity key. {@code lineIndex}
 * is only known for reference words that belong to a lyric line.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record WordToken(String word, double start, double end, int index, Integer lineIndex) {

  public WordToken {
    if (word == null) {
      word = "";
    }
  }

  public static WordToken of(String word, double start, double end, int index) {
    return new WordToken(word, start, end, index, null);
  }

  public double duration() {
    return end - start;
  }

  public boolean belongsToLine(int line) {
    return lineIndex != null && lineIndex == line;
  }
}
