package com.scholary.vocal.coach.alignment;

import com.scholary.vocal.coach.transcript.WordToken;
import java.util.List;

/**
 * Full output of {@link WordAligner#align}.
 *
 * @param perWord one result per reference token, in reference order
 * @param extras user tokens left without a reference slot
 * @param metrics aggregate metrics
 */
public record AlignmentResult(
    List<AlignmentWordResult> perWord, List<WordToken> extras, AlignmentMetrics metrics) {

  public AlignmentResult {
    perWord = List.copyOf(perWord);
    extras = List.copyOf(extras);
  }

  public int matchedCount() {
    return (int) perWord.stream().filter(AlignmentWordResult::hasUserWord).count();
  }
}
