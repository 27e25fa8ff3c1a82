package com.scholary.vocal.coach.alignment;

import java.util.List;

/**
 * Aggregate numbers over one alignment.
 *
 * @param wordAccuracyPct share of reference words with a correct status, 0-100
 * @param timingMeanAbsMs mean |deltaMs| over correct words only
 * @param paceRatio user duration / reference duration (1 when unknown)
 * @param missedWords reference words that were missed or sung incorrectly, in order
 * @param extraWords user words that had no reference slot, in order
 */
public record AlignmentMetrics(
    int wordAccuracyPct,
    int timingMeanAbsMs,
    double paceRatio,
    List<String> missedWords,
    List<String> extraWords) {

  public AlignmentMetrics {
    missedWords = List.copyOf(missedWords);
    extraWords = List.copyOf(extraWords);
  }
}
