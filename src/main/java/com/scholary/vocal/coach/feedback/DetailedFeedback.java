package com.scholary.vocal.coach.feedback;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.scholary.vocal.coach.alignment.AlignmentWordResult;
import com.scholary.vocal.coach.alignment.ConfidenceLabel;
import java.util.List;

/**
 * Word, segment and drill report for one attempt.
 *
 * <p>{@code message} is set only for incomplete takes; {@code warnings} is empty unless the
 * transcription confidence was low.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record DetailedFeedback(
    int wordAccuracyPct,
    int timingMeanAbsMs,
    double paceRatio,
    List<AlignmentWordResult> perWord,
    List<SegmentFeedback> segments,
    List<String> coachTips,
    NextDrill nextDrill,
    Subscores subscores,
    List<String> missedWords,
    List<String> extraWords,
    List<Substitution> substitutions,
    ConfidenceLabel confidenceLabel,
    Double estimatedOffsetMs,
    String message,
    List<String> warnings) {

  public DetailedFeedback {
    perWord = List.copyOf(perWord);
    segments = List.copyOf(segments);
    coachTips = List.copyOf(coachTips);
    missedWords = List.copyOf(missedWords);
    extraWords = List.copyOf(extraWords);
    substitutions = List.copyOf(substitutions);
    warnings = List.copyOf(warnings);
  }

  public boolean isIncompleteTake() {
    return message != null;
  }
}
