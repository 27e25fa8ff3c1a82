package com.scholary.vocal.coach.alignment;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.scholary.vocal.coach.transcript.WordToken;

/**
 * Alignment verdict for one reference word.
 *
 * <p>Exactly one of these exists per reference token. User fields, {@code deltaMs} are null for
 * {@link AlignmentStatus#MISSED} words. Times are already offset-corrected.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record AlignmentWordResult(
    int refIndex,
    String refWord,
    double refStart,
    double refEnd,
    AlignmentStatus status,
    String userWord,
    Double userStart,
    Double userEnd,
    Integer deltaMs,
    Double confidence,
    ConfidenceLabel confidenceLabel) {

  static AlignmentWordResult matched(
      WordToken reference,
      WordToken user,
      double referenceOffsetSec,
      double userOffsetSec,
      AlignmentStatus status,
      int deltaMs,
      double confidence) {
    return new AlignmentWordResult(
        reference.index(),
        reference.word(),
        reference.start() - referenceOffsetSec,
        reference.end() - referenceOffsetSec,
        status,
        user.word(),
        user.start() - userOffsetSec,
        user.end() - userOffsetSec,
        deltaMs,
        confidence,
        ConfidenceLabel.of(confidence));
  }

  static AlignmentWordResult missed(WordToken reference, double referenceOffsetSec) {
    return new AlignmentWordResult(
        reference.index(),
        reference.word(),
        reference.start() - referenceOffsetSec,
        reference.end() - referenceOffsetSec,
        AlignmentStatus.MISSED,
        null,
        null,
        null,
        null,
        0.0,
        ConfidenceLabel.LOW);
  }

  public boolean hasUserWord() {
    return userWord != null;
  }

  public boolean hasConfidence() {
    return confidence != null;
  }
}
