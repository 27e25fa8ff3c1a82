package com.scholary.vocal.coach.performance;

import java.util.List;

/**
 * Signals for one attempt, as produced by the pitch-extraction collaborator.
 *
 * <p>Durations, offset and word score are nullable: null means "not measured", which is different
 * from a measured 0. Lists default to empty.
 *
 * @param referenceDurationSec reference audio duration
 * @param recordingDurationSec recording duration
 * @param referenceContour reference pitch contour
 * @param recordingContour recording pitch contour
 * @param referenceEnvelope reference energy envelope, fixed step
 * @param recordingEnvelope recording energy envelope, fixed step
 * @param estimatedOffsetMs recording lag behind the reference
 * @param practiceMode weighting profile, null for {@link PracticeMode#FULL}
 * @param wordScore externally computed word score, 0-100
 */
public record PerformanceInput(
    Double referenceDurationSec,
    Double recordingDurationSec,
    List<PitchSample> referenceContour,
    List<PitchSample> recordingContour,
    List<Double> referenceEnvelope,
    List<Double> recordingEnvelope,
    Double estimatedOffsetMs,
    PracticeMode practiceMode,
    Integer wordScore) {

  public PerformanceInput {
    referenceContour = referenceContour == null ? List.of() : List.copyOf(referenceContour);
    recordingContour = recordingContour == null ? List.of() : List.copyOf(recordingContour);
    referenceEnvelope = referenceEnvelope == null ? List.of() : List.copyOf(referenceEnvelope);
    recordingEnvelope = recordingEnvelope == null ? List.of() : List.copyOf(recordingEnvelope);
    if (practiceMode == null) {
      practiceMode = PracticeMode.FULL;
    }
  }
}
