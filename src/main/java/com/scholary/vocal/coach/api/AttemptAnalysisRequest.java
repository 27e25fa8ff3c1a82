package com.scholary.vocal.coach.api;

import com.scholary.vocal.coach.feedback.ReferenceLine;
import com.scholary.vocal.coach.performance.PitchSample;
import com.scholary.vocal.coach.performance.PracticeMode;
import com.scholary.vocal.coach.transcript.TranscriptSegment;
import com.scholary.vocal.coach.transcript.WordToken;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import jakarta.validation.constraints.Size;
import java.util.List;

/**
 * Request for analyzing one sung attempt against its reference.
 *
 * <p>Word timelines can be given directly or as transcript segments, which are flattened into
 * words when the corresponding word list is empty. Signal fields are optional: without contours or
 * envelopes the performance subscores fall back to their neutral defaults.
 */
public record AttemptAnalysisRequest(
    @Size(max = 64) String attemptId,
    List<WordToken> referenceWords,
    List<WordToken> userWords,
    List<TranscriptSegment> referenceSegments,
    List<TranscriptSegment> userSegments,
    List<ReferenceLine> referenceLines,
    @NotNull @PositiveOrZero Double verseStartSec,
    @NotNull @PositiveOrZero Double verseEndSec,
    Double estimatedOffsetMs,
    @PositiveOrZero Double referenceDurationSec,
    @PositiveOrZero Double recordingDurationSec,
    List<PitchSample> referenceContour,
    List<PitchSample> recordingContour,
    List<Double> referenceEnvelope,
    List<Double> recordingEnvelope,
    PracticeMode practiceMode) {

  // Provide defaults
  public AttemptAnalysisRequest {
    referenceWords = referenceWords == null ? List.of() : referenceWords;
    userWords = userWords == null ? List.of() : userWords;
    referenceSegments = referenceSegments == null ? List.of() : referenceSegments;
    userSegments = userSegments == null ? List.of() : userSegments;
    referenceLines = referenceLines == null ? List.of() : referenceLines;
    referenceContour = referenceContour == null ? List.of() : referenceContour;
    recordingContour = recordingContour == null ? List.of() : recordingContour;
    referenceEnvelope = referenceEnvelope == null ? List.of() : referenceEnvelope;
    recordingEnvelope = recordingEnvelope == null ? List.of() : recordingEnvelope;
    if (practiceMode == null) {
      practiceMode = PracticeMode.FULL;
    }
  }

  public boolean hasEnvelopes() {
    return !referenceEnvelope.isEmpty() && !recordingEnvelope.isEmpty();
  }
}
