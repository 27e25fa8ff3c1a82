package com.scholary.vocal.coach.feedback;

import com.scholary.vocal.coach.transcript.WordToken;
import java.util.List;

/**
 * Input for {@link FeedbackBuilder#build(FeedbackRequest)}.
 *
 * @param referenceWords reference word timeline
 * @param userWords transcribed user word timeline
 * @param referenceLines lyric lines, empty to segment by pauses instead
 * @param verseStartSec verse start on the reference timeline
 * @param verseEndSec verse end on the reference timeline
 * @param estimatedOffsetMs recording lag behind the reference, null if not estimated
 */
public record FeedbackRequest(
    List<WordToken> referenceWords,
    List<WordToken> userWords,
    List<ReferenceLine> referenceLines,
    double verseStartSec,
    double verseEndSec,
    Double estimatedOffsetMs) {

  public FeedbackRequest {
    referenceWords = referenceWords == null ? List.of() : List.copyOf(referenceWords);
    userWords = userWords == null ? List.of() : List.copyOf(userWords);
    referenceLines = referenceLines == null ? List.of() : List.copyOf(referenceLines);
  }

  public double verseDuration() {
    return Math.max(0.0, verseEndSec - verseStartSec);
  }
}
