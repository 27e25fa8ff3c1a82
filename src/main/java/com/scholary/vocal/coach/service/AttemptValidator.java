package com.scholary.vocal.coach.service;

import com.scholary.vocal.coach.api.AttemptAnalysisRequest;
import com.scholary.vocal.coach.config.CoachingProperties;
import com.scholary.vocal.coach.transcript.WordToken;
import java.util.List;
import org.springframework.stereotype.Component;

/**
 * Rejects attempts the analysis components are not meant to see.
 *
 * <p>The components themselves accept any well-typed input. This is where negative times,
 * reversed spans, out-of-order words, implausible offsets and oversized alignments get turned
 * away.
 */
@Component
public class AttemptValidator {

  /** Largest start lag a caller may supply, one minute either way. */
  static final double MAX_PROVIDED_OFFSET_MS = 60_000;

  private final long maxAlignmentCells;

  public AttemptValidator(CoachingProperties properties) {
    this.maxAlignmentCells = properties.alignment().maxAlignmentCells();
  }

  /**
   * Validate the request together with the word timelines resolved from it.
   *
   * @throws InvalidAttemptException naming the first offending field
   */
  public void validate(
      AttemptAnalysisRequest request,
      List<WordToken> referenceWords,
      List<WordToken> userWords) {
    if (request.verseStartSec() == null || request.verseEndSec() == null) {
      throw new InvalidAttemptException("verseStartSec and verseEndSec are required");
    }
    requireNonNegative("verseStartSec", request.verseStartSec());
    requireNonNegative("verseEndSec", request.verseEndSec());
    if (request.verseEndSec() < request.verseStartSec()) {
      throw new InvalidAttemptException("verseEndSec must not be before verseStartSec");
    }
    requireNonNegative("referenceDurationSec", request.referenceDurationSec());
    requireNonNegative("recordingDurationSec", request.recordingDurationSec());
    validateOffset(request.estimatedOffsetMs());

    validateTimeline("referenceWords", referenceWords);
    validateTimeline("userWords", userWords);

    long cells = (long) referenceWords.size() * userWords.size();
    if (cells > maxAlignmentCells) {
      throw new InvalidAttemptException(
          String.format(
              "referenceWords x userWords = %d exceeds the limit of %d",
              cells, maxAlignmentCells));
    }
  }

  private static void validateTimeline(String field, List<WordToken> words) {
    double previousStart = 0.0;
    for (int i = 0; i < words.size(); i++) {
      WordToken word = words.get(i);
      String name = field + "[" + i + "]";
      requireNonNegative(name + ".start", word.start());
      if (word.end() < word.start()) {
        throw new InvalidAttemptException(name + ".end must not be before start");
      }
      if (i > 0 && word.start() < previousStart) {
        throw new InvalidAttemptException(name + ".start must not be before the previous word");
      }
      previousStart = word.start();
    }
  }

  private static void validateOffset(Double offsetMs) {
    if (offsetMs == null) {
      return;
    }
    if (!Double.isFinite(offsetMs) || Math.abs(offsetMs) > MAX_PROVIDED_OFFSET_MS) {
      throw new InvalidAttemptException(
          String.format("estimatedOffsetMs must be within +/-%.0f", MAX_PROVIDED_OFFSET_MS));
    }
  }

  private static void requireNonNegative(String field, Double value) {
    if (value == null) {
      return;
    }
    if (value.isNaN() || value < 0) {
      throw new InvalidAttemptException(field + " must be a non-negative number");
    }
  }
}
