package com.scholary.vocal.coach.service;

import com.scholary.vocal.coach.api.AttemptAnalysisRequest;
import com.scholary.vocal.coach.api.CoachingReport;
import com.scholary.vocal.coach.feedback.DetailedFeedback;
import com.scholary.vocal.coach.feedback.FeedbackBuilder;
import com.scholary.vocal.coach.feedback.FeedbackRequest;
import com.scholary.vocal.coach.logging.StructuredLogger;
import com.scholary.vocal.coach.offset.OffsetEstimate;
import com.scholary.vocal.coach.offset.OffsetEstimator;
import com.scholary.vocal.coach.offset.OffsetMethod;
import com.scholary.vocal.coach.performance.PerformanceAnalysisResult;
import com.scholary.vocal.coach.performance.PerformanceInput;
import com.scholary.vocal.coach.performance.PerformanceScorer;
import com.scholary.vocal.coach.transcript.TranscriptSegment;
import com.scholary.vocal.coach.transcript.WordTimeline;
import com.scholary.vocal.coach.transcript.WordToken;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Analyzes one attempt end to end.
 *
 * <p>Workflow:
 *
 * <ol>
 *   <li>Resolve word timelines, flattening transcript segments where no words were given and
 *       numbering words by position
 *   <li>Validate the attempt
 *   <li>Estimate the start offset from the energy envelopes, unless the caller supplied one
 *   <li>Build word-level feedback
 *   <li>Score the performance, feeding in the word accuracy subscore
 * </ol>
 *
 * <p>Stateless: nothing is kept between calls.
 */
@Service
public class CoachingService {

  private static final Logger LOGGER = LoggerFactory.getLogger(CoachingService.class);

  private final AttemptValidator validator;
  private final WordTimeline wordTimeline;
  private final OffsetEstimator offsetEstimator;
  private final FeedbackBuilder feedbackBuilder;
  private final PerformanceScorer performanceScorer;
  private final StructuredLogger structuredLogger = new StructuredLogger(LOGGER);

  public CoachingService(
      AttemptValidator validator,
      WordTimeline wordTimeline,
      OffsetEstimator offsetEstimator,
      FeedbackBuilder feedbackBuilder,
      PerformanceScorer performanceScorer) {
    this.validator = validator;
    this.wordTimeline = wordTimeline;
    this.offsetEstimator = offsetEstimator;
    this.feedbackBuilder = feedbackBuilder;
    this.performanceScorer = performanceScorer;
  }

  /**
   * Analyze an attempt.
   *
   * @param request the attempt
   * @return feedback, performance score and the offset that was applied
   * @throws InvalidAttemptException if the attempt fails validation
   */
  public CoachingReport analyze(AttemptAnalysisRequest request) {
    String attemptId =
        request.attemptId() == null || request.attemptId().isBlank()
            ? UUID.randomUUID().toString()
            : request.attemptId();

    StructuredLogger.setAttemptContext(attemptId);
    try {
      List<WordToken> referenceWords =
          resolveWords(request.referenceWords(), request.referenceSegments());
      List<WordToken> userWords = resolveWords(request.userWords(), request.userSegments());
      validator.validate(request, referenceWords, userWords);

      OffsetEstimate offset = resolveOffset(request);
      Double offsetMs = offset.method() == OffsetMethod.NONE ? null : offset.offsetMs();
      structuredLogger.logOffsetEstimated(offset.offsetMs(), offset.method().wireName());

      DetailedFeedback feedback =
          feedbackBuilder.build(
              new FeedbackRequest(
                  referenceWords,
                  userWords,
                  request.referenceLines(),
                  request.verseStartSec(),
                  request.verseEndSec(),
                  offsetMs));
      structuredLogger.logAlignmentCompleted(
          referenceWords.size(),
          userWords.size(),
          (int) feedback.perWord().stream().filter(w -> w.status().isCorrect()).count(),
          feedback.wordAccuracyPct());
      structuredLogger.logFeedbackBuilt(
          feedback.segments().size(),
          feedback.wordAccuracyPct(),
          feedback.timingMeanAbsMs(),
          feedback.nextDrill().type().wireName(),
          feedback.isIncompleteTake());

      PerformanceAnalysisResult performance =
          performanceScorer.analyze(
              new PerformanceInput(
                  request.referenceDurationSec(),
                  request.recordingDurationSec(),
                  request.referenceContour(),
                  request.recordingContour(),
                  request.referenceEnvelope(),
                  request.recordingEnvelope(),
                  offsetMs,
                  request.practiceMode(),
                  feedback.subscores().wordAccuracy()));
      structuredLogger.logPerformanceScored(
          performance.overall(),
          performance.pitch(),
          performance.timing(),
          performance.stability(),
          request.practiceMode().wireName());

      return new CoachingReport(attemptId, feedback, performance, offset);
    } finally {
      StructuredLogger.clearAttemptContext();
    }
  }

  /** Words as given, renumbered by position, or flattened from segments when none are given. */
  private List<WordToken> resolveWords(List<WordToken> words, List<TranscriptSegment> segments) {
    if (words.isEmpty() && !segments.isEmpty()) {
      return wordTimeline.flatten(segments);
    }
    List<WordToken> indexed = new ArrayList<>(words.size());
    for (int i = 0; i < words.size(); i++) {
      WordToken word = words.get(i);
      indexed.add(new WordToken(word.word(), word.start(), word.end(), i, word.lineIndex()));
    }
    return indexed;
  }

  private OffsetEstimate resolveOffset(AttemptAnalysisRequest request) {
    if (request.estimatedOffsetMs() != null) {
      return OffsetEstimate.provided(request.estimatedOffsetMs());
    }
    if (!request.hasEnvelopes()) {
      return OffsetEstimate.none();
    }
    return offsetEstimator.estimate(request.referenceEnvelope(), request.recordingEnvelope());
  }
}
