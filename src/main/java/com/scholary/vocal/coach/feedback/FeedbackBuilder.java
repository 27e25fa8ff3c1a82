package com.scholary.vocal.coach.feedback;

import com.scholary.vocal.coach.alignment.AlignmentOptions;
import com.scholary.vocal.coach.alignment.AlignmentResult;
import com.scholary.vocal.coach.alignment.AlignmentStatus;
import com.scholary.vocal.coach.alignment.AlignmentWordResult;
import com.scholary.vocal.coach.alignment.ConfidenceLabel;
import com.scholary.vocal.coach.alignment.WordAligner;
import com.scholary.vocal.coach.transcript.TokenNormalizer;
import com.scholary.vocal.coach.transcript.WordToken;
import com.scholary.vocal.coach.util.Scores;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns an aligned attempt into segment scores, coaching tips and one recommended drill.
 *
 * <p>Pipeline:
 *
 * <ol>
 *   <li>Coverage guard: if the user stopped well before the end of the verse, only the part they
 *       actually sang is scored
 *   <li>Word alignment against the offset-corrected user timeline
 *   <li>Segmentation and per-segment scoring
 *   <li>Report-level scores, tips, drill and confidence warnings
 * </ol>
 *
 * <p>Word accuracy is weighted: a correct word counts 1, an incorrect word whose confidence is
 * below {@value #SOFT_PENALTY_CONFIDENCE} counts 0.5 since it is more likely transcription noise
 * than a real mistake.
 */
public class FeedbackBuilder {

  private static final Logger LOGGER = LoggerFactory.getLogger(FeedbackBuilder.class);

  static final double MIN_COVERAGE = 0.6;
  static final double COVERAGE_GRACE_SEC = 0.5;
  static final double TIME_EPSILON_SEC = 0.01;
  static final double SOFT_PENALTY_CONFIDENCE = 0.45;
  static final int TIMING_WARNING_MS = 250;
  static final int ACCURACY_TIP_PCT = 75;
  static final int REPEAT_SEGMENT_PCT = 70;
  static final double RUSHING_PACE = 1.12;
  static final double DRAGGING_PACE = 0.88;
  static final int OFFSET_NOTE_MS = 40;
  static final int MAX_SEGMENT_ISSUE_WORDS = 4;
  static final int MAX_TIP_WORDS = 5;

  static final String INCOMPLETE_TAKE_MESSAGE =
      "You stopped early-record the full verse to score it.";
  static final String LOW_CONFIDENCE_WARNING =
      "Low transcription confidence; word penalties softened.";

  private final WordAligner aligner;
  private final Segmenter segmenter;
  private final int earlyLateThresholdMs;

  public FeedbackBuilder(WordAligner aligner, Segmenter segmenter, int earlyLateThresholdMs) {
    this.aligner = aligner;
    this.segmenter = segmenter;
    this.earlyLateThresholdMs = earlyLateThresholdMs;
  }

  /**
   * Build the detailed report for one attempt.
   *
   * @param request reference/user timelines, optional lines, verse bounds and offset
   * @return the report, never null
   */
  public DetailedFeedback build(FeedbackRequest request) {
    List<WordToken> userWords = request.userWords();
    double verseDuration = request.verseDuration();
    double userDuration =
        userWords.isEmpty()
            ? 0.0
            : Math.max(0.0, last(userWords).end() - userWords.get(0).start());
    double lastUserEnd = userWords.isEmpty() ? 0.0 : last(userWords).end();

    double coverage = verseDuration > 0 ? lastUserEnd / verseDuration : 1.0;
    boolean incomplete = coverage < MIN_COVERAGE;
    double coverageEnd =
        verseDuration > 0
            ? Math.min(verseDuration, lastUserEnd + COVERAGE_GRACE_SEC)
            : lastUserEnd;

    List<WordToken> referenceWords = request.referenceWords();
    List<ReferenceLine> referenceLines = request.referenceLines();
    if (incomplete) {
      double cutoff = coverageEnd + TIME_EPSILON_SEC;
      referenceWords = referenceWords.stream().filter(w -> w.start() <= cutoff).toList();
      referenceLines = referenceLines.stream().filter(l -> l.start() <= cutoff).toList();
      LOGGER.debug(
          "Incomplete take: coverage={}, scoring {} of {} reference words up to {}s",
          String.format("%.2f", coverage),
          referenceWords.size(),
          request.referenceWords().size(),
          String.format("%.2f", coverageEnd));
    }

    double offsetSec =
        request.estimatedOffsetMs() == null ? 0.0 : request.estimatedOffsetMs() / 1000.0;
    AlignmentOptions options =
        new AlignmentOptions(0.0, offsetSec, earlyLateThresholdMs, verseDuration, userDuration);
    AlignmentResult alignment = aligner.align(referenceWords, userWords, options);

    List<SegmentFeedback> segments =
        scoreSegments(segmenter.segment(referenceLines, referenceWords), referenceWords, alignment);

    List<AlignmentWordResult> perWord = alignment.perWord();
    double paceRatio = alignment.metrics().paceRatio();
    int timingMeanAbsMs = alignment.metrics().timingMeanAbsMs();
    int wordAccuracyPct =
        perWord.isEmpty() ? alignment.metrics().wordAccuracyPct() : weightedAccuracy(perWord);

    List<String> coachTips =
        coachTips(
            wordAccuracyPct,
            timingMeanAbsMs,
            paceRatio,
            alignment.metrics().missedWords(),
            request.estimatedOffsetMs());
    NextDrill nextDrill = selectDrill(segments, timingMeanAbsMs, paceRatio);

    List<Substitution> substitutions =
        perWord.stream()
            .filter(w -> w.status() == AlignmentStatus.INCORRECT && w.hasUserWord())
            .map(
                w ->
                    new Substitution(
                        w.refWord(), w.userWord(), w.confidence(), w.confidenceLabel()))
            .toList();

    ConfidenceLabel confidenceLabel =
        ConfidenceLabel.ofAverage(
            perWord.stream()
                .map(AlignmentWordResult::confidence)
                .filter(Objects::nonNull)
                .toList());
    List<String> warnings =
        confidenceLabel == ConfidenceLabel.LOW ? List.of(LOW_CONFIDENCE_WARNING) : List.of();

    DetailedFeedback feedback =
        new DetailedFeedback(
            wordAccuracyPct,
            timingMeanAbsMs,
            paceRatio,
            perWord,
            segments,
            coachTips,
            nextDrill,
            Subscores.from(wordAccuracyPct, timingMeanAbsMs, paceRatio),
            normalizedNonEmpty(alignment.metrics().missedWords()),
            normalizedNonEmpty(alignment.metrics().extraWords()),
            substitutions,
            confidenceLabel,
            request.estimatedOffsetMs(),
            incomplete ? INCOMPLETE_TAKE_MESSAGE : null,
            warnings);

    LOGGER.debug(
        "Built feedback: {} segments, accuracy={}%, timing={}ms, pace={}, drill={}",
        segments.size(),
        wordAccuracyPct,
        timingMeanAbsMs,
        String.format("%.2f", paceRatio),
        nextDrill.type().wireName());
    return feedback;
  }

  /**
   * Score each segment from the results of the reference words inside its span. Results are paired
   * with reference words by position, one result per word in order.
   */
  private List<SegmentFeedback> scoreSegments(
      List<SegmentFeedback> segments, List<WordToken> referenceWords, AlignmentResult alignment) {
    List<AlignmentWordResult> perWord = alignment.perWord();

    List<SegmentFeedback> scored = new ArrayList<>(segments.size());
    for (SegmentFeedback segment : segments) {
      List<AlignmentWordResult> aligned = new ArrayList<>();
      for (int i = 0; i < referenceWords.size(); i++) {
        WordToken word = referenceWords.get(i);
        if (word.start() >= segment.start() && word.end() <= segment.end() + TIME_EPSILON_SEC) {
          aligned.add(perWord.get(i));
        }
      }

      int accuracyPct = aligned.isEmpty() ? 0 : weightedAccuracy(aligned);
      int timingMs = meanAbsDeltaOfCorrect(aligned);
      scored.add(segment.withScores(accuracyPct, timingMs, segmentIssues(aligned, timingMs)));
    }
    return scored;
  }

  static int weightedAccuracy(List<AlignmentWordResult> words) {
    double weightedCorrect = 0.0;
    for (AlignmentWordResult word : words) {
      if (word.status().isCorrect()) {
        weightedCorrect += 1.0;
      } else if (word.status() == AlignmentStatus.INCORRECT
          && word.hasConfidence()
          && word.confidence() < SOFT_PENALTY_CONFIDENCE) {
        weightedCorrect += 0.5;
      }
    }
    return Scores.roundToInt(100.0 * weightedCorrect / words.size());
  }

  private static int meanAbsDeltaOfCorrect(List<AlignmentWordResult> words) {
    List<Integer> deltas =
        words.stream()
            .filter(w -> w.status().isCorrect() && w.deltaMs() != null)
            .map(w -> Math.abs(w.deltaMs()))
            .toList();
    if (deltas.isEmpty()) {
      return 0;
    }
    return Scores.roundToInt(deltas.stream().mapToInt(Integer::intValue).average().orElse(0.0));
  }

  static List<String> segmentIssues(List<AlignmentWordResult> words, int timingMeanAbsMs) {
    List<String> issues = new ArrayList<>();
    List<String> missed =
        words.stream()
            .filter(w -> w.status() == AlignmentStatus.MISSED)
            .map(AlignmentWordResult::refWord)
            .toList();
    List<String> incorrect =
        words.stream()
            .filter(w -> w.status() == AlignmentStatus.INCORRECT)
            .map(AlignmentWordResult::refWord)
            .toList();

    if (!missed.isEmpty()) {
      issues.add("Missed " + joinFirst(missed, MAX_SEGMENT_ISSUE_WORDS) + ".");
    }
    if (!incorrect.isEmpty() && issues.size() < 2) {
      issues.add("Incorrect words: " + joinFirst(incorrect, MAX_SEGMENT_ISSUE_WORDS) + ".");
    }
    if (timingMeanAbsMs > TIMING_WARNING_MS) {
      issues.add("Timing off by ~" + timingMeanAbsMs + "ms.");
    }
    if (issues.isEmpty()) {
      issues.add("Nice line. Keep the timing consistent.");
    }
    return issues;
  }

  // Every applicable tip is added, in this order.
  static List<String> coachTips(
      int wordAccuracyPct,
      int timingMeanAbsMs,
      double paceRatio,
      List<String> missedWords,
      Double estimatedOffsetMs) {
    List<String> tips = new ArrayList<>();
    if (wordAccuracyPct < ACCURACY_TIP_PCT) {
      tips.add(
          missedWords.isEmpty()
              ? "Focus on lyric accuracy - keep the words tight."
              : "Focus on the missed words: " + joinFirst(missedWords, MAX_TIP_WORDS) + ".");
    }
    if (timingMeanAbsMs > TIMING_WARNING_MS) {
      String offsetNote =
          estimatedOffsetMs != null && Math.abs(estimatedOffsetMs) > OFFSET_NOTE_MS
              ? " (offset corrected by " + Scores.round(estimatedOffsetMs) + "ms)"
              : "";
      tips.add(
          "Timing is off by about "
              + timingMeanAbsMs
              + "ms"
              + offsetNote
              + ". Lock into the reference cue.");
    }
    if (paceRatio > RUSHING_PACE) {
      tips.add("You're rushing this verse. Slow down slightly and match the phrasing.");
    }
    if (paceRatio < DRAGGING_PACE) {
      tips.add("You're dragging a bit. Push forward to match the reference pace.");
    }
    if (tips.isEmpty()) {
      tips.add("Nice take - aim for even tighter timing on the next pass.");
    }
    return tips;
  }

  // First matching rule wins.
  static NextDrill selectDrill(
      List<SegmentFeedback> segments, int timingMeanAbsMs, double paceRatio) {
    SegmentFeedback worst = null;
    for (SegmentFeedback segment : segments) {
      if (worst == null || segment.wordAccuracyPct() < worst.wordAccuracyPct()) {
        worst = segment;
      }
    }
    if (worst != null && worst.wordAccuracyPct() < REPEAT_SEGMENT_PCT) {
      return NextDrill.repeatSegment(worst.segmentIndex());
    }
    if (timingMeanAbsMs > TIMING_WARNING_MS) {
      return NextDrill.timingLock();
    }
    if (paceRatio > RUSHING_PACE) {
      return NextDrill.slowDown();
    }
    return NextDrill.accuracyClean();
  }

  private static List<String> normalizedNonEmpty(List<String> words) {
    return words.stream()
        .map(TokenNormalizer::normalizeToken)
        .filter(word -> !word.isEmpty())
        .toList();
  }

  private static String joinFirst(List<String> words, int limit) {
    return String.join(", ", words.subList(0, Math.min(limit, words.size())));
  }

  private static WordToken last(List<WordToken> words) {
    return words.get(words.size() - 1);
  }
}
