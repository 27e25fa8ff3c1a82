package com.scholary.vocal.coach.feedback;

import static org.assertj.core.api.Assertions.assertThat;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import com.scholary.vocal.coach.alignment.AlignmentStatus;
import com.scholary.vocal.coach.alignment.AlignmentWordResult;
import com.scholary.vocal.coach.alignment.ConfidenceLabel;
import com.scholary.vocal.coach.alignment.WordAligner;
import com.scholary.vocal.coach.transcript.WordToken;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

class FeedbackBuilderTest {

  private final FeedbackBuilder builder =
      new FeedbackBuilder(new WordAligner(), new Segmenter(), 200);

  @Test
  void build_perfectTake() {
    List<WordToken> reference = timed("we will rock you", 0.0, 0.5, 0);
    List<WordToken> user = timed("we will rock you", 0.0, 0.5, 0);
    List<ReferenceLine> lines = List.of(new ReferenceLine(0, "We will rock you", 0.0, 2.0));

    DetailedFeedback feedback =
        builder.build(new FeedbackRequest(reference, user, lines, 0, 2, null));

    assertThat(feedback.wordAccuracyPct()).isEqualTo(100);
    assertThat(feedback.timingMeanAbsMs()).isZero();
    assertThat(feedback.paceRatio()).isEqualTo(1.0);
    assertThat(feedback.segments()).hasSize(1);
    assertThat(feedback.segments().get(0).mainIssues())
        .containsExactly("Nice line. Keep the timing consistent.");
    assertThat(feedback.coachTips())
        .containsExactly("Nice take - aim for even tighter timing on the next pass.");
    assertThat(feedback.nextDrill().type()).isEqualTo(DrillType.ACCURACY_CLEAN);
    assertThat(feedback.subscores()).isEqualTo(new Subscores(100, 100, 100));
    assertThat(feedback.confidenceLabel()).isEqualTo(ConfidenceLabel.HIGH);
    assertThat(feedback.warnings()).isEmpty();
    assertThat(feedback.missedWords()).isEmpty();
    assertThat(feedback.isIncompleteTake()).isFalse();
  }

  @Test
  void build_stoppingEarly_scoresOnlyCoveredPart() {
    // Ten reference words across a 20s verse; the user sings the first five and stops at 9s.
    List<WordToken> reference = new ArrayList<>();
    for (int i = 0; i < 10; i++) {
      reference.add(WordToken.of("word" + i, i * 2.0, i * 2.0 + 1.0, i));
    }
    List<WordToken> user = new ArrayList<>(reference.subList(0, 5));

    DetailedFeedback feedback =
        builder.build(new FeedbackRequest(reference, user, List.of(), 0, 20, null));

    assertThat(feedback.isIncompleteTake()).isTrue();
    assertThat(feedback.message()).isEqualTo(FeedbackBuilder.INCOMPLETE_TAKE_MESSAGE);
    assertThat(feedback.perWord()).hasSize(5);
    assertThat(feedback.wordAccuracyPct()).isEqualTo(100);
    assertThat(feedback.missedWords()).isEmpty();
  }

  @Test
  void build_sufficientCoverage_scoresWholeVerse() {
    List<WordToken> reference = new ArrayList<>();
    for (int i = 0; i < 10; i++) {
      reference.add(WordToken.of("word" + i, i * 2.0, i * 2.0 + 1.0, i));
    }
    // Last user word ends at 13s: 65% of the verse.
    List<WordToken> user = new ArrayList<>(reference.subList(0, 7));

    DetailedFeedback feedback =
        builder.build(new FeedbackRequest(reference, user, List.of(), 0, 20, null));

    assertThat(feedback.isIncompleteTake()).isFalse();
    assertThat(feedback.message()).isNull();
    assertThat(feedback.perWord()).hasSize(10);
    assertThat(feedback.wordAccuracyPct()).isEqualTo(70);
    assertThat(feedback.missedWords()).containsExactly("word7", "word8", "word9");
  }

  @Test
  void build_estimatedOffsetIsRemovedFromUserTimes() {
    List<WordToken> reference = timed("one two three", 0.0, 1.0, 0.5);
    List<WordToken> lateUser = timed("one two three", 0.3, 1.0, 0.5);

    DetailedFeedback corrected =
        builder.build(new FeedbackRequest(reference, lateUser, List.of(), 0, 3, 300.0));
    DetailedFeedback uncorrected =
        builder.build(new FeedbackRequest(reference, lateUser, List.of(), 0, 3, null));

    assertThat(corrected.perWord())
        .extracting(AlignmentWordResult::status)
        .containsOnly(AlignmentStatus.CORRECT);
    assertThat(corrected.timingMeanAbsMs()).isZero();
    assertThat(corrected.estimatedOffsetMs()).isEqualTo(300.0);

    assertThat(uncorrected.perWord())
        .extracting(AlignmentWordResult::status)
        .containsOnly(AlignmentStatus.CORRECT_LATE);
    assertThat(uncorrected.timingMeanAbsMs()).isEqualTo(300);
    assertThat(uncorrected.coachTips())
        .contains("Timing is off by about 300ms. Lock into the reference cue.");
    assertThat(uncorrected.nextDrill().type()).isEqualTo(DrillType.TIMING_LOCK);
  }

  @Test
  void build_spellingVariantIsReportedAsSubstitution() {
    List<WordToken> reference = timed("light it up", 0.0, 0.5, 0);
    List<WordToken> user = timed("lite it up", 0.0, 0.5, 0);

    DetailedFeedback feedback =
        builder.build(new FeedbackRequest(reference, user, List.of(), 0, 1.5, null));

    assertThat(feedback.perWord().get(0).status()).isEqualTo(AlignmentStatus.INCORRECT);
    assertThat(feedback.substitutions())
        .containsExactly(new Substitution("light", "lite", 1.0, ConfidenceLabel.HIGH));
    assertThat(feedback.missedWords()).containsExactly("light");
    assertThat(feedback.extraWords()).isEmpty();
  }

  @Test
  void build_lowConfidenceMistakeIsHalfPenalized() {
    List<WordToken> reference = timed("cat runs", 0.0, 0.5, 0);
    List<WordToken> user = timed("dog runs", 0.0, 0.5, 0);

    DetailedFeedback feedback =
        builder.build(new FeedbackRequest(reference, user, List.of(), 0, 1, null));

    assertThat(feedback.perWord().get(0).confidence()).isZero();
    assertThat(feedback.wordAccuracyPct()).isEqualTo(75);
    assertThat(feedback.subscores().wordAccuracy()).isEqualTo(75);
    assertThat(feedback.confidenceLabel()).isEqualTo(ConfidenceLabel.MEDIUM);
  }

  @Test
  void build_lowConfidenceAddsWarning() {
    List<WordToken> reference = timed("cat sat", 0.0, 0.5, 0);
    List<WordToken> user = timed("dog hid", 0.0, 0.5, 0);

    DetailedFeedback feedback =
        builder.build(new FeedbackRequest(reference, user, List.of(), 0, 1, null));

    assertThat(feedback.confidenceLabel()).isEqualTo(ConfidenceLabel.LOW);
    assertThat(feedback.warnings()).containsExactly(FeedbackBuilder.LOW_CONFIDENCE_WARNING);
  }

  @Test
  void build_accuracyGrowsWithCorrectWords() {
    List<WordToken> reference = timed("and i will always love you", 0.0, 0.5, 0);

    int twoCorrect =
        builder
            .build(
                new FeedbackRequest(
                    reference, timed("and i", 0.0, 0.5, 0), List.of(), 0, 1.0, null))
            .wordAccuracyPct();
    int fourCorrect =
        builder
            .build(
                new FeedbackRequest(
                    reference, timed("and i will always", 0.0, 0.5, 0), List.of(), 0, 2.0, null))
            .wordAccuracyPct();

    assertThat(fourCorrect).isGreaterThan(twoCorrect);
  }

  @Test
  void build_weakLineGetsRepeatDrill() {
    List<ReferenceLine> lines =
        List.of(
            new ReferenceLine(0, "hello world", 0.0, 1.0),
            new ReferenceLine(1, "good night", 1.0, 1.8));
    List<WordToken> reference =
        List.of(
            new WordToken("hello", 0.0, 0.5, 0, 0),
            new WordToken("world", 0.5, 1.0, 1, 0),
            new WordToken("good", 1.0, 1.4, 2, 1),
            new WordToken("night", 1.4, 1.8, 3, 1));
    List<WordToken> user = timed("hello world", 0.0, 0.5, 0);

    DetailedFeedback feedback =
        builder.build(new FeedbackRequest(reference, user, lines, 0, 1.6, null));

    assertThat(feedback.segments()).extracting(SegmentFeedback::wordAccuracyPct)
        .containsExactly(100, 0);
    assertThat(feedback.segments().get(1).mainIssues()).containsExactly("Missed good, night.");
    assertThat(feedback.nextDrill())
        .isEqualTo(
            new NextDrill(
                DrillType.REPEAT_SEGMENT,
                1,
                3,
                "Repeat the weakest line (2) three times for clarity."));
    assertThat(feedback.coachTips()).first().isEqualTo("Focus on the missed words: good, night.");
  }

  @Test
  void build_segmentScoresDoNotDependOnTokenIndex() {
    List<ReferenceLine> lines =
        List.of(
            new ReferenceLine(0, "hello there", 0.0, 1.0),
            new ReferenceLine(1, "good night", 1.0, 2.0));
    List<WordToken> reference =
        List.of(
            new WordToken("hello", 0.0, 0.5, 0, 0),
            new WordToken("there", 0.5, 1.0, 0, 0),
            new WordToken("good", 1.0, 1.5, 0, 1),
            new WordToken("night", 1.5, 2.0, 0, 1));
    List<WordToken> user = timed("hello there good", 0.0, 0.5, 0);

    DetailedFeedback feedback =
        builder.build(new FeedbackRequest(reference, user, lines, 0, 2, null));

    assertThat(feedback.segments()).extracting(SegmentFeedback::wordAccuracyPct)
        .containsExactly(100, 50);
    assertThat(feedback.nextDrill().type()).isEqualTo(DrillType.REPEAT_SEGMENT);
    assertThat(feedback.nextDrill().targetSegmentIndex()).isEqualTo(1);
  }

  @Test
  void build_logsSummariesBelowInfo() {
    ListAppender<ILoggingEvent> appender = new ListAppender<>();
    appender.start();
    Logger builderLogger = (Logger) LoggerFactory.getLogger(FeedbackBuilder.class);
    Logger alignerLogger = (Logger) LoggerFactory.getLogger(WordAligner.class);
    builderLogger.addAppender(appender);
    alignerLogger.addAppender(appender);
    try {
      List<WordToken> words = timed("hold on", 0.0, 0.5, 0);
      builder.build(new FeedbackRequest(words, words, List.of(), 0, 1, null));
    } finally {
      builderLogger.detachAppender(appender);
      alignerLogger.detachAppender(appender);
    }

    assertThat(appender.list).extracting(ILoggingEvent::getLevel).doesNotContain(Level.INFO);
  }

  @Test
  void build_emptyReference() {
    DetailedFeedback feedback =
        builder.build(
            new FeedbackRequest(List.of(), timed("la la", 0.0, 0.5, 0), List.of(), 0, 1, null));

    assertThat(feedback.perWord()).isEmpty();
    assertThat(feedback.segments()).isEmpty();
    assertThat(feedback.extraWords()).containsExactly("la", "la");
    assertThat(feedback.nextDrill().type()).isEqualTo(DrillType.ACCURACY_CLEAN);
  }

  @Test
  void coachTips_mentionsAppliedOffsetAndPace() {
    List<String> tips = FeedbackBuilder.coachTips(100, 300, 1.2, List.of(), 120.0);

    assertThat(tips)
        .containsExactly(
            "Timing is off by about 300ms (offset corrected by 120ms). Lock into the reference"
                + " cue.",
            "You're rushing this verse. Slow down slightly and match the phrasing.");
  }

  @Test
  void coachTips_smallOffsetIsNotMentioned() {
    List<String> tips = FeedbackBuilder.coachTips(100, 300, 1.0, List.of(), 30.0);

    assertThat(tips).containsExactly("Timing is off by about 300ms. Lock into the reference cue.");
  }

  @Test
  void coachTips_lowAccuracyWithoutMissedWords() {
    List<String> tips = FeedbackBuilder.coachTips(50, 0, 0.8, List.of(), null);

    assertThat(tips)
        .containsExactly(
            "Focus on lyric accuracy - keep the words tight.",
            "You're dragging a bit. Push forward to match the reference pace.");
  }

  @Test
  void selectDrill_fallsThroughRulesInOrder() {
    List<SegmentFeedback> fine =
        List.of(new SegmentFeedback(0, "a", 0, 1, 90, 0, List.of("ok")));

    assertThat(FeedbackBuilder.selectDrill(fine, 300, 1.3).type())
        .isEqualTo(DrillType.TIMING_LOCK);
    assertThat(FeedbackBuilder.selectDrill(fine, 100, 1.3).type()).isEqualTo(DrillType.SLOW_DOWN);
    assertThat(FeedbackBuilder.selectDrill(fine, 100, 1.0).type())
        .isEqualTo(DrillType.ACCURACY_CLEAN);
  }

  /** Words from a space-separated string, {@code step} apart, each {@code length} long. */
  private static List<WordToken> timed(String text, double start, double step, double length) {
    double wordLength = length > 0 ? length : step;
    List<WordToken> tokens = new ArrayList<>();
    String[] parts = text.split(" ");
    for (int i = 0; i < parts.length; i++) {
      double wordStart = start + i * step;
      tokens.add(WordToken.of(parts[i], wordStart, wordStart + wordLength, i));
    }
    return tokens;
  }
}
