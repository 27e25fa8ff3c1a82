package com.scholary.vocal.coach.service;

import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.scholary.vocal.coach.api.AttemptAnalysisRequest;
import com.scholary.vocal.coach.config.CoachingProperties;
import com.scholary.vocal.coach.config.CoachingProperties.AlignmentProperties;
import com.scholary.vocal.coach.transcript.WordToken;
import java.util.List;
import org.junit.jupiter.api.Test;

class AttemptValidatorTest {

  private final AttemptValidator validator =
      new AttemptValidator(new CoachingProperties(new AlignmentProperties(200, 6L), null));

  @Test
  void validate_acceptsWellFormedAttempt() {
    List<WordToken> words = List.of(WordToken.of("a", 0.0, 0.5, 0), WordToken.of("b", 0.5, 1, 1));

    assertThatCode(() -> validator.validate(request(0.0, 2.0, 2.0), words, words))
        .doesNotThrowAnyException();
  }

  @Test
  void validate_rejectsReversedVerse() {
    assertThatThrownBy(() -> validator.validate(request(5.0, 2.0, null), List.of(), List.of()))
        .isInstanceOf(InvalidAttemptException.class)
        .hasMessageContaining("verseEndSec");
  }

  @Test
  void validate_rejectsNegativeTimes() {
    assertThatThrownBy(() -> validator.validate(request(-1.0, 2.0, null), List.of(), List.of()))
        .isInstanceOf(InvalidAttemptException.class)
        .hasMessageContaining("verseStartSec");
    assertThatThrownBy(() -> validator.validate(request(0.0, 2.0, -3.0), List.of(), List.of()))
        .isInstanceOf(InvalidAttemptException.class)
        .hasMessageContaining("recordingDurationSec");
  }

  @Test
  void validate_rejectsMissingVerseBounds() {
    assertThatThrownBy(() -> validator.validate(request(null, 2.0, null), List.of(), List.of()))
        .isInstanceOf(InvalidAttemptException.class);
  }

  @Test
  void validate_rejectsWordEndingBeforeItStarts() {
    List<WordToken> words = List.of(WordToken.of("a", 1.0, 0.5, 0));

    assertThatThrownBy(() -> validator.validate(request(0.0, 2.0, null), List.of(), words))
        .isInstanceOf(InvalidAttemptException.class)
        .hasMessage("userWords[0].end must not be before start");
  }

  @Test
  void validate_rejectsOutOfOrderWords() {
    List<WordToken> words = List.of(WordToken.of("a", 1.0, 1.5, 0), WordToken.of("b", 0.5, 1, 1));

    assertThatThrownBy(() -> validator.validate(request(0.0, 2.0, null), words, List.of()))
        .isInstanceOf(InvalidAttemptException.class)
        .hasMessageContaining("referenceWords[1].start");
  }

  @Test
  void validate_rejectsOffsetBeyondOneMinute() {
    double limit = AttemptValidator.MAX_PROVIDED_OFFSET_MS;

    assertThatCode(() -> validator.validate(withOffset(-limit), List.of(), List.of()))
        .doesNotThrowAnyException();
    assertThatThrownBy(() -> validator.validate(withOffset(3e9), List.of(), List.of()))
        .isInstanceOf(InvalidAttemptException.class)
        .hasMessageContaining("estimatedOffsetMs");
    assertThatThrownBy(() -> validator.validate(withOffset(Double.NaN), List.of(), List.of()))
        .isInstanceOf(InvalidAttemptException.class)
        .hasMessageContaining("estimatedOffsetMs");
  }

  @Test
  void validate_rejectsOversizedAlignment() {
    List<WordToken> three =
        List.of(WordToken.of("a", 0, 1, 0), WordToken.of("b", 1, 2, 1), WordToken.of("c", 2, 3, 2));

    assertThatCode(() -> validator.validate(request(0.0, 3.0, null), three, three.subList(0, 2)))
        .doesNotThrowAnyException();
    assertThatThrownBy(() -> validator.validate(request(0.0, 3.0, null), three, three))
        .isInstanceOf(InvalidAttemptException.class)
        .hasMessageContaining("exceeds the limit of 6");
  }

  private static AttemptAnalysisRequest withOffset(double estimatedOffsetMs) {
    return new AttemptAnalysisRequest(
        "attempt-2",
        null,
        null,
        null,
        null,
        null,
        0.0,
        2.0,
        estimatedOffsetMs,
        null,
        null,
        null,
        null,
        null,
        null,
        null);
  }

  private static AttemptAnalysisRequest request(
      Double verseStartSec, Double verseEndSec, Double recordingDurationSec) {
    return new AttemptAnalysisRequest(
        "attempt-1",
        null,
        null,
        null,
        null,
        null,
        verseStartSec,
        verseEndSec,
        null,
        null,
        recordingDurationSec,
        null,
        null,
        null,
        null,
        null);
  }
}
