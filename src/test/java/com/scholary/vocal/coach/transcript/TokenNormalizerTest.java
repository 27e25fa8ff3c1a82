package com.scholary.vocal.coach.transcript;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import org.junit.jupiter.api.Test;

class TokenNormalizerTest {

  @Test
  void normalizeToken_stripsCaseApostrophesAndPunctuation() {
    assertThat(TokenNormalizer.normalizeToken("Don't!")).isEqualTo("dont");
    assertThat(TokenNormalizer.normalizeToken("rock’n’roll")).isEqualTo("rocknroll");
    assertThat(TokenNormalizer.normalizeToken("HELLO,")).isEqualTo("hello");
  }

  @Test
  void normalizeToken_emptyForNullAndPunctuationOnly() {
    assertThat(TokenNormalizer.normalizeToken(null)).isEmpty();
    assertThat(TokenNormalizer.normalizeToken("...")).isEmpty();
    assertThat(TokenNormalizer.normalizeToken("  ")).isEmpty();
  }

  @Test
  void phoneticNormalize_appliesSubstitutionsBeforeVowelRemoval() {
    assertThat(TokenNormalizer.phoneticNormalize("Knight's")).isEqualTo("nts");
    assertThat(TokenNormalizer.phoneticNormalize("phone")).isEqualTo("fn");
    assertThat(TokenNormalizer.phoneticNormalize("butter")).isEqualTo("btr");
  }

  @Test
  void phoneticNormalize_allVowelWordIsEmpty() {
    assertThat(TokenNormalizer.phoneticNormalize("you")).isEmpty();
  }

  @Test
  void tokenSimilarity_spellingVariantsMatchPhonetically() {
    assertThat(TokenNormalizer.tokenSimilarity("light", "lite")).isEqualTo(1.0);
    assertThat(TokenNormalizer.tokenSimilarity("night", "nite")).isEqualTo(1.0);
  }

  @Test
  void tokenSimilarity_zeroForEmptyInput() {
    assertThat(TokenNormalizer.tokenSimilarity("", "lite")).isZero();
    assertThat(TokenNormalizer.tokenSimilarity("light", null)).isZero();
  }

  @Test
  void tokenSimilarity_differentWordsScoreLow() {
    assertThat(TokenNormalizer.tokenSimilarity("sun", "moon")).isEqualTo(0.5);
    assertThat(TokenNormalizer.tokenSimilarity("cat", "dog")).isZero();
  }

  @Test
  void levenshtein_classicExamples() {
    assertThat(TokenNormalizer.levenshtein("kitten", "sitting")).isEqualTo(3);
    assertThat(TokenNormalizer.levenshtein("", "abc")).isEqualTo(3);
    assertThat(TokenNormalizer.levenshtein("same", "same")).isZero();
  }

  @Test
  void editSimilarity_isOneMinusNormalizedDistance() {
    assertThat(TokenNormalizer.editSimilarity("abc", "abd")).isCloseTo(2.0 / 3, within(1e-9));
    assertThat(TokenNormalizer.editSimilarity("abc", "abc")).isEqualTo(1.0);
    assertThat(TokenNormalizer.editSimilarity("", "abc")).isZero();
  }
}
