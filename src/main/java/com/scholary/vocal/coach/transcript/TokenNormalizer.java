package com.scholary.vocal.coach.transcript;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Word normalization and fuzzy similarity used by the aligner.
 *
 * <p>Two levels of normalization exist:
 *
 * <ul>
 *   <li>{@link #normalizeToken(String)} decides correctness: two words are "the same" only when
 *       their normalized tokens are equal.
 *   <li>{@link #phoneticNormalize(String)} produces a coarse consonant skeleton. It only biases the
 *       alignment cost so near-misses stay in the right slot, it never makes a word correct.
 * </ul>
 */
public final class TokenNormalizer {

  private static final Pattern APOSTROPHES = Pattern.compile("[’']");
  private static final Pattern NON_ALPHANUMERIC = Pattern.compile("[^a-z0-9]+");
  private static final Pattern VOWELS = Pattern.compile("[aeiouy]");
  private static final Pattern REPEATED_CHARS = Pattern.compile("(.)\\1+");

  // Applied in order. "ght" must run before vowel removal so "light" and "lite" meet at "lt".
  private static final String[][] SUBSTITUTIONS = {
    {"ph", "f"},
    {"ght", "t"},
    {"ck", "k"},
    {"cq", "k"},
    {"qu", "k"},
    {"x", "ks"},
    {"kn", "n"},
    {"wr", "r"},
    {"wh", "w"},
  };

  private TokenNormalizer() {
    // Prevent instantiation
  }

  /**
   * Lower-case, drop apostrophes, strip everything that is not {@code [a-z0-9]}.
   *
   * @param token raw word (may be null)
   * @return normalized token, empty for null or punctuation-only input
   */
  public static String normalizeToken(String token) {
    if (token == null || token.isEmpty()) {
      return "";
    }
    String lower = token.toLowerCase(Locale.ROOT);
    String noApostrophes = APOSTROPHES.matcher(lower).replaceAll("");
    return NON_ALPHANUMERIC.matcher(noApostrophes).replaceAll("");
  }

  /**
   * Reduce a word to its consonant skeleton.
   *
   * <p>Example: {@code "Knight's"} becomes {@code "nts"}.
   *
   * @param token raw word (may be null)
   * @return skeleton, possibly empty (e.g. {@code "you"})
   */
  public static String phoneticNormalize(String token) {
    String value = normalizeToken(token);
    if (value.isEmpty()) {
      return "";
    }
    for (String[] substitution : SUBSTITUTIONS) {
      value = value.replace(substitution[0], substitution[1]);
    }
    value = VOWELS.matcher(value).replaceAll("");
    return REPEATED_CHARS.matcher(value).replaceAll("$1");
  }

  /**
   * Similarity of two words on their phonetic skeletons, in {@code [0, 1]}.
   *
   * <p>{@code 1 - levenshtein / max(len)}. Returns 0 when either word (or either skeleton) is
   * empty.
   */
  public static double tokenSimilarity(String a, String b) {
    if (a == null || b == null || a.isEmpty() || b.isEmpty()) {
      return 0.0;
    }
    return editSimilarity(phoneticNormalize(a), phoneticNormalize(b));
  }

  /**
   * Normalized edit similarity of two strings as given, in {@code [0, 1]}.
   *
   * @return 0 if either is empty, 1 if equal
   */
  public static double editSimilarity(String a, String b) {
    if (a == null || b == null || a.isEmpty() || b.isEmpty()) {
      return 0.0;
    }
    if (a.equals(b)) {
      return 1.0;
    }
    int maxLength = Math.max(a.length(), b.length());
    double similarity = 1.0 - (double) levenshtein(a, b) / maxLength;
    return Math.max(0.0, Math.min(1.0, similarity));
  }

  /**
   * Classic Levenshtein distance with a single rolling row.
   */
  public static int levenshtein(String a, String b) {
    int[] row = new int[b.length() + 1];
    for (int j = 0; j <= b.length(); j++) {
      row[j] = j;
    }
    for (int i = 1; i <= a.length(); i++) {
      int diagonal = row[0];
      row[0] = i;
      for (int j = 1; j <= b.length(); j++) {
        int above = row[j];
        int cost = a.charAt(i - 1) == b.charAt(j - 1) ? 0 : 1;
        row[j] = Math.min(Math.min(row[j] + 1, row[j - 1] + 1), diagonal + cost);
        diagonal = above;
      }
    }
    return row[b.length()];
  }
}
