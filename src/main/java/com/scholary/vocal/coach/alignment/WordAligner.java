package com.scholary.vocal.coach.alignment;

import static com.scholary.vocal.coach.transcript.TokenNormalizer.normalizeToken;
import static com.scholary.vocal.coach.transcript.TokenNormalizer.tokenSimilarity;

import com.scholary.vocal.coach.transcript.WordToken;
import com.scholary.vocal.coach.util.Scores;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Aligns a reference word sequence to what the user actually sang.
 *
 * <p>Algorithm: weighted edit distance over the two token sequences.
 *
 * <ul>
 *   <li>{@code delete} (reference word unmatched, becomes missed) and {@code insert} (user word
 *       unmatched, becomes an extra) cost 1
 *   <li>{@code match} costs 0 for equal normalized tokens, 0.5 for phonetically close tokens
 *       (similarity at least 0.7), 1 otherwise
 * </ul>
 *
 * <p>The half-cost substitution keeps near-miss words in their reference slot instead of splitting
 * them into a miss plus an extra. Backtracking prefers match, then delete, then insert on ties.
 *
 * <p>Correctness is decided by normalized equality only. Phonetic closeness changes the path, not
 * the verdict.
 *
 * <p>Cost is O(n*m) time and memory. Callers bound the input size before calling.
 */
@Component
public class WordAligner {

  private static final Logger LOGGER = LoggerFactory.getLogger(WordAligner.class);

  static final double PHONETIC_MATCH_THRESHOLD = 0.7;
  static final double PHONETIC_MATCH_COST = 0.5;

  private enum Op {
    MATCH,
    DELETE,
    INSERT
  }

  public AlignmentResult align(List<WordToken> reference, List<WordToken> user) {
    return align(reference, user, AlignmentOptions.defaults());
  }

  /**
   * Align reference tokens to user tokens.
   *
   * @param reference ground-truth words, in order
   * @param user transcribed user words, in order
   * @param options offsets, early/late threshold and durations
   * @return one result per reference word, plus unattached user words and metrics
   */
  public AlignmentResult align(
      List<WordToken> reference, List<WordToken> user, AlignmentOptions options) {
    List<Op> ops = backtrack(reference, user);

    List<AlignmentWordResult> perWord = new ArrayList<>(reference.size());
    List<WordToken> extras = new ArrayList<>();
    List<String> missedWords = new ArrayList<>();
    List<String> extraWords = new ArrayList<>();
    List<Integer> matchedDeltas = new ArrayList<>();

    int refIndex = 0;
    int userIndex = 0;
    for (Op op : ops) {
      if (op == Op.MATCH) {
        WordToken refWord = reference.get(refIndex);
        WordToken userWord = user.get(userIndex);
        AlignmentWordResult result = scoreMatch(refWord, userWord, options);
        perWord.add(result);
        if (result.status().isCorrect()) {
          matchedDeltas.add(Math.abs(result.deltaMs()));
        } else {
          missedWords.add(refWord.word());
        }
        refIndex++;
        userIndex++;
      } else if (op == Op.DELETE) {
        WordToken refWord = reference.get(refIndex);
        perWord.add(AlignmentWordResult.missed(refWord, options.referenceOffsetSec()));
        missedWords.add(refWord.word());
        refIndex++;
      } else {
        WordToken extra = user.get(userIndex);
        extras.add(extra);
        extraWords.add(extra.word());
        userIndex++;
      }
    }

    long correctCount = perWord.stream().filter(w -> w.status().isCorrect()).count();
    int wordAccuracyPct =
        perWord.isEmpty() ? 0 : Scores.roundToInt(100.0 * correctCount / perWord.size());
    int timingMeanAbsMs =
        matchedDeltas.isEmpty()
            ? 0
            : Scores.roundToInt(
                matchedDeltas.stream().mapToInt(Integer::intValue).average().orElse(0.0));

    AlignmentMetrics metrics =
        new AlignmentMetrics(
            wordAccuracyPct, timingMeanAbsMs, options.paceRatio(), missedWords, extraWords);

    LOGGER.debug(
        "Aligned {} reference words to {} user words: accuracy={}%, timing={}ms, extras={}",
        reference.size(),
        user.size(),
        wordAccuracyPct,
        timingMeanAbsMs,
        extras.size());

    return new AlignmentResult(perWord, extras, metrics);
  }

  /**
   * Fill the cost table and walk it back from (n, m) to (0, 0).
   *
   * @return the edit operations in forward order
   */
  private List<Op> backtrack(List<WordToken> reference, List<WordToken> user) {
    int n = reference.size();
    int m = user.size();
    double[][] cost = new double[n + 1][m + 1];
    Op[][] back = new Op[n + 1][m + 1];

    for (int i = 1; i <= n; i++) {
      cost[i][0] = i;
      back[i][0] = Op.DELETE;
    }
    for (int j = 1; j <= m; j++) {
      cost[0][j] = j;
      back[0][j] = Op.INSERT;
    }

    String[] userNorms = new String[m];
    for (int j = 0; j < m; j++) {
      userNorms[j] = normalizeToken(user.get(j).word());
    }

    for (int i = 1; i <= n; i++) {
      String refNorm = normalizeToken(reference.get(i - 1).word());
      for (int j = 1; j <= m; j++) {
        double matchCost = cost[i - 1][j - 1] + substitutionCost(refNorm, userNorms[j - 1]);
        double deleteCost = cost[i - 1][j] + 1;
        double insertCost = cost[i][j - 1] + 1;

        // Strict comparisons keep MATCH on ties, then DELETE.
        double best = matchCost;
        Op op = Op.MATCH;
        if (deleteCost < best) {
          best = deleteCost;
          op = Op.DELETE;
        }
        if (insertCost < best) {
          best = insertCost;
          op = Op.INSERT;
        }
        cost[i][j] = best;
        back[i][j] = op;
      }
    }

    List<Op> ops = new ArrayList<>(n + m);
    int i = n;
    int j = m;
    while (i > 0 || j > 0) {
      Op op = back[i][j];
      ops.add(op);
      if (op == Op.MATCH) {
        i--;
        j--;
      } else if (op == Op.DELETE) {
        i--;
      } else {
        j--;
      }
    }
    Collections.reverse(ops);
    return ops;
  }

  private static double substitutionCost(String refNorm, String userNorm) {
    if (refNorm.equals(userNorm)) {
      return 0.0;
    }
    return tokenSimilarity(refNorm, userNorm) >= PHONETIC_MATCH_THRESHOLD
        ? PHONETIC_MATCH_COST
        : 1.0;
  }

  private static AlignmentWordResult scoreMatch(
      WordToken refWord, WordToken userWord, AlignmentOptions options) {
    String refNorm = normalizeToken(refWord.word());
    String userNorm = normalizeToken(userWord.word());
    boolean correct = !refNorm.isEmpty() && refNorm.equals(userNorm);
    double confidence = correct ? 1.0 : tokenSimilarity(refNorm, userNorm);

    double refStart = refWord.start() - options.referenceOffsetSec();
    double userStart = userWord.start() - options.userOffsetSec();
    int deltaMs = Scores.roundToInt((userStart - refStart) * 1000);

    AlignmentStatus status = AlignmentStatus.INCORRECT;
    if (correct) {
      int threshold = options.earlyLateThresholdMs();
      if (deltaMs < -threshold) {
        status = AlignmentStatus.CORRECT_EARLY;
      } else if (deltaMs > threshold) {
        status = AlignmentStatus.CORRECT_LATE;
      } else {
        status = AlignmentStatus.CORRECT;
      }
    }

    return AlignmentWordResult.matched(
        refWord,
        userWord,
        options.referenceOffsetSec(),
        options.userOffsetSec(),
        status,
        deltaMs,
        confidence);
  }
}
