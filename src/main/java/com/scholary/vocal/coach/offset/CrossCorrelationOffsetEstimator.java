package com.scholary.vocal.coach.offset;

import com.scholary.vocal.coach.util.Scores;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Finds the lag that best lines up two energy envelopes.
 *
 * <p>Strategy:
 *
 * <ol>
 *   <li>Scan every integer lag within {@code ±maxOffsetMs} and keep the one with the highest
 *       normalized correlation
 *   <li>If that peak is above {@value #MIN_CORRELATION}, use it
 *   <li>Otherwise compare where each envelope first reaches {@value #ONSET_FRACTION} of its own
 *       maximum
 * </ol>
 *
 * <p>The result is always clamped to {@code ±maxOffsetMs}.
 */
public class CrossCorrelationOffsetEstimator implements OffsetEstimator {

  private static final Logger LOGGER =
      LoggerFactory.getLogger(CrossCorrelationOffsetEstimator.class);

  static final double MIN_CORRELATION = 0.2;
  static final double ONSET_FRACTION = 0.4;
  private static final int MIN_OVERLAP = 3;

  private final double maxOffsetMs;
  private final double stepMs;

  public CrossCorrelationOffsetEstimator(double maxOffsetMs, double stepMs) {
    if (maxOffsetMs <= 0 || stepMs <= 0) {
      throw new IllegalArgumentException("maxOffsetMs and stepMs must be positive");
    }
    this.maxOffsetMs = maxOffsetMs;
    this.stepMs = stepMs;
  }

  @Override
  public OffsetEstimate estimate(List<Double> referenceEnvelope, List<Double> recordingEnvelope) {
    if (referenceEnvelope.isEmpty() || recordingEnvelope.isEmpty()) {
      return OffsetEstimate.none();
    }

    int maxLag = Math.max(1, Scores.roundToInt(maxOffsetMs / stepMs));
    int bestLag = 0;
    double bestCorrelation = Double.NEGATIVE_INFINITY;
    for (int lag = -maxLag; lag <= maxLag; lag++) {
      double correlation = correlationAtLag(referenceEnvelope, recordingEnvelope, lag);
      if (correlation > bestCorrelation) {
        bestCorrelation = correlation;
        bestLag = lag;
      }
    }

    if (bestCorrelation > MIN_CORRELATION) {
      OffsetEstimate estimate =
          new OffsetEstimate(clampedMs(bestLag), OffsetMethod.XCORR, bestCorrelation);
      LOGGER.debug("Offset by cross-correlation: lag={} bins, r={}", bestLag, bestCorrelation);
      return estimate;
    }

    int referenceOnset = onsetIndex(referenceEnvelope);
    int recordingOnset = onsetIndex(recordingEnvelope);
    if (referenceOnset < 0 || recordingOnset < 0) {
      return OffsetEstimate.none();
    }
    LOGGER.debug(
        "Weak correlation (r={}), falling back to onsets {} vs {}",
        bestCorrelation,
        referenceOnset,
        recordingOnset);
    return new OffsetEstimate(clampedMs(recordingOnset - referenceOnset), OffsetMethod.ONSET, null);
  }

  /**
   * Pearson correlation between {@code a[i]} and {@code b[i + lag]} over the overlapping indices.
   *
   * @return 0 with fewer than {@value #MIN_OVERLAP} overlapping samples or a flat side
   */
  static double correlationAtLag(List<Double> a, List<Double> b, int lag) {
    double sum = 0;
    double sumA = 0;
    double sumB = 0;
    double sumAA = 0;
    double sumBB = 0;
    int count = 0;
    for (int i = 0; i < a.size(); i++) {
      int j = i + lag;
      if (j < 0 || j >= b.size()) {
        continue;
      }
      double av = a.get(i);
      double bv = b.get(j);
      sum += av * bv;
      sumA += av;
      sumB += bv;
      sumAA += av * av;
      sumBB += bv * bv;
      count++;
    }
    if (count < MIN_OVERLAP) {
      return 0.0;
    }
    double denomA = sumAA - sumA * sumA / count;
    double denomB = sumBB - sumB * sumB / count;
    if (denomA <= 0 || denomB <= 0) {
      return 0.0;
    }
    return (sum - sumA * sumB / count) / Math.sqrt(denomA * denomB);
  }

  private static int onsetIndex(List<Double> envelope) {
    double max = 0.0;
    for (double value : envelope) {
      max = Math.max(max, value);
    }
    double threshold = max * ONSET_FRACTION;
    for (int i = 0; i < envelope.size(); i++) {
      if (envelope.get(i) >= threshold) {
        return i;
      }
    }
    return -1;
  }

  private double clampedMs(int lagBins) {
    double offsetMs = Scores.round(lagBins * stepMs);
    return Math.max(-maxOffsetMs, Math.min(maxOffsetMs, offsetMs));
  }
}
