package com.scholary.vocal.coach.performance;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Contour and envelope math used by {@link PerformanceScorer}.
 *
 * <p>All methods are pure and tolerate empty input.
 */
public final class SignalMath {

  public static final double MIN_PITCH_HZ = 50;
  public static final double MAX_PITCH_HZ = 1100;

  private SignalMath() {
    // Prevent instantiation
  }

  /**
   * Zero every sample outside the vocal band. Octave-jump artifacts from the pitch tracker land
   * out there and would otherwise dominate the statistics.
   */
  public static List<PitchSample> sanitize(List<PitchSample> samples) {
    List<PitchSample> result = new ArrayList<>(samples.size());
    for (PitchSample sample : samples) {
      boolean outOfBand =
          sample.frequency() < MIN_PITCH_HZ || sample.frequency() > MAX_PITCH_HZ;
      result.add(outOfBand ? sample.unvoiced() : sample);
    }
    return result;
  }

  /** Cents from reference to actual; 0 if either is unvoiced. */
  public static double centsOff(double referenceHz, double actualHz) {
    if (referenceHz <= 0 || actualHz <= 0) {
      return 0.0;
    }
    return 1200 * log2(actualHz / referenceHz);
  }

  public static double voicedRatio(List<PitchSample> samples) {
    long voiced = samples.stream().filter(PitchSample::isVoiced).count();
    return (double) voiced / Math.max(1, samples.size());
  }

  /**
   * Mean |cents| over index-aligned pairs where both samples are voiced.
   *
   * @return 0 when no pair is voiced on both sides
   */
  public static double averageAbsoluteCentsDiff(
      List<PitchSample> reference, List<PitchSample> actual) {
    int length = Math.min(reference.size(), actual.size());
    double total = 0.0;
    int count = 0;
    for (int i = 0; i < length; i++) {
      double referenceHz = reference.get(i).frequency();
      double actualHz = actual.get(i).frequency();
      if (referenceHz <= 0 || actualHz <= 0) {
        continue;
      }
      total += Math.abs(centsOff(referenceHz, actualHz));
      count++;
    }
    return count == 0 ? 0.0 : total / count;
  }

  /**
   * Standard deviation of the voiced frequencies, expressed in cents around their mean.
   *
   * @return the spread in cents, or null with fewer than {@code minVoiced} voiced samples
   */
  public static Double voicedCentsStd(List<PitchSample> samples, int minVoiced) {
    List<Double> voiced =
        samples.stream().filter(PitchSample::isVoiced).map(PitchSample::frequency).toList();
    if (voiced.size() < minVoiced) {
      return null;
    }
    double mean = voiced.stream().mapToDouble(Double::doubleValue).average().orElse(0.0);
    double variance =
        voiced.stream().mapToDouble(f -> (f - mean) * (f - mean)).sum() / voiced.size();
    double std = Math.sqrt(variance);
    return mean > 0 ? 1200 * log2((mean + std) / mean) : 0.0;
  }

  /**
   * Pearson correlation over the common prefix of two envelopes.
   *
   * @return correlation in [-1, 1], or 0 when either side is empty or flat
   */
  public static double pearson(List<Double> a, List<Double> b) {
    int length = Math.min(a.size(), b.size());
    if (length == 0) {
      return 0.0;
    }
    double meanA = 0.0;
    double meanB = 0.0;
    for (int i = 0; i < length; i++) {
      meanA += a.get(i);
      meanB += b.get(i);
    }
    meanA /= length;
    meanB /= length;

    double numerator = 0.0;
    double denomA = 0.0;
    double denomB = 0.0;
    for (int i = 0; i < length; i++) {
      double da = a.get(i) - meanA;
      double db = b.get(i) - meanB;
      numerator += da * db;
      denomA += da * da;
      denomB += db * db;
    }
    if (denomA == 0 || denomB == 0) {
      return 0.0;
    }
    return Math.max(-1.0, Math.min(1.0, numerator / Math.sqrt(denomA * denomB)));
  }

  public static double averageEnergy(List<Double> envelope) {
    return envelope.stream().mapToDouble(Double::doubleValue).average().orElse(0.0);
  }

  /**
   * Move every bin {@code bins} positions earlier ({@code out[i - bins] = in[i]}). Bins pushed past
   * either end are dropped and vacated bins are zero.
   */
  public static List<Double> shiftEarlier(List<Double> envelope, int bins) {
    if (bins == 0) {
      return envelope;
    }
    Double[] shifted = new Double[envelope.size()];
    Arrays.fill(shifted, 0.0);
    for (int i = 0; i < envelope.size(); i++) {
      int target = i - bins;
      if (target < 0 || target >= envelope.size()) {
        continue;
      }
      shifted[target] = envelope.get(i);
    }
    return List.of(shifted);
  }

  private static double log2(double value) {
    return Math.log(value) / Math.log(2);
  }
}
