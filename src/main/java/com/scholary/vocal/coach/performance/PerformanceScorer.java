package com.scholary.vocal.coach.performance;

import com.scholary.vocal.coach.performance.PerformanceAnalysisResult.SignalAlignment;
import com.scholary.vocal.coach.util.Scores;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Scores pitch, timing and stability from signal contours and blends them with an optional word
 * score into one overall number.
 *
 * <p>This works independently of word alignment: it only sees pitch contours, energy envelopes,
 * durations and the estimated start offset.
 *
 * <p>Defaults when a signal is missing are explicit. "Neutral" defaults (55 pitch, 60 timing, 50
 * stability) apply when there is nothing to compare. A near-silent recording is "unscorable" and
 * gets 0 for pitch and timing.
 */
@Component
public class PerformanceScorer {

  private static final Logger LOGGER = LoggerFactory.getLogger(PerformanceScorer.class);

  public static final String LABEL_PITCH_ACCURACY = "Pitch Accuracy";
  public static final String LABEL_TONE_MATCH = "Tone Match";

  static final double DEFAULT_BIN_MS = 50;
  static final double LOW_SIGNAL_ENERGY = 0.002;
  static final double MIN_VOICED_RATIO = 0.3;
  static final int MIN_STABILITY_SAMPLES = 5;
  static final double SHORT_RECORDING_SEC = 3;
  static final int TIP_THRESHOLD = 75;

  static final int NEUTRAL_PITCH = 55;
  static final int NEUTRAL_TIMING = 60;
  static final int NEUTRAL_STABILITY = 50;

  static final String LOW_SIGNAL_TIP =
      "Low input level detected. Try moving closer to the mic or increasing input gain.";

  /**
   * Analyze one attempt.
   *
   * @param input contours, envelopes, durations, offset, mode and optional word score
   * @return subscores, overall score, label and tips
   */
  public PerformanceAnalysisResult analyze(PerformanceInput input) {
    List<PitchSample> referenceContour = SignalMath.sanitize(input.referenceContour());
    List<PitchSample> recordingContour = SignalMath.sanitize(input.recordingContour());
    List<Double> referenceEnvelope = input.referenceEnvelope();

    int offsetBins = offsetBins(input);
    List<Double> recordingEnvelope =
        SignalMath.shiftEarlier(input.recordingEnvelope(), offsetBins);

    double averageEnergy = SignalMath.averageEnergy(recordingEnvelope);
    boolean lowSignal = averageEnergy > 0 && averageEnergy < LOW_SIGNAL_ENERGY;
    boolean tooShort =
        input.recordingDurationSec() != null
            && input.recordingDurationSec() < SHORT_RECORDING_SEC;

    double rawCorrelation = SignalMath.pearson(referenceEnvelope, recordingEnvelope);
    double timingCorrelation = Math.max(0.0, rawCorrelation);

    String label = LABEL_PITCH_ACCURACY;
    int pitch = NEUTRAL_PITCH;
    if (!referenceContour.isEmpty() && !recordingContour.isEmpty() && !lowSignal) {
      if (SignalMath.voicedRatio(referenceContour) < MIN_VOICED_RATIO) {
        // Mostly unvoiced material (spoken, rapped, percussive): compare the energy shape instead.
        label = LABEL_TONE_MATCH;
        pitch = Scores.toScore(timingCorrelation * 100);
      } else {
        double averageCents =
            SignalMath.averageAbsoluteCentsDiff(referenceContour, recordingContour);
        pitch = Scores.toScore(100 - Math.min(100, averageCents * 2));
      }
    }

    int timing = NEUTRAL_TIMING;
    if (!lowSignal) {
      int durationScore = durationScore(input);
      timing =
          rawCorrelation > 0
              ? Scores.toScore(Math.min(100, rawCorrelation * 85 + durationScore * 0.15))
              : durationScore;
    }

    int stability;
    if (!recordingContour.isEmpty() && !lowSignal) {
      Double centsStd = SignalMath.voicedCentsStd(recordingContour, MIN_STABILITY_SAMPLES);
      stability = centsStd == null ? NEUTRAL_STABILITY : Scores.toScore(100 - centsStd * 4);
    } else {
      stability = Scores.clamp(Scores.roundToInt(55 + timingCorrelation * 20), 40, 90);
    }

    if (lowSignal) {
      pitch = 0;
      timing = 0;
      LOGGER.debug(
          "Low input level: average energy {} below {}, pitch and timing unscorable",
          averageEnergy,
          LOW_SIGNAL_ENERGY);
    }

    int overall =
        computeOverallScore(pitch, timing, stability, input.wordScore(), input.practiceMode());
    List<String> tips = buildTips(pitch, timing, stability, label, tooShort, lowSignal);

    LOGGER.debug(
        "Scored performance: overall={}, pitch={}, timing={}, stability={}, words={}, mode={}",
        overall,
        pitch,
        timing,
        stability,
        input.wordScore(),
        input.practiceMode().wireName());

    return new PerformanceAnalysisResult(
        overall,
        pitch,
        timing,
        stability,
        input.wordScore(),
        label,
        tips,
        new SignalAlignment(timingCorrelation));
  }

  /**
   * Blend subscores with the mode's weights, normalized to sum to 1.
   *
   * <p>A missing word score contributes 0. It does not drop the term from the blend.
   */
  public static int computeOverallScore(
      int pitch, int timing, int stability, Integer words, PracticeMode mode) {
    PracticeMode resolved = mode == null ? PracticeMode.FULL : mode;
    PerformanceWeights weights = resolved.weights().normalized();
    int wordScore = words == null ? 0 : words;
    double overall =
        pitch * weights.pitch()
            + timing * weights.timing()
            + stability * weights.stability()
            + wordScore * weights.words();
    return Scores.roundToInt(overall);
  }

  /**
   * Number of envelope bins the offset spans.
   *
   * <p>Bin length comes from the reference envelope and duration when available, else from the
   * recording's, else {@value #DEFAULT_BIN_MS}ms.
   */
  static int offsetBins(PerformanceInput input) {
    if (input.estimatedOffsetMs() == null) {
      return 0;
    }
    double binMs = DEFAULT_BIN_MS;
    if (!input.referenceEnvelope().isEmpty() && isPositive(input.referenceDurationSec())) {
      binMs = input.referenceDurationSec() * 1000 / input.referenceEnvelope().size();
    } else if (!input.recordingEnvelope().isEmpty()
        && isPositive(input.recordingDurationSec())) {
      binMs = input.recordingDurationSec() * 1000 / input.recordingEnvelope().size();
    }
    return Scores.roundToInt(input.estimatedOffsetMs() / binMs);
  }

  /** How close the recording length is to the reference length, 60 when either is unknown. */
  static int durationScore(PerformanceInput input) {
    Double reference = input.referenceDurationSec();
    Double recording = input.recordingDurationSec();
    if (!isPositive(reference) || !isPositive(recording)) {
      return NEUTRAL_TIMING;
    }
    double relativeError = Math.abs(recording - reference) / Math.max(0.1, reference);
    return Math.max(0, Scores.roundToInt(100 - Math.min(100, relativeError * 120)));
  }

  static List<String> buildTips(
      int pitch, int timing, int stability, String label, boolean tooShort, boolean lowSignal) {
    List<String> tips = new ArrayList<>();
    if (lowSignal) {
      tips.add(LOW_SIGNAL_TIP);
      return tips;
    }
    if (tooShort) {
      tips.add("Recording is very short. Try a longer take for better scoring.");
    }
    if (pitch < TIP_THRESHOLD) {
      tips.add(
          LABEL_TONE_MATCH.equals(label)
              ? "Tone match is off. Focus on resonance and dynamics to match the reference."
              : "Pitch accuracy needs tightening. Match the reference tone early in each line.");
    }
    if (timing < TIP_THRESHOLD) {
      tips.add("Timing is loose. Enter phrases right on the reference cue.");
    }
    if (stability < TIP_THRESHOLD) {
      tips.add("Stability could improve. Hold sustained notes steady.");
    }
    if (tips.isEmpty()) {
      tips.add("Great take. Try a fresh pass for even tighter timing.");
    }
    return tips;
  }

  private static boolean isPositive(Double value) {
    return value != null && value > 0;
  }
}
