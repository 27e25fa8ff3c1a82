package com.scholary.vocal.coach.performance;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.List;

/**
 * Multi-metric score for one attempt. All scores are 0-100.
 *
 * @param label "Pitch Accuracy", or "Tone Match" for mostly unvoiced reference material
 * @param words the word score that went into the blend, null if none was supplied
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record PerformanceAnalysisResult(
    int overall,
    int pitch,
    int timing,
    int stability,
    Integer words,
    String label,
    List<String> tips,
    SignalAlignment alignment) {

  public PerformanceAnalysisResult {
    tips = List.copyOf(tips);
  }

  /** @param timingCorrelation envelope correlation clamped to [0, 1] */
  public record SignalAlignment(double timingCorrelation) {}
}
