package com.scholary.vocal.coach.performance;

/**
 * One pitch-tracker frame. A frequency of 0 means unvoiced.
 */
public record PitchSample(double time, double frequency) {

  public boolean isVoiced() {
    return frequency > 0;
  }

  PitchSample unvoiced() {
    return new PitchSample(time, 0.0);
  }
}
