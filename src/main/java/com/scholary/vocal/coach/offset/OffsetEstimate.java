package com.scholary.vocal.coach.offset;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Estimated lag of the recording behind the reference, in milliseconds. Positive means the singer
 * started late.
 *
 * @param correlation peak correlation, only set for {@link OffsetMethod#XCORR}
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record OffsetEstimate(double offsetMs, OffsetMethod method, Double correlation) {

  public static OffsetEstimate none() {
    return new OffsetEstimate(0.0, OffsetMethod.NONE, null);
  }

  public static OffsetEstimate provided(double offsetMs) {
    return new OffsetEstimate(offsetMs, OffsetMethod.PROVIDED, null);
  }
}
