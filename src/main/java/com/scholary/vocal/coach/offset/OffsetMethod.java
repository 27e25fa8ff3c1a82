package com.scholary.vocal.coach.offset;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * How an offset estimate was obtained. Informational only.
 */
public enum OffsetMethod {
  /** Peak of the normalized cross-correlation between the envelopes. */
  XCORR("xcorr"),
  /** Difference between the first loud bins of each envelope. */
  ONSET("onset"),
  /** Nothing usable; the offset is 0. */
  NONE("none"),
  /** Supplied by the caller. */
  PROVIDED("provided");

  private final String wireName;

  OffsetMethod(String wireName) {
    this.wireName = wireName;
  }

  @JsonValue
  public String wireName() {
    return wireName;
  }
}
