package com.scholary.vocal.coach.offset;

import java.util.List;

/**
 * Estimates the start offset between a reference and a recording from their energy envelopes.
 *
 * <p>Implementations must be stateless and never throw for empty envelopes.
 */
public interface OffsetEstimator {

  /**
   * Estimate the lag of the recording behind the reference.
   *
   * @param referenceEnvelope reference energy envelope, fixed step
   * @param recordingEnvelope recording energy envelope, same step
   * @return the estimate; {@link OffsetMethod#NONE} with offset 0 if nothing usable was found
   */
  OffsetEstimate estimate(List<Double> referenceEnvelope, List<Double> recordingEnvelope);
}
