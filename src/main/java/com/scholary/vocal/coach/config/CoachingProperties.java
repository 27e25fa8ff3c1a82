package com.scholary.vocal.coach.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for attempt analysis.
 *
 * <p>Controls the early/late timing threshold, the size limit on alignment input and the search
 * window of the offset estimator.
 */
@ConfigurationProperties(prefix = "coaching")
@Validated
public record CoachingProperties(
    @Valid AlignmentProperties alignment, @Valid OffsetProperties offset) {

  public CoachingProperties {
    if (alignment == null) {
      alignment = new AlignmentProperties(null, null);
    }
    if (offset == null) {
      offset = new OffsetProperties(null, null);
    }
  }

  public record AlignmentProperties(
      @Positive Integer earlyLateThresholdMs, @Positive Long maxAlignmentCells) {

    public AlignmentProperties {
      if (earlyLateThresholdMs == null) {
        earlyLateThresholdMs = 200;
      }
      if (maxAlignmentCells == null) {
        maxAlignmentCells = 250_000L;
      }
    }
  }

  public record OffsetProperties(@Positive Double maxOffsetMs, @Positive Double stepMs) {

    public OffsetProperties {
      if (maxOffsetMs == null) {
        maxOffsetMs = 800.0;
      }
      if (stepMs == null) {
        stepMs = 50.0;
      }
    }
  }
}
