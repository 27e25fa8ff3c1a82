package com.scholary.vocal.coach.config;

import com.scholary.vocal.coach.alignment.WordAligner;
import com.scholary.vocal.coach.feedback.FeedbackBuilder;
import com.scholary.vocal.coach.feedback.Segmenter;
import com.scholary.vocal.coach.offset.CrossCorrelationOffsetEstimator;
import com.scholary.vocal.coach.offset.OffsetEstimator;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration for the analysis components that take tunables from {@link CoachingProperties}.
 */
@Configuration
@EnableConfigurationProperties(CoachingProperties.class)
public class CoachingConfig {

  @Bean
  public FeedbackBuilder feedbackBuilder(
      WordAligner wordAligner, Segmenter segmenter, CoachingProperties properties) {
    return new FeedbackBuilder(
        wordAligner, segmenter, properties.alignment().earlyLateThresholdMs());
  }

  @Bean
  public OffsetEstimator offsetEstimator(CoachingProperties properties) {
    return new CrossCorrelationOffsetEstimator(
        properties.offset().maxOffsetMs(), properties.offset().stepMs());
  }
}
