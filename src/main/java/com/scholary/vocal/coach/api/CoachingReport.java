package com.scholary.vocal.coach.api;

import com.scholary.vocal.coach.feedback.DetailedFeedback;
import com.scholary.vocal.coach.offset.OffsetEstimate;
import com.scholary.vocal.coach.performance.PerformanceAnalysisResult;

/**
 * Combined word-level feedback and signal-level performance score for one attempt.
 *
 * @param offset the offset that was applied and where it came from
 */
public record CoachingReport(
    String attemptId,
    DetailedFeedback feedback,
    PerformanceAnalysisResult performance,
    OffsetEstimate offset) {}
