package com.scholary.vocal.coach.feedback;

import com.scholary.vocal.coach.alignment.ConfidenceLabel;

/**
 * "You sang {@code userWord} instead of {@code refWord}".
 */
public record Substitution(
    String refWord, String userWord, Double confidence, ConfidenceLabel confidenceLabel) {}
