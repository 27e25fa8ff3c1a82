package com.scholary.vocal.coach.logging;

import org.slf4j.Logger;
import org.slf4j.MDC;

/**
 * Utility for structured logging with MDC (Mapped Diagnostic Context).
 *
 * <p>Each event puts {@code event_type} and its own fields into the MDC for the duration of one log
 * call. The console pattern in {@code logback-spring.xml} prints {@code attemptId} and {@code
 * event_type}; any MDC-aware appender sees the rest of the fields.
 */
public class StructuredLogger {

  private static final String ATTEMPT_ID = "attemptId";

  private final Logger logger;

  public StructuredLogger(Logger logger) {
    this.logger = logger;
  }

  /** Log alignment completed event. */
  public void logAlignmentCompleted(
      int referenceWords, int userWords, int matchedWords, int wordAccuracyPct) {
    try {
      MDC.put("event_type", "alignment_completed");
      MDC.put("referenceWords", String.valueOf(referenceWords));
      MDC.put("userWords", String.valueOf(userWords));
      MDC.put("matchedWords", String.valueOf(matchedWords));
      MDC.put("wordAccuracyPct", String.valueOf(wordAccuracyPct));

      logger.debug(
          "Alignment completed: reference={}, user={}, matched={}, accuracy={}%",
          referenceWords,
          userWords,
          matchedWords,
          wordAccuracyPct);
    } finally {
      clearEventFields();
    }
  }

  /** Log feedback built event. */
  public void logFeedbackBuilt(
      int segments, int wordAccuracyPct, int timingMeanAbsMs, String drill, boolean incomplete) {
    try {
      MDC.put("event_type", "feedback_built");
      MDC.put("segments", String.valueOf(segments));
      MDC.put("wordAccuracyPct", String.valueOf(wordAccuracyPct));
      MDC.put("timingMeanAbsMs", String.valueOf(timingMeanAbsMs));
      MDC.put("drill", drill);
      MDC.put("incomplete", String.valueOf(incomplete));

      logger.info(
          "Feedback built: segments={}, accuracy={}%, timing={}ms, drill={}, incomplete={}",
          segments,
          wordAccuracyPct,
          timingMeanAbsMs,
          drill,
          incomplete);
    } finally {
      clearEventFields();
    }
  }

  /** Log performance scored event. */
  public void logPerformanceScored(
      int overall, int pitch, int timing, int stability, String practiceMode) {
    try {
      MDC.put("event_type", "performance_scored");
      MDC.put("overall", String.valueOf(overall));
      MDC.put("pitch", String.valueOf(pitch));
      MDC.put("timing", String.valueOf(timing));
      MDC.put("stability", String.valueOf(stability));
      MDC.put("practiceMode", practiceMode);

      logger.info(
          "Performance scored: overall={}, pitch={}, timing={}, stability={}, mode={}",
          overall,
          pitch,
          timing,
          stability,
          practiceMode);
    } finally {
      clearEventFields();
    }
  }

  /** Log offset estimated event. */
  public void logOffsetEstimated(double offsetMs, String method) {
    try {
      MDC.put("event_type", "offset_estimated");
      MDC.put("offsetMs", String.valueOf(offsetMs));
      MDC.put("method", method);

      logger.debug("Offset estimated: offset={}ms, method={}", offsetMs, method);
    } finally {
      clearEventFields();
    }
  }

  /** Set attempt context in MDC. */
  public static void setAttemptContext(String attemptId) {
    MDC.put(ATTEMPT_ID, attemptId);
  }

  /** Clear attempt context from MDC. */
  public static void clearAttemptContext() {
    MDC.remove(ATTEMPT_ID);
  }

  /** Clear event-specific fields from MDC. */
  private void clearEventFields() {
    MDC.remove("event_type");
    MDC.remove("referenceWords");
    MDC.remove("userWords");
    MDC.remove("matchedWords");
    MDC.remove("wordAccuracyPct");
    MDC.remove("segments");
    MDC.remove("timingMeanAbsMs");
    MDC.remove("drill");
    MDC.remove("incomplete");
    MDC.remove("overall");
    MDC.remove("pitch");
    MDC.remove("timing");
    MDC.remove("stability");
    MDC.remove("practiceMode");
    MDC.remove("offsetMs");
    MDC.remove("method");
  }
}
