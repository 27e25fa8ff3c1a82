package com.scholary.vocal.coach.feedback;

import java.util.List;

/**
 * Localized feedback for one contiguous span of the reference timeline.
 *
 * @param segmentIndex line index, or running index for pause-delimited segments
 * @param text the reference text of the segment
 * @param start start time in seconds
 * @param end end time in seconds
 * @param wordAccuracyPct weighted word accuracy within the segment, 0-100
 * @param timingMeanAbsMs mean |deltaMs| over the segment's correct words
 * @param mainIssues short human-readable issues, never empty once scored
 */
public record SegmentFeedback(
    int segmentIndex,
    String text,
    double start,
    double end,
    int wordAccuracyPct,
    int timingMeanAbsMs,
    List<String> mainIssues) {

  public SegmentFeedback {
    mainIssues = List.copyOf(mainIssues);
  }

  static SegmentFeedback unscored(int segmentIndex, String text, double start, double end) {
    return new SegmentFeedback(segmentIndex, text, start, end, 0, 0, List.of());
  }

  public double duration() {
    return end - start;
  }

  /** Absorb a following segment: text is concatenated and the end extended. */
  SegmentFeedback absorb(SegmentFeedback next) {
    String merged = (text + " " + next.text()).trim();
    return new SegmentFeedback(
        segmentIndex,
        merged,
        start,
        Math.max(end, next.end()),
        wordAccuracyPct,
        timingMeanAbsMs,
        mainIssues);
  }

  SegmentFeedback withScores(int accuracyPct, int timingMs, List<String> issues) {
    return new SegmentFeedback(segmentIndex, text, start, end, accuracyPct, timingMs, issues);
  }
}
