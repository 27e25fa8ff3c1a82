package com.scholary.vocal.coach.feedback;

import com.scholary.vocal.coach.transcript.WordToken;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Partitions the reference timeline into segments that are scored independently.
 *
 * <p>Two construction paths:
 *
 * <ul>
 *   <li>By lyric line, when lines are known. Each segment spans its own words, falling back to the
 *       line's declared span when no word belongs to it.
 *   <li>By pauses otherwise. Consecutive words are bucketed up to {@value #MAX_SEGMENT_WORDS} per
 *       segment, flushing early on a gap longer than {@value #PAUSE_GAP_SEC}s or on a word ending a
 *       sentence.
 * </ul>
 *
 * <p>Either way, segments shorter than {@value #MIN_SEGMENT_SEC}s are merged backward into the
 * previous segment. Single-word segments make for noisy percentages.
 */
@Component
public class Segmenter {

  private static final Logger LOGGER = LoggerFactory.getLogger(Segmenter.class);

  static final int MAX_SEGMENT_WORDS = 10;
  static final double PAUSE_GAP_SEC = 0.9;
  static final double MIN_SEGMENT_SEC = 0.6;

  private static final Pattern SENTENCE_END = Pattern.compile("[.!?]$");

  /**
   * Segment by lyric line, or by pauses when there are no lines.
   *
   * @param lines reference lines (may be empty)
   * @param words reference words
   * @return merged segments, unscored
   */
  public List<SegmentFeedback> segment(List<ReferenceLine> lines, List<WordToken> words) {
    List<SegmentFeedback> raw = lines.isEmpty() ? fromWords(words) : fromLines(lines, words);
    return mergeShortSegments(raw);
  }

  List<SegmentFeedback> fromLines(List<ReferenceLine> lines, List<WordToken> words) {
    List<SegmentFeedback> segments = new ArrayList<>(lines.size());
    for (ReferenceLine line : lines) {
      List<WordToken> lineWords =
          words.stream().filter(w -> w.belongsToLine(line.index())).toList();

      String text = line.text().trim();
      if (text.isEmpty()) {
        text = lineWords.stream().map(WordToken::word).collect(Collectors.joining(" "));
      }
      double start = lineWords.isEmpty() ? line.start() : lineWords.get(0).start();
      double end = lineWords.isEmpty() ? line.end() : lineWords.get(lineWords.size() - 1).end();

      segments.add(SegmentFeedback.unscored(line.index(), text, start, end));
    }
    return segments;
  }

  List<SegmentFeedback> fromWords(List<WordToken> words) {
    List<SegmentFeedback> segments = new ArrayList<>();
    if (words.isEmpty()) {
      return segments;
    }

    List<WordToken> bucket = new ArrayList<>();
    bucket.add(words.get(0));
    for (int i = 1; i < words.size(); i++) {
      WordToken word = words.get(i);
      WordToken previous = words.get(i - 1);

      if (word.start() - previous.end() > PAUSE_GAP_SEC) {
        flush(bucket, segments);
        bucket.add(word);
        continue;
      }

      bucket.add(word);
      boolean endsSentence = SENTENCE_END.matcher(word.word()).find();
      if (bucket.size() >= MAX_SEGMENT_WORDS || endsSentence) {
        flush(bucket, segments);
      }
    }
    flush(bucket, segments);
    return segments;
  }

  /**
   * Merge every segment shorter than the minimum into its predecessor. The first segment is never
   * merged forward.
   */
  List<SegmentFeedback> mergeShortSegments(List<SegmentFeedback> segments) {
    if (segments.size() < 2) {
      return segments;
    }
    List<SegmentFeedback> merged = new ArrayList<>(segments.size());
    int mergeCount = 0;
    for (SegmentFeedback segment : segments) {
      if (!merged.isEmpty() && segment.duration() < MIN_SEGMENT_SEC) {
        int last = merged.size() - 1;
        merged.set(last, merged.get(last).absorb(segment));
        mergeCount++;
        continue;
      }
      merged.add(segment);
    }
    if (mergeCount > 0) {
      LOGGER.debug("Merged {} short segments, {} remain", mergeCount, merged.size());
    }
    return merged;
  }

  private static void flush(List<WordToken> bucket, List<SegmentFeedback> segments) {
    if (bucket.isEmpty()) {
      return;
    }
    String text = bucket.stream().map(WordToken::word).collect(Collectors.joining(" "));
    segments.add(
        SegmentFeedback.unscored(
            segments.size(), text, bucket.get(0).start(), bucket.get(bucket.size() - 1).end()));
    bucket.clear();
  }
}
